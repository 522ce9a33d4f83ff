package com.icora.intentmcp.engine;

/**
 * Receives every committed intent mutation. Called on the thread that performed the mutation,
 * after the store write and while the intent's lock is still held.
 */
@FunctionalInterface
public interface IntentLifecycleListener {
  void onTransition(IntentTransition transition);
}
