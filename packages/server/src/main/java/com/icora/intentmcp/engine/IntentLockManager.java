package com.icora.intentmcp.engine;

import com.icora.intentmcp.exception.ConflictException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-intent exclusive locks. Entries are reference counted and dropped once no thread holds or
 * waits for them, so the map only ever contains ids with in-flight transitions.
 */
public final class IntentLockManager {
  private static final class Entry {
    final ReentrantLock lock = new ReentrantLock();
    int references;
  }

  private final Map<String, Entry> locks = new ConcurrentHashMap<>();
  private final Duration timeout;

  public IntentLockManager(Duration timeout) {
    this.timeout = timeout;
  }

  /**
   * Acquire the lock for {@code intentId}, waiting at most the configured timeout.
   *
   * @throws ConflictException when another transition on the same id holds the lock for longer
   */
  public Lease acquire(String intentId) {
    Entry entry =
        locks.compute(
            intentId,
            (id, existing) -> {
              Entry e = existing == null ? new Entry() : existing;
              e.references++;
              return e;
            });
    boolean locked = false;
    try {
      locked = entry.lock.tryLock(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    if (!locked) {
      release(intentId);
      throw new ConflictException(
          "Another operation on intent '%s' is in progress".formatted(intentId),
          Map.of("id", intentId, "lockTimeoutMs", timeout.toMillis()));
    }
    return new Lease(intentId, entry);
  }

  /** Number of ids with a held or awaited lock. */
  int activeEntries() {
    return locks.size();
  }

  private void release(String intentId) {
    locks.computeIfPresent(
        intentId,
        (id, e) -> {
          e.references--;
          return e.references <= 0 ? null : e;
        });
  }

  /** Held lock; closing it unlocks and releases the entry. */
  public final class Lease implements AutoCloseable {
    private final String intentId;
    private final Entry entry;
    private boolean closed;

    private Lease(String intentId, Entry entry) {
      this.intentId = intentId;
      this.entry = entry;
    }

    @Override
    public void close() {
      if (closed) return;
      closed = true;
      entry.lock.unlock();
      release(intentId);
    }
  }
}
