package com.icora.intentmcp.engine;

import com.icora.intentmcp.backend.BackendClient;
import com.icora.intentmcp.backend.BackendResult;
import com.icora.intentmcp.backend.BackendState;
import com.icora.intentmcp.exception.BackendRejectedException;
import com.icora.intentmcp.exception.BackendUnavailableException;
import com.icora.intentmcp.exception.ExceptionUtil;
import com.icora.intentmcp.exception.StateException;
import com.icora.intentmcp.exception.ValidationException;
import com.icora.intentmcp.logging.LoggingService;
import com.icora.intentmcp.model.Intent;
import com.icora.intentmcp.model.IntentFilter;
import com.icora.intentmcp.model.IntentState;
import com.icora.intentmcp.model.IntentUpdate;
import com.icora.intentmcp.store.IntentStore;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.function.Supplier;
import org.slf4j.MDC;

/**
 * The intent state machine.
 *
 * <p>Every mutating operation runs under the intent's lock from {@link IntentLockManager}: load
 * the record, look the event up in the {@link TransitionTable}, call the backend if needed, write
 * the new record, notify listeners. Backend calls run on a dedicated executor and are bounded by
 * {@link EngineSettings#backendTimeout()}, so a hung backend never pins the lock indefinitely.
 *
 * <p>Reads ({@link #get}, {@link #list}) take no lock; records are immutable so they always see a
 * whole record, either before or after an in-flight transition.
 */
public class IntentLifecycleEngine implements AutoCloseable {
  private static final org.slf4j.Logger log =
      com.icora.intentmcp.logging.LoggingService.getLogger(IntentLifecycleEngine.class);

  public static final String ID_PREFIX = "intent-";

  /** Backend calls waiting for a worker, per worker, before new calls are turned away. */
  private static final int QUEUED_CALLS_PER_THREAD = 4;

  private final IntentStore store;
  private final BackendClient backend;
  private final EngineSettings settings;
  private final Clock clock;
  private final TransitionTable table = TransitionTable.standard();
  private final IntentLockManager locks;
  private final List<IntentLifecycleListener> listeners = new CopyOnWriteArrayList<>();
  private final ExecutorService backendExecutor;

  public IntentLifecycleEngine(
      IntentStore store, BackendClient backend, EngineSettings settings, Clock clock) {
    this.store = Objects.requireNonNull(store, "store");
    this.backend = Objects.requireNonNull(backend, "backend");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.locks = new IntentLockManager(settings.lockTimeout());
    int threads = settings.backendThreads();
    ThreadPoolExecutor pool =
        new ThreadPoolExecutor(
            threads,
            threads,
            60L,
            TimeUnit.SECONDS,
            new LinkedBlockingQueue<>(threads * QUEUED_CALLS_PER_THREAD),
            new BackendThreadFactory());
    pool.allowCoreThreadTimeOut(true);
    this.backendExecutor = pool;
  }

  public void addListener(IntentLifecycleListener listener) {
    listeners.add(Objects.requireNonNull(listener, "listener"));
  }

  public TransitionTable transitionTable() {
    return table;
  }

  // ---------------------------------------------------------------------------------------------
  // Reads
  // ---------------------------------------------------------------------------------------------

  public Intent get(String id) {
    return store.get(id);
  }

  public List<Intent> list(IntentFilter filter) {
    return store.list(filter == null ? IntentFilter.all() : filter);
  }

  public int count() {
    return store.size();
  }

  /** Backend health check, bounded like any other backend call. */
  public boolean backendReachable() {
    Future<Boolean> ping;
    try {
      ping = backendExecutor.submit(backend::ping);
    } catch (RejectedExecutionException e) {
      return false;
    }
    try {
      return ping.get(settings.backendTimeout().toMillis(), TimeUnit.MILLISECONDS);
    } catch (InterruptedException e) {
      ping.cancel(true);
      Thread.currentThread().interrupt();
      return false;
    } catch (ExecutionException | TimeoutException e) {
      ping.cancel(true);
      log.debug("Backend health check did not succeed: {}", e.toString());
      return false;
    }
  }

  // ---------------------------------------------------------------------------------------------
  // Mutations
  // ---------------------------------------------------------------------------------------------

  /** New {@link IntentState#DRAFT} intent. Nothing is sent to the backend. */
  public Intent create(String name, String description, Map<String, Object> specification) {
    String trimmedName = requireName(name);
    requireSpecification(specification);

    Instant now = clock.instant();
    Intent intent =
        Intent.builder()
            .id(ID_PREFIX + UUID.randomUUID())
            .name(trimmedName)
            .description(description == null ? "" : description)
            .specification(specification)
            .state(IntentState.DRAFT)
            .createdAt(now)
            .updatedAt(now)
            .build();
    store.insert(intent);
    publish(intent.id(), LifecycleEvent.CREATE, null, intent);
    return intent;
  }

  /** Replace the supplied fields of a draft. */
  public Intent update(String id, IntentUpdate update) {
    if (update == null || update.isEmpty()) {
      throw new ValidationException(
          "update_intent needs at least one of name, description or specification",
          Map.of("id", id));
    }
    String newName = update.name() == null ? null : requireName(update.name());
    if (update.specification() != null) {
      requireSpecification(update.specification());
    }

    try (MDC.MDCCloseable ctx = LoggingService.intentContext(id);
        IntentLockManager.Lease ignored = locks.acquire(id)) {
      Intent current = store.get(id);
      Transition t = table.require(current, LifecycleEvent.UPDATE);
      return commit(
          current,
          t,
          b -> {
            if (newName != null) b.name(newName);
            if (update.description() != null) b.description(update.description());
            if (update.specification() != null) b.specification(update.specification());
            b.lastError(null);
          });
    }
  }

  /**
   * Submit a draft to the backend.
   *
   * <ul>
   *   <li>Accepted: Submitted with the backend reference, then confirmed against the backend when
   *       {@link EngineSettings#confirmOnSubmit()} is set.
   *   <li>Rejected: Failed, then {@link BackendRejectedException}.
   *   <li>Unavailable or unknown: stays Draft with {@code lastError}, then {@link
   *       BackendUnavailableException}. When the backend may have acted on the request the draft
   *       is marked {@link Intent#submissionPending()} and refuses update and delete until a
   *       later submit settles it. Submitting again is safe, the intent id is the idempotency key.
   * </ul>
   */
  public Intent submit(String id) {
    try (MDC.MDCCloseable ctx = LoggingService.intentContext(id);
        IntentLockManager.Lease ignored = locks.acquire(id)) {
      Intent current = store.get(id);
      Transition submit = table.require(current, LifecycleEvent.SUBMIT);
      BackendResult result =
          callBackend("submit", id, () -> backend.submit(current), BackendResult.Kind.UNKNOWN);

      switch (result.kind()) {
        case ACCEPTED:
          {
            Intent submitted =
                commit(
                    current,
                    submit,
                    b ->
                        b.backendReference(result.reference())
                            .lastError(null)
                            .submissionPending(false));
            if (!settings.confirmOnSubmit()) {
              return submitted;
            }
            BackendResult status =
                result.state() == BackendState.ACTIVE
                    ? result
                    : callBackend(
                        "fetchStatus",
                        id,
                        () -> backend.fetchStatus(result.reference()),
                        BackendResult.Kind.UNAVAILABLE);
            return reconcile(submitted, status);
          }
        case REJECTED:
          {
            Transition reject = follow(submit, LifecycleEvent.REJECT);
            String reason = "Backend rejected the submission: " + result.reason();
            commit(current, reject, b -> b.lastError(reason).submissionPending(false));
            throw new BackendRejectedException(reason, backendContext(id, result));
          }
        default:
          {
            String reason =
                "Submission did not complete (%s): %s"
                    .formatted(kindLabel(result), result.reason());
            boolean pending = current.submissionPending() || result.isInconclusive();
            recordFailure(current, LifecycleEvent.SUBMIT, reason, pending);
            Map<String, Object> details = backendContext(id, result);
            details.put("submissionPending", pending);
            throw new BackendUnavailableException(reason, details);
          }
      }
    }
  }

  /**
   * Cancel an active intent. The intent ends Terminated whatever the backend answers; a failed
   * cancellation is kept in {@code lastError}.
   */
  public Intent terminate(String id) {
    try (MDC.MDCCloseable ctx = LoggingService.intentContext(id);
        IntentLockManager.Lease ignored = locks.acquire(id)) {
      Intent current = store.get(id);
      Transition t = table.require(current, LifecycleEvent.TERMINATE);
      String cancelError = cancelQuietly(current);
      return commit(current, t, b -> b.lastError(cancelError));
    }
  }

  /**
   * Remove a Draft, Failed or Terminated intent. Nothing is sent to the backend, so intents the
   * backend may still be running (Submitted, Active, or a draft with a pending submission) are
   * refused and have to be settled first.
   */
  public void delete(String id) {
    try (MDC.MDCCloseable ctx = LoggingService.intentContext(id);
        IntentLockManager.Lease ignored = locks.acquire(id)) {
      Intent current = store.get(id);
      table.require(current, LifecycleEvent.DELETE);
      store.delete(id);
      publish(id, LifecycleEvent.DELETE, current.state(), current, null);
    }
  }

  /**
   * Ask the backend for the current status and adopt it when it diverges from the local record.
   * A failed intent that never got a backend reference has nothing to reconcile and is returned
   * as is.
   */
  public Intent checkStatus(String id) {
    try (MDC.MDCCloseable ctx = LoggingService.intentContext(id);
        IntentLockManager.Lease ignored = locks.acquire(id)) {
      Intent current = store.get(id);
      table.require(current, LifecycleEvent.QUERY);
      if (!current.hasBackendReference()) {
        return current;
      }
      BackendResult status =
          callBackend(
              "fetchStatus",
              id,
              () -> backend.fetchStatus(current.backendReference()),
              BackendResult.Kind.UNAVAILABLE);
      return reconcile(current, status);
    }
  }

  // ---------------------------------------------------------------------------------------------
  // Internals; everything below runs with the intent lock held.
  // ---------------------------------------------------------------------------------------------

  private Intent reconcile(Intent current, BackendResult status) {
    LifecycleEvent event;
    String error = null;
    switch (status.kind()) {
      case ACCEPTED:
        switch (status.state()) {
          case ACTIVE:
            event = LifecycleEvent.CONFIRM_ACTIVE;
            break;
          case PENDING:
            event = LifecycleEvent.BACKEND_PENDING;
            break;
          case TERMINATED:
            event = LifecycleEvent.BACKEND_TERMINATED;
            break;
          case FAILED:
            event = LifecycleEvent.REJECT;
            error = "Backend reports the intent as failed";
            break;
          default:
            event = LifecycleEvent.BACKEND_UNAVAILABLE;
            error = "Backend reported an unrecognized status";
            break;
        }
        break;
      case REJECTED:
        if (status.httpStatus() == 404) {
          event = LifecycleEvent.REJECT;
          error = status.reason();
        } else {
          event = LifecycleEvent.BACKEND_UNAVAILABLE;
          error = "Status check refused: " + status.reason();
        }
        break;
      default:
        event = LifecycleEvent.BACKEND_UNAVAILABLE;
        error =
            "Status check did not complete (%s): %s"
                .formatted(kindLabel(status), status.reason());
        break;
    }

    Transition t = table.require(current, event);
    String lastError = error;
    if (t.to() == current.state() && Objects.equals(lastError, current.lastError())) {
      return current;
    }
    if (t.changesState()) {
      log.info(
          "Reconciled intent {} from {} to {} (backend {})",
          current.id(),
          current.state(),
          t.to(),
          status);
    }
    return commit(current, t, b -> b.lastError(lastError));
  }

  private Transition follow(Transition prior, LifecycleEvent event) {
    return table
        .find(prior.to(), event)
        .orElseThrow(
            () -> new IllegalStateException("No " + event + " transition after " + prior));
  }

  /** Returns the cancellation failure to record, or null when the backend confirmed it. */
  private String cancelQuietly(Intent current) {
    if (!current.hasBackendReference()) {
      return null;
    }
    BackendResult cancel =
        callBackend(
            "cancel",
            current.id(),
            () -> backend.cancel(current.backendReference()),
            BackendResult.Kind.UNKNOWN);
    if (cancel.isAccepted()) {
      return null;
    }
    log.warn(
        "Backend cancel of {} for {} failed: {}",
        current.backendReference(),
        current.id(),
        cancel);
    return "Backend cancel failed (%s): %s".formatted(kindLabel(cancel), cancel.reason());
  }

  private Intent recordFailure(
      Intent current, LifecycleEvent event, String reason, boolean submissionPending) {
    Intent next =
        current.toBuilder()
            .lastError(reason)
            .submissionPending(submissionPending)
            .updatedAt(nextTimestamp(current.updatedAt()))
            .build();
    store.put(next);
    publish(current.id(), event, current.state(), next);
    return next;
  }

  private Intent commit(Intent current, Transition t, Consumer<Intent.Builder> changes) {
    Intent.Builder b = current.toBuilder();
    changes.accept(b);
    Intent next = b.state(t.to()).updatedAt(nextTimestamp(current.updatedAt())).build();
    store.put(next);
    publish(current.id(), t.event(), current.state(), next);
    return next;
  }

  /** Strictly after {@code previous}, even when the clock has not moved. */
  private Instant nextTimestamp(Instant previous) {
    Instant now = clock.instant();
    return now.isAfter(previous) ? now : previous.plusNanos(1);
  }

  private BackendResult callBackend(
      String operation,
      String intentId,
      Supplier<BackendResult> call,
      BackendResult.Kind onTimeout) {
    Future<BackendResult> future;
    try {
      future = backendExecutor.submit(call::get);
    } catch (RejectedExecutionException e) {
      if (backendExecutor.isShutdown()) {
        throw new StateException("Lifecycle engine is shut down", e);
      }
      log.warn("Backend {} for {} refused, all backend workers are busy", operation, intentId);
      return BackendResult.notSent("Too many backend calls in flight, " + operation + " not sent");
    }
    long timeoutMs = settings.backendTimeout().toMillis();
    try {
      return future.get(timeoutMs, TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      future.cancel(true);
      log.warn("Backend {} for {} exceeded {} ms, cancelled", operation, intentId, timeoutMs);
      return timedOut(
          onTimeout, "Backend %s timed out after %d ms".formatted(operation, timeoutMs));
    } catch (InterruptedException e) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      return timedOut(onTimeout, "Interrupted while waiting for backend " + operation);
    } catch (ExecutionException e) {
      Throwable cause = ExceptionUtil.rootCause(e);
      log.error("Backend {} for {} failed unexpectedly", operation, intentId, cause);
      String detail =
          Optional.ofNullable(cause.getMessage()).orElse(cause.getClass().getSimpleName());
      return BackendResult.unknown("Backend %s failed: %s".formatted(operation, detail), 0);
    }
  }

  private static BackendResult timedOut(BackendResult.Kind kind, String reason) {
    return kind == BackendResult.Kind.UNKNOWN
        ? BackendResult.unknown(reason, 0)
        : BackendResult.unavailable(reason, 0);
  }

  private void publish(String id, LifecycleEvent event, IntentState from, Intent after) {
    publish(id, event, from, after, after.state());
  }

  private void publish(
      String id, LifecycleEvent event, IntentState from, Intent after, IntentState to) {
    IntentTransition transition =
        new IntentTransition(
            id,
            event,
            from,
            to,
            after.backendReference(),
            after.lastError(),
            event == LifecycleEvent.DELETE ? clock.instant() : after.updatedAt());
    for (IntentLifecycleListener listener : listeners) {
      try {
        listener.onTransition(transition);
      } catch (RuntimeException e) {
        log.warn("Lifecycle listener {} failed on {}", listener, transition, e);
      }
    }
  }

  private static Map<String, Object> backendContext(String id, BackendResult result) {
    Map<String, Object> ctx = new LinkedHashMap<>();
    ctx.put("id", id);
    ctx.put("outcome", kindLabel(result));
    if (result.httpStatus() > 0) {
      ctx.put("httpStatus", result.httpStatus());
    }
    return ctx;
  }

  private static String kindLabel(BackendResult result) {
    String name = result.kind().name();
    return name.charAt(0) + name.substring(1).toLowerCase(java.util.Locale.ROOT);
  }

  private static String requireName(String name) {
    if (name == null || name.isBlank()) {
      throw new ValidationException("Intent name must not be blank");
    }
    return name.trim();
  }

  private static void requireSpecification(Map<String, Object> specification) {
    if (specification == null || specification.isEmpty()) {
      throw new ValidationException("Intent specification must be a non-empty object");
    }
  }

  @Override
  public void close() {
    backendExecutor.shutdownNow();
  }

  private static final class BackendThreadFactory implements ThreadFactory {
    private final AtomicInteger counter = new AtomicInteger();

    @Override
    public Thread newThread(Runnable r) {
      Thread t = new Thread(r, "intent-backend-" + counter.incrementAndGet());
      t.setDaemon(true);
      return t;
    }
  }
}
