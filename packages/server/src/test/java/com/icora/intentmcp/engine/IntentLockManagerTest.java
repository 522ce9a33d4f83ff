package com.icora.intentmcp.engine;

import static org.junit.jupiter.api.Assertions.*;

import com.icora.intentmcp.exception.ConflictException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class IntentLockManagerTest {

  private final IntentLockManager locks = new IntentLockManager(Duration.ofMillis(50));

  @Test
  void secondHolderTimesOutWithConflict() throws Exception {
    try (IntentLockManager.Lease ignored = locks.acquire("intent-1")) {
      CompletableFuture<Throwable> other =
          CompletableFuture.supplyAsync(
              () -> {
                try (IntentLockManager.Lease lease = locks.acquire("intent-1")) {
                  return null;
                } catch (ConflictException e) {
                  return e;
                }
              });
      Throwable failure = other.get(5, TimeUnit.SECONDS);
      assertInstanceOf(ConflictException.class, failure);
      assertEquals(
          "intent-1", ((ConflictException) failure).getContext().get("id"));
    }
    assertEquals(0, locks.activeEntries());
  }

  @Test
  void differentIdsDoNotBlockEachOther() throws Exception {
    try (IntentLockManager.Lease ignored = locks.acquire("intent-1")) {
      Boolean acquired =
          CompletableFuture.supplyAsync(
                  () -> {
                    try (IntentLockManager.Lease lease = locks.acquire("intent-2")) {
                      return true;
                    }
                  })
              .get(5, TimeUnit.SECONDS);
      assertTrue(acquired);
    }
  }

  @Test
  void entriesAreDroppedAfterRelease() {
    IntentLockManager.Lease lease = locks.acquire("intent-1");
    assertEquals(1, locks.activeEntries());
    lease.close();
    assertEquals(0, locks.activeEntries());

    try (IntentLockManager.Lease again = locks.acquire("intent-1")) {
      assertEquals(1, locks.activeEntries());
    }
  }
}
