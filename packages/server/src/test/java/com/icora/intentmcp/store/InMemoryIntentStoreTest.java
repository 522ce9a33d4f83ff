package com.icora.intentmcp.store;

import static org.junit.jupiter.api.Assertions.*;

import com.icora.intentmcp.exception.NotFoundException;
import com.icora.intentmcp.exception.StateException;
import com.icora.intentmcp.model.Intent;
import com.icora.intentmcp.model.IntentFilter;
import com.icora.intentmcp.model.IntentState;
import com.icora.intentmcp.testing.Intents;
import java.util.EnumSet;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("InMemoryIntentStore")
class InMemoryIntentStoreTest {

  private InMemoryIntentStore store;

  @BeforeEach
  void setUp() {
    store = new InMemoryIntentStore();
  }

  @Test
  void insertThenGetReturnsSameRecord() {
    Intent draft = Intents.draft("intent-1", "4K Broadcast");
    store.insert(draft);

    assertEquals(draft, store.get("intent-1"));
    assertEquals(1, store.size());
  }

  @Test
  void insertRejectsExistingId() {
    store.insert(Intents.draft("intent-1", "a"));
    assertThrows(StateException.class, () -> store.insert(Intents.draft("intent-1", "b")));
    assertEquals("a", store.get("intent-1").name());
  }

  @Test
  void putRequiresExistingRecord() {
    assertThrows(NotFoundException.class, () -> store.put(Intents.draft("intent-404", "x")));
    assertEquals(0, store.size());
  }

  @Test
  void putReplacesWholeRecord() {
    store.insert(Intents.draft("intent-1", "a"));
    Intent changed = store.get("intent-1").toBuilder().name("b").build();
    store.put(changed);
    assertEquals("b", store.get("intent-1").name());
  }

  @Test
  @DisplayName("deleted ids are retired and cannot be reused")
  void deleteRetiresId() {
    store.insert(Intents.draft("intent-1", "a"));
    store.delete("intent-1");

    assertTrue(store.find("intent-1").isEmpty());
    assertThrows(NotFoundException.class, () -> store.get("intent-1"));
    assertThrows(NotFoundException.class, () -> store.delete("intent-1"));
    assertThrows(StateException.class, () -> store.insert(Intents.draft("intent-1", "again")));
  }

  @Test
  void findWithNullIdIsEmpty() {
    assertTrue(store.find(null).isEmpty());
  }

  @Test
  void listFiltersByStateAndNameAndOrdersByCreation() {
    Intent older = Intents.draft("intent-b", "4K Broadcast north");
    Intent newer =
        Intents.draft("intent-a", "4K Broadcast south")
            .toBuilder()
            .createdAt(Intents.T0.plusSeconds(10))
            .updatedAt(Intents.T0.plusSeconds(10))
            .build();
    Intent active = Intents.inState("intent-c", IntentState.ACTIVE, "ref-c");
    store.insert(newer);
    store.insert(older);
    store.insert(active);

    List<Intent> drafts = store.list(IntentFilter.byState(IntentState.DRAFT));
    assertEquals(List.of("intent-b", "intent-a"), drafts.stream().map(Intent::id).toList());

    List<Intent> south = store.list(IntentFilter.of(null, "SOUTH"));
    assertEquals(1, south.size());
    assertEquals("intent-a", south.get(0).id());

    List<Intent> activeOrDraft =
        store.list(IntentFilter.of(EnumSet.of(IntentState.ACTIVE, IntentState.DRAFT), null));
    assertEquals(3, activeOrDraft.size());

    assertEquals(3, store.list(null).size());
  }
}
