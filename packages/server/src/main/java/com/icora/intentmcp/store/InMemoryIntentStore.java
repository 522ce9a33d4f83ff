package com.icora.intentmcp.store;

import com.icora.intentmcp.exception.NotFoundException;
import com.icora.intentmcp.exception.StateException;
import com.icora.intentmcp.model.Intent;
import com.icora.intentmcp.model.IntentFilter;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/** Map-backed store. Records are immutable, so handing out references is safe. */
public class InMemoryIntentStore implements IntentStore {
  private static final org.slf4j.Logger log =
      com.icora.intentmcp.logging.LoggingService.getLogger(InMemoryIntentStore.class);

  private static final Comparator<Intent> CREATION_ORDER =
      Comparator.comparing(Intent::createdAt).thenComparing(Intent::id);

  private final Map<String, Intent> memory = new ConcurrentHashMap<>();
  private final Set<String> retiredIds = ConcurrentHashMap.newKeySet();

  @Override
  public void insert(Intent intent) {
    if (retiredIds.contains(intent.id())) {
      throw new StateException("Intent id '%s' was already used".formatted(intent.id()));
    }
    if (memory.putIfAbsent(intent.id(), intent) != null) {
      throw new StateException("Intent id '%s' already exists".formatted(intent.id()));
    }
    log.trace("IntentStore: insert {}", intent);
    afterMutation();
  }

  @Override
  public void put(Intent intent) {
    Intent previous = memory.computeIfPresent(intent.id(), (k, v) -> intent);
    if (previous == null) {
      throw new NotFoundException(
          "Intent '%s' not found".formatted(intent.id()), Map.of("id", intent.id()));
    }
    log.trace("IntentStore: put {}", intent);
    afterMutation();
  }

  @Override
  public Optional<Intent> find(String id) {
    try {
      return id == null ? Optional.empty() : Optional.ofNullable(memory.get(id));
    } finally {
      log.trace("IntentStore: get {}", id);
    }
  }

  @Override
  public List<Intent> list(IntentFilter filter) {
    IntentFilter criteria = filter == null ? IntentFilter.all() : filter;
    try {
      return memory.values().stream().filter(criteria).sorted(CREATION_ORDER).toList();
    } finally {
      log.trace("IntentStore: list states={} name~{}", criteria.states(), criteria.nameContains());
    }
  }

  @Override
  public void delete(String id) {
    if (memory.remove(id) == null) {
      throw new NotFoundException("Intent '%s' not found".formatted(id), Map.of("id", id));
    }
    retiredIds.add(id);
    log.trace("IntentStore: delete {}", id);
    afterMutation();
  }

  @Override
  public int size() {
    return memory.size();
  }

  /** Hook for subclasses that persist the content after every change. */
  protected void afterMutation() {}

  protected Collection<Intent> records() {
    return memory.values();
  }

  protected Set<String> retiredIds() {
    return retiredIds;
  }

  /** Seed the store from persisted content, bypassing the insert checks. */
  protected void restore(Collection<Intent> intents, Collection<String> retired) {
    intents.forEach(i -> memory.put(i.id(), i));
    retiredIds.addAll(retired);
  }
}
