package com.icora.intentmcp.store;

import com.icora.intentmcp.exception.NotFoundException;
import com.icora.intentmcp.model.Intent;
import com.icora.intentmcp.model.IntentFilter;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Persistence seam for intent records.
 *
 * <p>Each operation is atomic with respect to a single record and readers never see a partially
 * written record. Implementations do not serialize same-id writers themselves: the lifecycle
 * engine holds the per-intent lock around every read-modify-write.
 */
public interface IntentStore {

  /** Store a new record. Fails if the id is in use or was used before. */
  void insert(Intent intent);

  /** Replace an existing record. Fails with {@link NotFoundException} if absent. */
  void put(Intent intent);

  Optional<Intent> find(String id);

  default Intent get(String id) {
    return find(id)
        .orElseThrow(
            () -> new NotFoundException("Intent '%s' not found".formatted(id), Map.of("id", id)));
  }

  /** Snapshot of the records matching the filter, oldest first. */
  List<Intent> list(IntentFilter filter);

  /** Physically remove a record and retire its id. */
  void delete(String id);

  int size();
}
