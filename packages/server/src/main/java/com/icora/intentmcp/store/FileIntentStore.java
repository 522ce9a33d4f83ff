package com.icora.intentmcp.store;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.icora.intentmcp.exception.IoException;
import com.icora.intentmcp.model.Intent;
import com.icora.intentmcp.utility.JacksonUtility;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;

/**
 * In-memory store that mirrors its content into a JSON snapshot file.
 *
 * <p>The snapshot is rewritten after every mutation: content goes to a sibling temp file which
 * then atomically replaces the target, so a crash never leaves a truncated snapshot behind. The
 * snapshot is loaded once at construction when the file exists.
 */
public class FileIntentStore extends InMemoryIntentStore {
  private static final org.slf4j.Logger log =
      com.icora.intentmcp.logging.LoggingService.getLogger(FileIntentStore.class);

  private final Path file;
  private final Object writeLock = new Object();

  public FileIntentStore(Path file) {
    this.file = Objects.requireNonNull(file, "file").toAbsolutePath();
    load();
  }

  public Path file() {
    return file;
  }

  private void load() {
    if (!Files.isRegularFile(file)) {
      log.info("No intent snapshot at {}, starting empty", file);
      return;
    }
    try (var in = Files.newBufferedReader(file)) {
      Snapshot snapshot = JacksonUtility.getJsonMapper().readValue(in, Snapshot.class);
      restore(snapshot.intents, snapshot.retiredIds);
      log.info("Loaded {} intents from {}", snapshot.intents.size(), file);
    } catch (IOException e) {
      throw new IoException("Failed to load intent snapshot from " + file, e);
    }
  }

  @Override
  protected void afterMutation() {
    synchronized (writeLock) {
      Snapshot snapshot =
          new Snapshot(new ArrayList<>(records()), new ArrayList<>(new TreeSet<>(retiredIds())));
      try {
        Path parent = file.getParent();
        if (parent != null) {
          Files.createDirectories(parent);
        }
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        try (var out = Files.newBufferedWriter(tmp)) {
          JacksonUtility.getJsonMapper().writeValue(out, snapshot);
        }
        Files.move(
            tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        log.debug("Saved {} intents to {}", snapshot.intents.size(), file);
      } catch (IOException e) {
        throw new IoException("Failed to persist intent snapshot to " + file, e);
      }
    }
  }

  static final class Snapshot {
    @JsonProperty("intents")
    final List<Intent> intents;

    @JsonProperty("retiredIds")
    final List<String> retiredIds;

    @JsonCreator
    Snapshot(
        @JsonProperty("intents") List<Intent> intents,
        @JsonProperty("retiredIds") List<String> retiredIds) {
      this.intents = intents == null ? List.of() : intents;
      this.retiredIds = retiredIds == null ? List.of() : retiredIds;
    }
  }
}
