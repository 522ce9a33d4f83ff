package com.icora.intentmcp.store;

import com.icora.intentmcp.exception.ConfigException;
import java.nio.file.Path;
import org.apache.commons.configuration2.Configuration;

/** Builds the {@link IntentStore} named by {@code store.type}: "memory" (default) or "file". */
public final class IntentStoreFactory {
  private IntentStoreFactory() {}

  public static IntentStore create(Configuration cfg) {
    String type = cfg.getString("store.type", "memory").trim().toLowerCase();
    switch (type) {
      case "memory":
        return new InMemoryIntentStore();
      case "file":
        String path = cfg.getString("store.file.path", "data/intents.json");
        if (path == null || path.isBlank()) {
          throw new ConfigException("store.file.path must be set when store.type is 'file'");
        }
        return new FileIntentStore(Path.of(path.trim()));
      default:
        throw new ConfigException("Unsupported store.type: " + type);
    }
  }
}
