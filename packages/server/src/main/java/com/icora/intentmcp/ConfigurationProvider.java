package com.icora.intentmcp;

import com.icora.intentmcp.exception.ConfigException;
import com.icora.intentmcp.exception.SerializationException;
import com.icora.intentmcp.logging.LoggingService;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.net.URI;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.YAMLConfiguration;
import org.apache.commons.configuration2.builder.FileBasedConfigurationBuilder;
import org.apache.commons.configuration2.builder.fluent.Parameters;
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.apache.commons.configuration2.interpol.Lookup;
import org.slf4j.Logger;

/**
 * Reads the server configuration from YAML into a Commons Configuration tree.
 *
 * <p>{@code location} is one of {@code classpath:<resource>}, a {@code file:} URI, or a plain
 * path. A missing classpath resource gives an empty configuration, so every component runs on its
 * defaults; a missing file is a {@link ConfigException}.
 *
 * <p>Secrets are written as {@code ${env:NAME}}. NAME is looked up in the process environment
 * first, then in a {@code .env.local} file next to the working directory.
 */
public final class ConfigurationProvider {
  private static final Logger log = LoggingService.getLogger(ConfigurationProvider.class);

  private static final String CLASSPATH_PREFIX = "classpath:";
  private static final String DEFAULT_RESOURCE = "application.yaml";
  private static final List<Path> DOTENV_CANDIDATES =
      List.of(Path.of(".env.local"), Path.of("packages", "server", ".env.local"));

  private final Configuration configuration;

  public ConfigurationProvider(String location) {
    YAMLConfiguration yaml = read(location == null ? "" : location.trim());
    yaml.getInterpolator().registerLookup("env", new EnvLookup(DOTENV_CANDIDATES));
    this.configuration = yaml;
  }

  public Configuration config() {
    return configuration;
  }

  private static YAMLConfiguration read(String location) {
    if (location.isEmpty()) {
      return fromClasspath(DEFAULT_RESOURCE);
    }
    if (location.startsWith(CLASSPATH_PREFIX)) {
      return fromClasspath(location.substring(CLASSPATH_PREFIX.length()));
    }
    if (location.regionMatches(true, 0, "file:", 0, 5)) {
      try {
        return fromFile(Path.of(URI.create(location)));
      } catch (IllegalArgumentException e) {
        throw new ConfigException("Malformed configuration URI: " + location, e);
      }
    }
    return fromFile(Path.of(location));
  }

  private static YAMLConfiguration fromClasspath(String resource) {
    URL url = Thread.currentThread().getContextClassLoader().getResource(resource);
    if (url == null) {
      log.warn("No {} on the classpath, running on defaults", resource);
      return new YAMLConfiguration();
    }
    log.info("Configuration: classpath:{}", resource);
    YAMLConfiguration yaml = new YAMLConfiguration();
    try (InputStream in = url.openStream();
        Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
      yaml.read(reader);
      return yaml;
    } catch (IOException | ConfigurationException e) {
      throw new SerializationException("Unreadable YAML in classpath:" + resource, e);
    }
  }

  private static YAMLConfiguration fromFile(Path path) {
    if (!Files.isRegularFile(path)) {
      throw new ConfigException("Configuration file not found: " + path.toAbsolutePath());
    }
    log.info("Configuration: {}", path.toAbsolutePath());
    try {
      return new FileBasedConfigurationBuilder<>(YAMLConfiguration.class)
          .configure(new Parameters().fileBased().setFile(path.toFile()))
          .getConfiguration();
    } catch (ConfigurationException e) {
      throw new ConfigException("Could not load configuration file " + path, e);
    }
  }

  /** {@code env:} lookup backed by the process environment and a dotenv file. */
  static final class EnvLookup implements Lookup {
    private final List<Path> candidates;
    private Map<String, String> dotenv;

    EnvLookup(List<Path> candidates) {
      this.candidates = candidates;
    }

    @Override
    public Object lookup(String name) {
      String value = System.getenv(name);
      if (value != null && !value.isEmpty()) {
        return value;
      }
      return dotenv().get(name);
    }

    private synchronized Map<String, String> dotenv() {
      if (dotenv == null) {
        dotenv =
            candidates.stream()
                .filter(Files::isRegularFile)
                .findFirst()
                .map(EnvLookup::parse)
                .orElseGet(Map::of);
      }
      return dotenv;
    }

    static Map<String, String> parse(Path file) {
      Map<String, String> values = new LinkedHashMap<>();
      List<String> lines;
      try {
        lines = Files.readAllLines(file, StandardCharsets.UTF_8);
      } catch (IOException e) {
        log.warn("Ignoring unreadable {}", file, e);
        return values;
      }
      log.info("Reading secrets fallback from {}", file.toAbsolutePath());
      for (String raw : lines) {
        String line = raw.strip();
        int eq = line.indexOf('=');
        if (line.startsWith("#") || eq <= 0) {
          continue;
        }
        values.put(line.substring(0, eq).strip(), unquote(line.substring(eq + 1).strip()));
      }
      return values;
    }

    private static String unquote(String v) {
      boolean quoted =
          v.length() >= 2
              && (v.charAt(0) == '"' || v.charAt(0) == '\'')
              && v.charAt(v.length() - 1) == v.charAt(0);
      return quoted ? v.substring(1, v.length() - 1) : v;
    }
  }
}
