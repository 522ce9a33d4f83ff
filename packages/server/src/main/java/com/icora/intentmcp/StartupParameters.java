package com.icora.intentmcp;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Command line of the server. Options are {@code --name value} pairs; bare words are ignored.
 *
 * <pre>
 *   --mode server|mock-backend     default server
 *   --config-file &lt;location&gt;      default classpath:application.yaml
 * </pre>
 *
 * In {@code server} mode the MCP endpoint is exposed, together with the embedded mock backend when
 * {@code backend.mock.enabled} is set. {@code mock-backend} runs the mock TMF921 API alone.
 */
public final class StartupParameters {
  public static final String MODE_SERVER = "server";
  public static final String MODE_MOCK_BACKEND = "mock-backend";

  static final String OPT_MODE = "mode";
  static final String OPT_CONFIG_FILE = "config-file";

  private static final List<String> MODES = List.of(MODE_SERVER, MODE_MOCK_BACKEND);
  private static final String DEFAULT_CONFIG = "classpath:application.yaml";

  private final Map<String, String> given;

  public StartupParameters(String[] arguments) {
    Map<String, String> options = new LinkedHashMap<>();
    int i = 0;
    while (i < arguments.length) {
      String arg = arguments[i++];
      if (!arg.startsWith("--")) {
        continue;
      }
      String name = arg.substring(2);
      if (i >= arguments.length || arguments[i].startsWith("--")) {
        throw new IllegalArgumentException("Option --" + name + " needs a value");
      }
      options.put(name, arguments[i++]);
    }
    this.given = Collections.unmodifiableMap(options);

    String mode = mode();
    if (!MODES.contains(mode)) {
      throw new IllegalArgumentException(
          "Unsupported --mode '%s', expected one of %s".formatted(mode, MODES));
    }
    if (configFile().isBlank()) {
      throw new IllegalArgumentException("--config-file must not be blank");
    }
  }

  public String mode() {
    return given.getOrDefault(OPT_MODE, MODE_SERVER);
  }

  /** Location of the YAML configuration, in any form {@link ConfigurationProvider} accepts. */
  public String configFile() {
    return given.getOrDefault(OPT_CONFIG_FILE, DEFAULT_CONFIG);
  }

  /** Whether {@code --name} was given on the command line. */
  public boolean isParameterPresent(String name) {
    return given.containsKey(name);
  }
}
