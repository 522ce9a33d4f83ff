package com.icora.intentmcp.exception;

/** Configuration or environment related problem detected at startup or runtime. */
public class ConfigException extends IntentMcpException {
  public ConfigException(String message) {
    super(IntentMcpErrorCode.CONFIGURATION_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(IntentMcpErrorCode.CONFIGURATION_ERROR, message, cause);
  }
}
