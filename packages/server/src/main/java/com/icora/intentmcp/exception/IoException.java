package com.icora.intentmcp.exception;

/** I/O operation failed (filesystem, classpath, network streams). */
public class IoException extends IntentMcpException {
  public IoException(String message) {
    super(IntentMcpErrorCode.IO_ERROR, message);
  }

  public IoException(String message, Throwable cause) {
    super(IntentMcpErrorCode.IO_ERROR, message, cause);
  }
}
