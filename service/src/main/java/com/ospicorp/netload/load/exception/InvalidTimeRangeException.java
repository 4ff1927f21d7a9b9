package com.ospicorp.netload.load.exception;

public class InvalidTimeRangeException extends InvalidParameterException {
  public static final int ERROR_CODE = 1003;

  public InvalidTimeRangeException(String message) {
    super(message, ERROR_CODE);
  }

  public InvalidTimeRangeException(String message, Throwable cause) {
    super(message, ERROR_CODE, cause);
  }
}
