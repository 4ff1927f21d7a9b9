package com.ospicorp.netload.load.exception;

public class InvalidResolutionException extends InvalidParameterException {
  public static final int ERROR_CODE = 1002;

  public InvalidResolutionException(String message) {
    super(message, ERROR_CODE);
  }

  public InvalidResolutionException(String message, Throwable cause) {
    super(message, ERROR_CODE, cause);
  }
}
