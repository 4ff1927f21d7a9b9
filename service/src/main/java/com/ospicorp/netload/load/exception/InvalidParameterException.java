package com.ospicorp.netload.load.exception;

public class InvalidParameterException extends LoadDataException {

  public InvalidParameterException(String message, int errorCode) {
    super(message, errorCode);
  }

  public InvalidParameterException(String message, int errorCode, Throwable cause) {
    super(message, errorCode, cause);
  }
}
