package com.ospicorp.netload.load.exception;

/**
 * Base of every failure raised while resolving or aggregating load. Each subclass has a stable
 * error code that is reported to API clients together with a documentation link.
 */
public abstract class LoadDataException extends RuntimeException {
  static final String ERROR_DOCS_BASE = "https://developers.company.com/docs/errors/";

  private final int errorCode;

  protected LoadDataException(String message, int errorCode) {
    super(message);
    this.errorCode = errorCode;
  }

  protected LoadDataException(String message, int errorCode, Throwable cause) {
    super(message, cause);
    this.errorCode = errorCode;
  }

  public int errorCode() {
    return errorCode;
  }

  public String moreInfo() {
    return ERROR_DOCS_BASE + errorCode;
  }
}
