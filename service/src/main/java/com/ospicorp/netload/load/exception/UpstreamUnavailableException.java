package com.ospicorp.netload.load.exception;

/**
 * A collaborator (measurement store or metadata database) could not be reached or failed
 * while answering. Retries are left to the caller.
 */
public class UpstreamUnavailableException extends LoadDataException {
  public static final int ERROR_CODE = 3001;

  public UpstreamUnavailableException(String message, Throwable cause) {
    super(message, ERROR_CODE, cause);
  }
}
