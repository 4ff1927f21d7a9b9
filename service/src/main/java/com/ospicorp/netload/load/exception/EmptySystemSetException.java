package com.ospicorp.netload.load.exception;

/** The job exists but has no member systems. Not retryable. */
public class EmptySystemSetException extends LoadDataException {
  public static final int ERROR_CODE = 2002;

  private final long jobId;

  public EmptySystemSetException(long jobId) {
    super("No systems found for prediction job " + jobId, ERROR_CODE);
    this.jobId = jobId;
  }

  public long jobId() {
    return jobId;
  }
}
