package com.ospicorp.netload.load.exception;

public class JobNotFoundException extends LoadDataException {
  public static final int ERROR_CODE = 2001;

  private final long jobId;

  public JobNotFoundException(long jobId) {
    super("Prediction job not found: " + jobId, ERROR_CODE);
    this.jobId = jobId;
  }

  public long jobId() {
    return jobId;
  }
}
