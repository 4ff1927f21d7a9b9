package com.ospicorp.netload.load.repository;

import com.ospicorp.netload.load.model.SystemRecord;
import java.util.List;

public interface SystemCatalog {

  /**
   * Resolves the member systems of a prediction job.
   *
   * @throws com.ospicorp.netload.load.exception.JobNotFoundException if the job is unknown
   * @throws com.ospicorp.netload.load.exception.EmptySystemSetException if it has no systems
   * @throws com.ospicorp.netload.load.exception.UpstreamUnavailableException on database failure
   */
  List<SystemRecord> getSystemsForJob(long jobId);
}
