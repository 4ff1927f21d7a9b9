package com.ospicorp.netload.load.repository;

import com.ospicorp.netload.load.exception.EmptySystemSetException;
import com.ospicorp.netload.load.exception.JobNotFoundException;
import com.ospicorp.netload.load.exception.UpstreamUnavailableException;
import com.ospicorp.netload.load.model.SystemRecord;
import java.util.List;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class JdbcSystemCatalog implements SystemCatalog {
  private final PredictionJobRepository jobs;
  private final JdbcTemplate jdbc;

  public JdbcSystemCatalog(PredictionJobRepository jobs, JdbcTemplate jdbc) {
    this.jobs = jobs;
    this.jdbc = jdbc;
  }

  @Override
  public List<SystemRecord> getSystemsForJob(long jobId) {
    String sql = """
      SELECT s.sid, s.polarity, ps.factor
      FROM systems s
      INNER JOIN predictions_systems ps ON ps.system_id = s.sid
      WHERE ps.prediction_id = ?
      ORDER BY s.sid
    """;
    List<SystemRecord> systems;
    try {
      if (!jobs.existsById(jobId)) {
        throw new JobNotFoundException(jobId);
      }
      systems = jdbc.query(sql, (rs, i) -> new SystemRecord(rs.getString(1), rs.getInt(2),
                                                             rs.getDouble(3)),
                           jobId);
    } catch (DataAccessException ex) {
      throw new UpstreamUnavailableException(
          "Could not load systems for prediction job " + jobId, ex);
    }
    if (systems.isEmpty()) {
      throw new EmptySystemSetException(jobId);
    }
    return systems;
  }
}
