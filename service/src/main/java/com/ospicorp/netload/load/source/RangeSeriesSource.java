package com.ospicorp.netload.load.source;

import com.ospicorp.netload.load.model.AggregationFunction;
import com.ospicorp.netload.load.model.Resolution;
import com.ospicorp.netload.load.model.TimeSeriesTable;
import java.time.Instant;
import java.util.List;

/**
 * Range queries against the measurement store. Both calls cover {@code [start, stop)} and
 * block until the store answers; transport failures surface as
 * {@link com.ospicorp.netload.load.exception.UpstreamUnavailableException}.
 */
public interface RangeSeriesSource {

  /**
   * Returns the samples of every requested key as one column per key. Keys without any
   * sample in the range have no column.
   */
  TimeSeriesTable queryRaw(List<String> seriesKeys, Instant start, Instant stop,
      Resolution resolution);

  /**
   * Averages every key per bucket, then combines the per-key means with {@code function} into
   * a single column named {@link AggregationFunction#columnName()}.
   *
   * <p>Buckets are labelled by their right (closing) edge, once per aggregation stage, so the
   * result lags the bucket starts. See
   * {@link com.ospicorp.netload.load.service.WindowedQueryCorrector}.
   */
  TimeSeriesTable queryAggregated(List<String> seriesKeys, Instant start, Instant stop,
      Resolution resolution, AggregationFunction function);
}
