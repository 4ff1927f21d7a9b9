package com.ospicorp.netload.load.service;

import com.ospicorp.netload.load.model.AggregationFunction;
import com.ospicorp.netload.load.model.TimeSeriesTable;
import com.ospicorp.netload.load.model.TimeWindow;
import com.ospicorp.netload.load.source.RangeSeriesSource;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Realigns aggregated range queries to bucket starts.
 *
 * <p>The store labels every aggregation stage with the bucket's closing edge, so a
 * mean-then-sum query lags by {@code shiftPeriods} buckets. The query is widened by that many
 * buckets, the answer is shifted back by the same amount, and the leading rows that now fall
 * before the requested start are dropped. The steps only work in exactly this order.
 *
 * <p>The number of periods depends on the store and the query shape, hence configurable.
 */
@Component
public class WindowedQueryCorrector {

  private static final Logger log = LoggerFactory.getLogger(WindowedQueryCorrector.class);

  private final int shiftPeriods;

  public WindowedQueryCorrector(
      @Value("${load.aggregation.boundary-shift-periods:2}") int shiftPeriods) {
    if (shiftPeriods < 0) {
      throw new IllegalArgumentException("boundary shift periods must not be negative");
    }
    this.shiftPeriods = shiftPeriods;
  }

  public int shiftPeriods() {
    return shiftPeriods;
  }

  /** Widens, fetches, shifts and trims one aggregated query. */
  public TimeSeriesTable fetch(RangeSeriesSource source, List<String> seriesKeys,
      TimeWindow window, AggregationFunction function) {
    Instant stop = widenedStop(window);
    log.debug("Aggregated {} query for {} series over [{}, {})", function, seriesKeys.size(),
        window.start(), stop);
    TimeSeriesTable answer = source.queryAggregated(seriesKeys, window.start(), stop,
        window.resolution(), function);
    return correct(answer, window);
  }

  Instant widenedStop(TimeWindow window) {
    return window.endPlus(window.resolution().times(shiftPeriods));
  }

  TimeSeriesTable correct(TimeSeriesTable answer, TimeWindow window) {
    if (answer.isEmpty()) {
      return answer;
    }
    Duration lag = window.resolution().times(shiftPeriods);
    return answer.shift(lag.negated())
        .dropFirst(shiftPeriods)
        .dropEmptyRows()
        .between(window.start(), window.end());
  }
}
