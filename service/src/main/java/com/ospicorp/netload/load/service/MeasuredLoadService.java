package com.ospicorp.netload.load.service;

import com.ospicorp.netload.load.exception.InvalidParameterException;
import com.ospicorp.netload.load.model.AggregationFunction;
import com.ospicorp.netload.load.model.Resolution;
import com.ospicorp.netload.load.model.TimeSeriesTable;
import com.ospicorp.netload.load.model.TimeWindow;
import com.ospicorp.netload.load.source.RangeSeriesSource;
import java.time.Instant;
import java.util.List;
import java.util.NavigableMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Unscaled load for an explicit list of system ids, summed across systems by the store.
 */
@Service
public class MeasuredLoadService {

  public static final String LOAD_COLUMN = "load";
  public static final String ENTRIES_COLUMN = "nEntries";

  private static final Logger log = LoggerFactory.getLogger(MeasuredLoadService.class);

  private final RangeSeriesSource seriesSource;
  private final WindowedQueryCorrector corrector;

  public MeasuredLoadService(RangeSeriesSource seriesSource, WindowedQueryCorrector corrector) {
    this.seriesSource = seriesSource;
    this.corrector = corrector;
  }

  /**
   * Returns a {@code load} column with the per-bucket sum of the systems' means and, when
   * requested, an {@code nEntries} column with the number of systems that reported. With
   * {@code averageOutput} the load is divided by that count.
   */
  public TimeSeriesTable getLoad(List<String> sids, Instant start, Instant end,
      Resolution resolution, boolean averageOutput, boolean includeEntryCount) {
    if (sids == null || sids.isEmpty()) {
      throw new InvalidParameterException("At least one system id must be provided", 1008);
    }
    TimeWindow window = TimeWindow.of(start, end, resolution);
    List<String> keys = sids.stream().distinct().toList();

    NavigableMap<Instant, Double> sums = corrector
        .fetch(seriesSource, keys, window, AggregationFunction.SUM)
        .column(AggregationFunction.SUM.columnName());
    if (sums.isEmpty()) {
      log.warn("Probably no load data available for system(s) {} in {}", keys, window);
      return TimeSeriesTable.empty();
    }

    NavigableMap<Instant, Double> counts = (averageOutput || includeEntryCount)
        ? corrector.fetch(seriesSource, keys, window, AggregationFunction.COUNT)
            .column(AggregationFunction.COUNT.columnName())
        : null;

    TimeSeriesTable.Builder builder = TimeSeriesTable.builder(LOAD_COLUMN);
    if (includeEntryCount) {
      builder.column(ENTRIES_COLUMN);
    }
    sums.forEach((timestamp, sum) -> {
      Double count = counts == null ? null : counts.get(timestamp);
      if (averageOutput) {
        if (count == null || count == 0d) {
          return;
        }
        builder.put(timestamp, LOAD_COLUMN, sum / count);
      } else {
        builder.put(timestamp, LOAD_COLUMN, sum);
      }
      if (includeEntryCount) {
        builder.put(timestamp, ENTRIES_COLUMN, count);
      }
    });
    return builder.build();
  }
}
