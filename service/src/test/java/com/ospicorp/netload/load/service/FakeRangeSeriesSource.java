package com.ospicorp.netload.load.service;

import com.ospicorp.netload.load.model.AggregationFunction;
import com.ospicorp.netload.load.model.Resolution;
import com.ospicorp.netload.load.model.TimeSeriesTable;
import com.ospicorp.netload.load.source.RangeSeriesSource;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * In-memory store. Aggregated answers are labelled {@code labelLag} buckets after the bucket
 * start and open with {@code labelLag} rows that precede the requested start, like the
 * mean-then-sum window query of the real store.
 */
class FakeRangeSeriesSource implements RangeSeriesSource {

  record Call(String kind, List<String> keys, Instant start, Instant stop,
      AggregationFunction function) {}

  private final Map<String, NavigableMap<Instant, Double>> samples = new LinkedHashMap<>();
  private final int labelLag;
  final List<Call> calls = new ArrayList<>();

  FakeRangeSeriesSource() {
    this(2);
  }

  FakeRangeSeriesSource(int labelLag) {
    this.labelLag = labelLag;
  }

  FakeRangeSeriesSource add(String sid, Instant timestamp, double value) {
    samples.computeIfAbsent(sid, k -> new TreeMap<>()).put(timestamp, value);
    return this;
  }

  FakeRangeSeriesSource addSeries(String sid, Instant first, Duration step, double... values) {
    for (int i = 0; i < values.length; i++) {
      add(sid, first.plus(step.multipliedBy(i)), values[i]);
    }
    return this;
  }

  @Override
  public TimeSeriesTable queryRaw(List<String> seriesKeys, Instant start, Instant stop,
      Resolution resolution) {
    calls.add(new Call("raw", List.copyOf(seriesKeys), start, stop, null));
    TimeSeriesTable.Builder builder = TimeSeriesTable.builder();
    for (String key : seriesKeys) {
      samplesIn(key, start, stop).forEach((t, v) -> builder.put(t, key, v));
    }
    return builder.build();
  }

  @Override
  public TimeSeriesTable queryAggregated(List<String> seriesKeys, Instant start, Instant stop,
      Resolution resolution, AggregationFunction function) {
    calls.add(new Call("aggregated", List.copyOf(seriesKeys), start, stop, function));
    boolean anyData = seriesKeys.stream().anyMatch(k -> !samplesIn(k, start, stop).isEmpty());
    if (!anyData) {
      return TimeSeriesTable.empty();
    }
    Duration width = resolution.duration();
    Duration lag = resolution.times(labelLag);
    TimeSeriesTable.Builder builder = TimeSeriesTable.builder(function.columnName());
    for (Instant label = start; !label.isAfter(stop); label = label.plus(width)) {
      Instant bucket = label.minus(lag);
      Instant from = bucket.isBefore(start) ? start : bucket;
      Instant to = bucket.plus(width).isAfter(stop) ? stop : bucket.plus(width);
      List<Double> means = new ArrayList<>();
      for (String key : seriesKeys) {
        if (!from.isBefore(to)) {
          continue;
        }
        NavigableMap<Instant, Double> inBucket = samplesIn(key, from, to);
        if (!inBucket.isEmpty()) {
          means.add(inBucket.values().stream().mapToDouble(Double::doubleValue).average()
              .orElseThrow());
        }
      }
      builder.put(label, function.columnName(), combine(means, function));
    }
    return builder.build();
  }

  private NavigableMap<Instant, Double> samplesIn(String key, Instant from, Instant to) {
    NavigableMap<Instant, Double> series = samples.get(key);
    if (series == null) {
      return new TreeMap<>();
    }
    return series.subMap(from, true, to, false);
  }

  private static Double combine(List<Double> means, AggregationFunction function) {
    if (means.isEmpty()) {
      return null;
    }
    return switch (function) {
      case SUM -> means.stream().mapToDouble(Double::doubleValue).sum();
      case COUNT -> (double) means.size();
      case MEAN -> means.stream().mapToDouble(Double::doubleValue).average().orElseThrow();
    };
  }
}
