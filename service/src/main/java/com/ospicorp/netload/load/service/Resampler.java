package com.ospicorp.netload.load.service;

import com.ospicorp.netload.load.model.Resolution;
import com.ospicorp.netload.load.model.TimeSeriesTable;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

public final class Resampler {
  private Resampler() {
  }

  /** Averages every column per bucket; each bucket is labelled by its start. */
  public static TimeSeriesTable meanPerBucket(TimeSeriesTable in, Resolution resolution) {
    Map<String, Map<Instant, Double>> out = new LinkedHashMap<>();
    for (String column : in.columns()) {
      Map<Instant, double[]> buckets = new TreeMap<>();
      for (var e : in.column(column).entrySet()) {
        double[] acc = buckets.computeIfAbsent(resolution.floor(e.getKey()), k -> new double[2]);
        acc[0] += e.getValue();
        acc[1]++;
      }
      Map<Instant, Double> means = new TreeMap<>();
      buckets.forEach((bucket, acc) -> means.put(bucket, acc[0] / acc[1]));
      out.put(column, means);
    }
    return TimeSeriesTable.ofColumns(out);
  }
}
