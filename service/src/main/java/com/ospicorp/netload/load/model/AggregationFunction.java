package com.ospicorp.netload.load.model;

import java.util.Locale;

/** Cross-series aggregation applied by an aggregated range query. */
public enum AggregationFunction {
  MEAN,
  SUM,
  COUNT;

  public String columnName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
