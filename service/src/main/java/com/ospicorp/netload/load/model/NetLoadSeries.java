package com.ospicorp.netload.load.model;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Single-column net load of a prediction job. An empty series means no system delivered
 * data; it is never zero-filled.
 */
public final class NetLoadSeries {

  public static final String COLUMN = "load";

  private static final NetLoadSeries EMPTY = new NetLoadSeries(new TreeMap<>());

  private final NavigableMap<Instant, Double> values;

  private NetLoadSeries(NavigableMap<Instant, Double> values) {
    this.values = Collections.unmodifiableNavigableMap(values);
  }

  public static NetLoadSeries empty() {
    return EMPTY;
  }

  public static NetLoadSeries of(Map<Instant, Double> values) {
    if (values.isEmpty()) {
      return EMPTY;
    }
    return new NetLoadSeries(new TreeMap<>(values));
  }

  public NavigableMap<Instant, Double> values() {
    return values;
  }

  public Double get(Instant timestamp) {
    return values.get(timestamp);
  }

  public boolean isEmpty() {
    return values.isEmpty();
  }

  public int size() {
    return values.size();
  }

  public List<LoadPoint> points() {
    return values.entrySet().stream()
        .map(e -> new LoadPoint(e.getKey(), e.getValue()))
        .toList();
  }

  @Override
  public boolean equals(Object o) {
    return this == o || (o instanceof NetLoadSeries other && values.equals(other.values));
  }

  @Override
  public int hashCode() {
    return values.hashCode();
  }

  @Override
  public String toString() {
    return "NetLoadSeries" + values;
  }
}
