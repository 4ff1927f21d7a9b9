package com.ospicorp.netload.load.model;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.NavigableSet;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * Time-indexed table of named numeric columns, as returned by a range query.
 *
 * <p>Timestamps are unique and ordered. A cell may be absent or {@code null} when a column had
 * no sample at that timestamp; {@link #dropEmptyRows()} removes rows without any value so that
 * gaps are represented by missing rows. Instances are immutable.
 */
public final class TimeSeriesTable {

  private static final TimeSeriesTable EMPTY = new TimeSeriesTable(List.of(), new TreeMap<>());

  private final List<String> columns;
  private final NavigableMap<Instant, Map<String, Double>> rows;

  private TimeSeriesTable(List<String> columns, NavigableMap<Instant, Map<String, Double>> rows) {
    this.columns = List.copyOf(columns);
    this.rows = Collections.unmodifiableNavigableMap(rows);
  }

  public static TimeSeriesTable empty() {
    return EMPTY;
  }

  public static Builder builder(String... columns) {
    Builder builder = new Builder();
    for (String column : columns) {
      builder.column(column);
    }
    return builder;
  }

  public static TimeSeriesTable ofColumns(Map<String, ? extends Map<Instant, Double>> columns) {
    Builder builder = new Builder();
    columns.forEach((name, values) -> {
      builder.column(name);
      values.forEach((timestamp, value) -> builder.put(timestamp, name, value));
    });
    return builder.build();
  }

  public List<String> columns() {
    return columns;
  }

  public boolean hasColumn(String column) {
    return columns.contains(column);
  }

  public NavigableSet<Instant> timestamps() {
    return rows.navigableKeySet();
  }

  public int rowCount() {
    return rows.size();
  }

  public boolean isEmpty() {
    return rows.isEmpty();
  }

  /** Returns the cell value, or {@code null} when the column has no sample there. */
  public Double value(Instant timestamp, String column) {
    Map<String, Double> row = rows.get(timestamp);
    return row == null ? null : row.get(column);
  }

  /** Non-null samples of one column. */
  public NavigableMap<Instant, Double> column(String column) {
    NavigableMap<Instant, Double> out = new TreeMap<>();
    rows.forEach((timestamp, row) -> {
      Double value = row.get(column);
      if (value != null) {
        out.put(timestamp, value);
      }
    });
    return out;
  }

  public TimeSeriesTable shift(Duration offset) {
    NavigableMap<Instant, Map<String, Double>> shifted = new TreeMap<>();
    rows.forEach((timestamp, row) -> shifted.put(timestamp.plus(offset), row));
    return new TimeSeriesTable(columns, shifted);
  }

  public TimeSeriesTable dropFirst(int count) {
    if (count < 0) {
      throw new IllegalArgumentException("count must not be negative");
    }
    NavigableMap<Instant, Map<String, Double>> kept = new TreeMap<>(rows);
    Iterator<Instant> it = kept.navigableKeySet().iterator();
    for (int i = 0; i < count && it.hasNext(); i++) {
      it.next();
      it.remove();
    }
    return new TimeSeriesTable(columns, kept);
  }

  public TimeSeriesTable dropEmptyRows() {
    NavigableMap<Instant, Map<String, Double>> kept = new TreeMap<>();
    rows.forEach((timestamp, row) -> {
      if (row.values().stream().anyMatch(Objects::nonNull)) {
        kept.put(timestamp, row);
      }
    });
    return new TimeSeriesTable(columns, kept);
  }

  /** Rows with {@code from <= timestamp <= to}. */
  public TimeSeriesTable between(Instant from, Instant to) {
    if (from.isAfter(to)) {
      return new TimeSeriesTable(columns, new TreeMap<>());
    }
    return new TimeSeriesTable(columns, new TreeMap<>(rows.subMap(from, true, to, true)));
  }

  public TimeSeriesTable select(Collection<String> selected) {
    List<String> kept = columns.stream().filter(selected::contains).toList();
    Set<String> keptSet = new LinkedHashSet<>(kept);
    NavigableMap<Instant, Map<String, Double>> out = new TreeMap<>();
    rows.forEach((timestamp, row) -> {
      Map<String, Double> narrowed = new LinkedHashMap<>();
      row.forEach((column, value) -> {
        if (keptSet.contains(column)) {
          narrowed.put(column, value);
        }
      });
      if (!narrowed.isEmpty()) {
        out.put(timestamp, Collections.unmodifiableMap(narrowed));
      }
    });
    return new TimeSeriesTable(kept, out);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof TimeSeriesTable other)) {
      return false;
    }
    return columns.equals(other.columns) && rows.equals(other.rows);
  }

  @Override
  public int hashCode() {
    return Objects.hash(columns, rows);
  }

  @Override
  public String toString() {
    return "TimeSeriesTable" + columns + " rows=" + rows.size();
  }

  public static final class Builder {
    private final Set<String> columns = new LinkedHashSet<>();
    private final NavigableMap<Instant, Map<String, Double>> rows = new TreeMap<>();

    private Builder() {
    }

    public Builder column(String column) {
      columns.add(Objects.requireNonNull(column, "column"));
      return this;
    }

    /** Adds a cell; a {@code null} value registers the row without a sample. */
    public Builder put(Instant timestamp, String column, Double value) {
      Objects.requireNonNull(timestamp, "timestamp");
      column(column);
      rows.computeIfAbsent(timestamp, t -> new LinkedHashMap<>()).put(column, value);
      return this;
    }

    public TimeSeriesTable build() {
      NavigableMap<Instant, Map<String, Double>> frozen = new TreeMap<>();
      rows.forEach((timestamp, row) ->
          frozen.put(timestamp, Collections.unmodifiableMap(new LinkedHashMap<>(row))));
      return new TimeSeriesTable(new ArrayList<>(columns), frozen);
    }
  }
}
