package com.ospicorp.netload.load.model;

import com.ospicorp.netload.load.exception.InvalidTimeRangeException;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;

/**
 * Requested range, aligned to the resolution grid. Both bounds are inclusive bucket starts.
 */
public record TimeWindow(Instant start, Instant end, Resolution resolution) {

  public TimeWindow {
    if (start == null || end == null || resolution == null) {
      throw new InvalidTimeRangeException("start, end and resolution must be provided");
    }
    if (start.isAfter(end)) {
      throw new InvalidTimeRangeException("start " + start + " is after end " + end);
    }
  }

  /** Validates caller input and floors both bounds to the resolution grid. */
  public static TimeWindow of(Instant start, Instant end, Resolution resolution) {
    if (start == null || end == null) {
      throw new InvalidTimeRangeException("start and end must be provided");
    }
    if (!start.isBefore(end)) {
      throw new InvalidTimeRangeException("start " + start + " must be before end " + end);
    }
    if (resolution == null) {
      throw new InvalidTimeRangeException("resolution must be provided");
    }
    try {
      return new TimeWindow(resolution.floor(start), resolution.floor(end), resolution);
    } catch (DateTimeException ex) {
      throw new InvalidTimeRangeException("[" + start + ", " + end + "] cannot be aligned to "
          + resolution, ex);
    }
  }

  public boolean contains(Instant instant) {
    return !instant.isBefore(start) && !instant.isAfter(end);
  }

  /** Exclusive stop covering the last bucket of the window. */
  public Instant exclusiveStop() {
    return endPlus(resolution.duration());
  }

  /** End shifted forward; fails with {@link InvalidTimeRangeException} past the last instant. */
  public Instant endPlus(Duration offset) {
    try {
      return end.plus(offset);
    } catch (DateTimeException | ArithmeticException ex) {
      throw new InvalidTimeRangeException("end " + end + " cannot be extended by " + offset, ex);
    }
  }

  @Override
  public String toString() {
    return "[" + start + ", " + end + "] @ " + resolution;
  }
}
