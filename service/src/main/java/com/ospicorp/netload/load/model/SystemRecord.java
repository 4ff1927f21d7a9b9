package com.ospicorp.netload.load.model;

import java.util.Objects;

/**
 * Snapshot of one metered system as seen by a prediction job.
 *
 * <p>A polarity of {@code 0} means "not set" and is applied as {@code +1}. A factor of
 * {@code 0} is applied as-is: it is a legitimate way to weigh a system out of the net load.
 */
public record SystemRecord(String sid, int polarity, double factor) {

  public SystemRecord {
    Objects.requireNonNull(sid, "sid");
    if (polarity < -1 || polarity > 1) {
      throw new IllegalArgumentException("polarity must be -1, 0 or 1 for system " + sid);
    }
    if (Double.isNaN(factor) || Double.isInfinite(factor)) {
      throw new IllegalArgumentException("factor must be finite for system " + sid);
    }
  }

  public int effectivePolarity() {
    return polarity == 0 ? 1 : polarity;
  }

  public boolean hasPolaritySet() {
    return polarity != 0;
  }
}
