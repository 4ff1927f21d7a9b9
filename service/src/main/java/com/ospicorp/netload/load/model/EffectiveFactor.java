package com.ospicorp.netload.load.model;

/**
 * The single multiplier applied to a group of systems. Systems sharing one can be summed
 * before scaling without changing the result.
 */
public record EffectiveFactor(double value) implements Comparable<EffectiveFactor> {

  public EffectiveFactor {
    // -0.0 and 0.0 must land in the same group
    value = value == 0d ? 0d : value;
  }

  public static EffectiveFactor of(SystemRecord system) {
    return new EffectiveFactor(system.effectivePolarity() * system.factor());
  }

  public static EffectiveFactor polarityOnly(SystemRecord system) {
    return new EffectiveFactor(system.effectivePolarity());
  }

  public double apply(double load) {
    return load * value;
  }

  @Override
  public int compareTo(EffectiveFactor other) {
    return Double.compare(value, other.value);
  }

  @Override
  public String toString() {
    return Double.toString(value);
  }
}
