package com.ospicorp.netload.load.service;

import com.ospicorp.netload.load.model.EffectiveFactor;
import com.ospicorp.netload.load.model.SystemRecord;
import java.util.ArrayList;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

public final class EffectiveFactorGrouper {
  private EffectiveFactorGrouper() {
  }

  /**
   * Partitions systems by {@code polarity * factor}, with an unset polarity counted as +1.
   * Groups iterate in ascending factor order; members keep their input order.
   */
  public static SortedMap<EffectiveFactor, List<SystemRecord>> groupByEffectiveFactor(
      List<SystemRecord> systems) {
    SortedMap<EffectiveFactor, List<SystemRecord>> groups = new TreeMap<>();
    for (SystemRecord system : systems) {
      groups.computeIfAbsent(EffectiveFactor.of(system), k -> new ArrayList<>()).add(system);
    }
    return groups;
  }
}
