package com.ospicorp.netload.load.service;

import com.ospicorp.netload.load.model.EffectiveFactor;
import com.ospicorp.netload.load.model.SystemGroup;
import com.ospicorp.netload.load.model.SystemRecord;
import java.util.List;

/**
 * Decides which systems are fetched and scaled together. Grouping one system per group is the
 * direct computation; grouping by effective factor lets the store sum members before scaling.
 */
@FunctionalInterface
public interface GroupingStrategy {

  List<SystemGroup> group(List<SystemRecord> systems);

  static GroupingStrategy perSystem(boolean ignoreFactor) {
    return systems -> systems.stream()
        .map(system -> new SystemGroup(
            ignoreFactor ? EffectiveFactor.polarityOnly(system) : EffectiveFactor.of(system),
            List.of(system)))
        .toList();
  }

  static GroupingStrategy byEffectiveFactor() {
    return systems -> EffectiveFactorGrouper.groupByEffectiveFactor(systems).entrySet().stream()
        .map(e -> new SystemGroup(e.getKey(), e.getValue()))
        .toList();
  }
}
