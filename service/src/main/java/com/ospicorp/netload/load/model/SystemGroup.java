package com.ospicorp.netload.load.model;

import java.util.List;

public record SystemGroup(EffectiveFactor multiplier, List<SystemRecord> members) {

  public SystemGroup {
    members = List.copyOf(members);
    if (members.isEmpty()) {
      throw new IllegalArgumentException("a system group needs at least one member");
    }
  }

  public List<String> sids() {
    return members.stream().map(SystemRecord::sid).toList();
  }
}
