package com.ospicorp.netload.load.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.time.Instant;

@JsonPropertyOrder({"datetime", "load"})
public record LoadPoint(Instant datetime, double load) {}
