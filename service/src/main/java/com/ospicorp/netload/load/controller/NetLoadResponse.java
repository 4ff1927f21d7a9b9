package com.ospicorp.netload.load.controller;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record NetLoadResponse(
    @JsonProperty("job_id") long jobId,
    String resolution,
    Instant start,
    Instant end,
    @JsonProperty("ignore_factor") boolean ignoreFactor,
    boolean aggregated,
    @JsonProperty("first_timestamp") Instant firstTimestamp,
    @JsonProperty("last_timestamp") Instant lastTimestamp,
    @JsonProperty("point_count") int pointCount,
    List<List<Object>> points
) {}
