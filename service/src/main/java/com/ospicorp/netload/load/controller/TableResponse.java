package com.ospicorp.netload.load.controller;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/** Multi-column load table; each row holds {@code datetime} plus one entry per column. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TableResponse(
    @JsonProperty("job_id") Long jobId,
    String resolution,
    Instant start,
    Instant end,
    List<String> columns,
    @JsonProperty("row_count") int rowCount,
    List<Map<String, Object>> rows
) {}
