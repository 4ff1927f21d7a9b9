package com.ospicorp.netload.load.controller;

import com.ospicorp.netload.load.exception.InvalidParameterException;
import com.ospicorp.netload.load.exception.JobNotFoundException;
import com.ospicorp.netload.load.model.LoadPoint;
import com.ospicorp.netload.load.model.NetLoadSeries;
import com.ospicorp.netload.load.model.PredictionJob;
import com.ospicorp.netload.load.model.Resolution;
import com.ospicorp.netload.load.model.TimeSeriesTable;
import com.ospicorp.netload.load.repository.PredictionJobRepository;
import com.ospicorp.netload.load.service.LoadAggregationEngine;
import com.ospicorp.netload.load.service.MeasuredLoadService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Positive;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.MimeTypeUtils;
import org.springframework.util.StringUtils;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1")
@Validated
@Tag(name = "Load")
public class NetLoadController {
  private static final MediaType CSV_MEDIA_TYPE = CsvHttpMessageConverter.TEXT_CSV;
  private static final String DATETIME_COLUMN = "datetime";

  private final LoadAggregationEngine engine;
  private final MeasuredLoadService measuredLoadService;
  private final PredictionJobRepository jobs;

  public NetLoadController(LoadAggregationEngine engine, MeasuredLoadService measuredLoadService,
      PredictionJobRepository jobs) {
    this.engine = engine;
    this.measuredLoadService = measuredLoadService;
    this.jobs = jobs;
  }

  @GetMapping("/jobs/{id}/load")
  @Operation(summary = "Get net load of a prediction job",
      description = "Sum of the job's systems' measured load, each multiplied by its polarity "
          + "and factor. An empty point list means no system delivered data.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Net load",
          content = {
              @Content(mediaType = "application/json",
                  schema = @Schema(implementation = NetLoadResponse.class)),
              @Content(mediaType = "text/csv")
          }),
      @ApiResponse(responseCode = "400", description = "Invalid resolution or time range"),
      @ApiResponse(responseCode = "404", description = "Unknown prediction job",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = org.springframework.http.ProblemDetail.class))),
      @ApiResponse(responseCode = "422", description = "Prediction job has no systems",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = org.springframework.http.ProblemDetail.class))),
      @ApiResponse(responseCode = "503", description = "Measurement store or database unavailable",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = org.springframework.http.ProblemDetail.class)))
  })
  public ResponseEntity<?> netLoad(
      @PathVariable @Positive @Parameter(description = "Prediction job id", example = "313") long id,
      @RequestParam @Parameter(description = "Start (inclusive, ISO-8601 instant)") Instant start,
      @RequestParam @Parameter(description = "End (inclusive, ISO-8601 instant)") Instant end,
      @RequestParam(required = false)
          @Parameter(description = "Bucket width, e.g. 15min or PT15M; defaults to the job's") String resolution,
      @RequestParam(name = "ignore_factor", defaultValue = "false") boolean ignoreFactor,
      @RequestParam(defaultValue = "true") boolean aggregated,
      @RequestParam(name = "format", required = false) String format,
      @RequestHeader(value = HttpHeaders.ACCEPT, required = false) String accept) {

    Resolution bucket = resolveResolution(id, resolution);
    MediaType contentType = selectMediaType(format, accept);
    NetLoadSeries series = engine.getNetLoad(id, start, end, bucket, ignoreFactor, aggregated);

    if (contentType.isCompatibleWith(CSV_MEDIA_TYPE)) {
      List<LoadPoint> points = series.points();
      return ResponseEntity.ok().contentType(CSV_MEDIA_TYPE).body(points);
    }

    List<List<Object>> tuples = new ArrayList<>(series.size());
    series.values().forEach((timestamp, load) -> {
      List<Object> tuple = new ArrayList<>(2);
      tuple.add(timestamp.toString());
      tuple.add(load);
      tuples.add(tuple);
    });
    Instant first = series.isEmpty() ? null : series.values().firstKey();
    Instant last = series.isEmpty() ? null : series.values().lastKey();
    NetLoadResponse body = new NetLoadResponse(id, bucket.toString(), start, end, ignoreFactor,
        aggregated, first, last, series.size(), tuples);
    return ResponseEntity.ok().contentType(MediaType.APPLICATION_JSON).body(body);
  }

  @GetMapping("/jobs/{id}/systems/load")
  @Operation(summary = "Get per-system load of a prediction job",
      description = "One column per system with data, multiplied by polarity and factor.")
  public ResponseEntity<?> systemLoads(
      @PathVariable @Positive long id,
      @RequestParam Instant start,
      @RequestParam Instant end,
      @RequestParam(required = false) String resolution,
      @RequestParam(name = "ignore_factor", defaultValue = "false") boolean ignoreFactor,
      @RequestParam(name = "format", required = false) String format,
      @RequestHeader(value = HttpHeaders.ACCEPT, required = false) String accept) {

    Resolution bucket = resolveResolution(id, resolution);
    MediaType contentType = selectMediaType(format, accept);
    TimeSeriesTable table = engine.getSystemLoads(id, start, end, bucket, ignoreFactor);
    return tableResponse(id, bucket, start, end, table, contentType);
  }

  @GetMapping("/systems/load")
  @Operation(summary = "Get measured load of systems",
      description = "Unscaled load summed across the given systems, optionally averaged.")
  public ResponseEntity<?> measuredLoad(
      @RequestParam(name = "sid") @Parameter(description = "System ids", example = "pv_123") List<String> sids,
      @RequestParam Instant start,
      @RequestParam Instant end,
      @RequestParam(defaultValue = "15min") String resolution,
      @RequestParam(name = "average", defaultValue = "false") boolean averageOutput,
      @RequestParam(name = "include_entries", defaultValue = "false") boolean includeEntries,
      @RequestParam(name = "format", required = false) String format,
      @RequestHeader(value = HttpHeaders.ACCEPT, required = false) String accept) {

    Resolution bucket = Resolution.parse(resolution);
    MediaType contentType = selectMediaType(format, accept);
    TimeSeriesTable table = measuredLoadService.getLoad(sids, start, end, bucket, averageOutput,
        includeEntries);
    return tableResponse(null, bucket, start, end, table, contentType);
  }

  private Resolution resolveResolution(long jobId, String resolution) {
    if (StringUtils.hasText(resolution)) {
      return Resolution.parse(resolution);
    }
    PredictionJob job = jobs.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    Integer minutes = job.getResolutionMinutes();
    return Resolution.ofMinutes(minutes == null ? 15 : minutes);
  }

  private static ResponseEntity<?> tableResponse(Long jobId, Resolution resolution, Instant start,
      Instant end, TimeSeriesTable table, MediaType contentType) {
    List<Map<String, Object>> rows = new ArrayList<>(table.rowCount());
    for (Instant timestamp : table.timestamps()) {
      Map<String, Object> row = new LinkedHashMap<>();
      row.put(DATETIME_COLUMN, timestamp.toString());
      for (String column : table.columns()) {
        row.put(column, table.value(timestamp, column));
      }
      rows.add(row);
    }
    if (contentType.isCompatibleWith(CSV_MEDIA_TYPE)) {
      return ResponseEntity.ok().contentType(CSV_MEDIA_TYPE).body(rows);
    }
    return ResponseEntity.ok().contentType(MediaType.APPLICATION_JSON)
        .body(new TableResponse(jobId, resolution.toString(), start, end, table.columns(),
            rows.size(), rows));
  }

  private static MediaType selectMediaType(String format, String accept) {
    if (StringUtils.hasText(format)) {
      if ("csv".equalsIgnoreCase(format)) {
        return CSV_MEDIA_TYPE;
      }
      if ("json".equalsIgnoreCase(format)) {
        return MediaType.APPLICATION_JSON;
      }
      throw new InvalidParameterException("Invalid format value. Supported values: json,csv.",
          1007);
    }
    if (!StringUtils.hasText(accept)) {
      return MediaType.APPLICATION_JSON;
    }
    List<MediaType> mediaTypes = MediaType.parseMediaTypes(accept);
    mediaTypes.sort(Comparator.comparingDouble(MediaType::getQualityValue).reversed());
    MimeTypeUtils.sortBySpecificity(mediaTypes);
    for (MediaType mediaType : mediaTypes) {
      if (mediaType.isCompatibleWith(MediaType.APPLICATION_JSON)) {
        return MediaType.APPLICATION_JSON;
      }
      if (mediaType.isCompatibleWith(CSV_MEDIA_TYPE)) {
        return CSV_MEDIA_TYPE;
      }
    }
    return MediaType.APPLICATION_JSON;
  }
}
