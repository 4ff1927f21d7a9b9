package com.ospicorp.netload.load.source;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.ospicorp.netload.load.exception.UpstreamUnavailableException;
import com.ospicorp.netload.load.model.AggregationFunction;
import com.ospicorp.netload.load.model.Resolution;
import com.ospicorp.netload.load.model.TimeSeriesTable;
import java.io.IOException;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Runs Flux queries through the InfluxDB v2 HTTP API and reads the annotated CSV answer.
 *
 * <p>Aggregated queries average each system per bucket with {@code aggregateWindow}, then
 * ungroup and aggregate again. Both stages stamp rows with the window's stop time, which is
 * the two-bucket lag the {@link com.ospicorp.netload.load.service.WindowedQueryCorrector}
 * removes.
 */
@Component
public class InfluxRangeSeriesSource implements RangeSeriesSource {
  private static final Logger log = LoggerFactory.getLogger(InfluxRangeSeriesSource.class);
  private static final MediaType FLUX = MediaType.valueOf("application/vnd.flux");
  private static final MediaType CSV = MediaType.valueOf("application/csv");
  static final String SYSTEM_TAG = "system";

  private final RestTemplate restTemplate;
  private final CsvMapper csvMapper = new CsvMapper();
  private final String baseUrl;
  private final String organization;
  private final String token;
  private final String bucket;
  private final String measurement;
  private final String field;

  public InfluxRangeSeriesSource(RestTemplate restTemplate,
      @Value("${load.store.url:http://influxdb:8086}") String baseUrl,
      @Value("${load.store.org:openstef}") String organization,
      @Value("${load.store.token:}") String token,
      @Value("${load.store.bucket:realised/autogen}") String bucket,
      @Value("${load.store.measurement:power}") String measurement,
      @Value("${load.store.field:output}") String field) {
    this.restTemplate = restTemplate;
    this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    this.organization = organization;
    this.token = token;
    this.bucket = bucket;
    this.measurement = measurement;
    this.field = field;
  }

  @Override
  public TimeSeriesTable queryRaw(List<String> seriesKeys, Instant start, Instant stop,
      Resolution resolution) {
    String flux = source(seriesKeys, start, stop)
        + "\n  |> keep(columns: [\"_time\", \"_value\", \"" + SYSTEM_TAG + "\"])";
    return parse(execute(flux), null);
  }

  @Override
  public TimeSeriesTable queryAggregated(List<String> seriesKeys, Instant start, Instant stop,
      Resolution resolution, AggregationFunction function) {
    String every = resolution.toFluxDuration();
    String flux = source(seriesKeys, start, stop)
        + "\n  |> aggregateWindow(every: " + every + ", fn: mean)"
        + "\n  |> group()"
        + "\n  |> aggregateWindow(every: " + every + ", fn: " + fluxFunction(function) + ")";
    return parse(execute(flux), function.columnName());
  }

  String source(List<String> seriesKeys, Instant start, Instant stop) {
    if (seriesKeys.isEmpty()) {
      throw new IllegalArgumentException("at least one series key is required");
    }
    if (seriesKeys.contains(null)) {
      throw new IllegalArgumentException("series keys must not be null");
    }
    String systems = seriesKeys.stream()
        .map(key -> "r." + SYSTEM_TAG + " == " + fluxString(key))
        .collect(Collectors.joining(" or "));
    return "from(bucket: " + fluxString(bucket) + ")"
        + "\n  |> range(start: " + start + ", stop: " + stop + ")"
        + "\n  |> filter(fn: (r) => r._measurement == " + fluxString(measurement) + ")"
        + "\n  |> filter(fn: (r) => r._field == " + fluxString(field) + ")"
        + "\n  |> filter(fn: (r) => " + systems + ")";
  }

  /** Quotes a value as a Flux string literal. Dollar signs are escaped to stop interpolation. */
  static String fluxString(String value) {
    StringBuilder out = new StringBuilder(value.length() + 2).append('"');
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      switch (c) {
        case '\\' -> out.append("\\\\");
        case '"' -> out.append("\\\"");
        case '$' -> out.append("\\$");
        case '\n' -> out.append("\\n");
        case '\r' -> out.append("\\r");
        case '\t' -> out.append("\\t");
        default -> out.append(c);
      }
    }
    return out.append('"').toString();
  }

  private String execute(String flux) {
    HttpHeaders headers = new HttpHeaders();
    headers.setContentType(FLUX);
    headers.setAccept(List.of(CSV));
    if (StringUtils.hasText(token)) {
      headers.set(HttpHeaders.AUTHORIZATION, "Token " + token);
    }
    log.debug("Flux query:\n{}", flux);
    try {
      ResponseEntity<String> response = restTemplate.exchange(
          baseUrl + "/api/v2/query?org={org}", HttpMethod.POST, new HttpEntity<>(flux, headers),
          String.class, organization);
      String body = response.getBody();
      return body == null ? "" : body;
    } catch (RestClientException ex) {
      log.error("Flux query against {} failed: {}", baseUrl, ex.getMessage());
      throw new UpstreamUnavailableException("Measurement store query failed: " + ex.getMessage(),
          ex);
    }
  }

  /**
   * Reads annotated CSV. Annotation lines start with '#', every table repeats its header row.
   * With {@code column == null} rows are pivoted by their system tag.
   */
  TimeSeriesTable parse(String body, String column) {
    TimeSeriesTable.Builder builder = TimeSeriesTable.builder();
    if (column != null) {
      builder.column(column);
    }
    if (!StringUtils.hasText(body)) {
      return builder.build();
    }
    try (MappingIterator<String[]> rows = csvMapper.readerFor(String[].class)
        .with(CsvParser.Feature.WRAP_AS_ARRAY)
        .with(CsvParser.Feature.SKIP_EMPTY_LINES)
        .with(CsvParser.Feature.ALLOW_COMMENTS)
        .readValues(body)) {
      Map<String, Integer> header = null;
      while (rows.hasNextValue()) {
        String[] row = rows.nextValue();
        Map<String, Integer> candidate = headerOf(row);
        if (candidate != null) {
          header = candidate;
          continue;
        }
        if (header == null) {
          continue;
        }
        String time = cell(row, header.get("_time"));
        if (!StringUtils.hasText(time)) {
          continue;
        }
        String target = column != null ? column : cell(row, header.get(SYSTEM_TAG));
        if (!StringUtils.hasText(target)) {
          continue;
        }
        String value = cell(row, header.get("_value"));
        builder.put(Instant.parse(time), target,
            StringUtils.hasText(value) ? Double.valueOf(value) : null);
      }
    } catch (IOException | DateTimeParseException | NumberFormatException ex) {
      throw new UpstreamUnavailableException("Unreadable measurement store response", ex);
    }
    return builder.build();
  }

  private static Map<String, Integer> headerOf(String[] row) {
    Map<String, Integer> index = new HashMap<>();
    for (int i = 0; i < row.length; i++) {
      index.put(row[i], i);
    }
    if (index.containsKey("error")) {
      throw new UpstreamUnavailableException("Measurement store reported an error: "
          + String.join(",", row), null);
    }
    return index.containsKey("_time") && index.containsKey("_value") ? index : null;
  }

  private static String cell(String[] row, Integer index) {
    return index == null || index >= row.length ? null : row[index];
  }

  private static String fluxFunction(AggregationFunction function) {
    return switch (function) {
      case MEAN -> "mean";
      case SUM -> "sum";
      case COUNT -> "count";
    };
  }
}
