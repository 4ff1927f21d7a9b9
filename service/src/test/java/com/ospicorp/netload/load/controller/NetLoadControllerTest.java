package com.ospicorp.netload.load.controller;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.ospicorp.netload.load.exception.EmptySystemSetException;
import com.ospicorp.netload.load.exception.JobNotFoundException;
import com.ospicorp.netload.load.exception.UpstreamUnavailableException;
import com.ospicorp.netload.load.model.NetLoadSeries;
import com.ospicorp.netload.load.model.PredictionJob;
import com.ospicorp.netload.load.model.Resolution;
import com.ospicorp.netload.load.model.TimeSeriesTable;
import com.ospicorp.netload.load.repository.PredictionJobRepository;
import com.ospicorp.netload.load.service.LoadAggregationEngine;
import com.ospicorp.netload.load.service.MeasuredLoadService;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(NetLoadController.class)
class NetLoadControllerTest {

  private static final Instant T0 = Instant.parse("2024-03-01T00:00:00Z");
  private static final Instant T1 = Instant.parse("2024-03-01T00:15:00Z");
  private static final String WINDOW = "start=2024-03-01T00:00:00Z&end=2024-03-01T00:45:00Z";

  @Autowired
  private MockMvc mockMvc;

  @MockBean
  private LoadAggregationEngine engine;

  @MockBean
  private MeasuredLoadService measuredLoadService;

  @MockBean
  private PredictionJobRepository jobs;

  private static NetLoadSeries series() {
    Map<Instant, Double> values = new LinkedHashMap<>();
    values.put(T0, 10d);
    values.put(T1, -2.5d);
    return NetLoadSeries.of(values);
  }

  @Test
  void netLoadAsJson() throws Exception {
    when(engine.getNetLoad(eq(313L), any(), any(), eq(Resolution.ofMinutes(15)), eq(false),
        eq(true))).thenReturn(series());

    mockMvc.perform(get("/v1/jobs/313/load?" + WINDOW + "&resolution=15min"))
        .andExpect(status().isOk())
        .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
        .andExpect(jsonPath("$.job_id").value(313))
        .andExpect(jsonPath("$.resolution").value("15m"))
        .andExpect(jsonPath("$.point_count").value(2))
        .andExpect(jsonPath("$.first_timestamp").value("2024-03-01T00:00:00Z"))
        .andExpect(jsonPath("$.points[0][0]").value("2024-03-01T00:00:00Z"))
        .andExpect(jsonPath("$.points[1][1]").value(-2.5));
  }

  @Test
  void emptySeriesHasNoPoints() throws Exception {
    when(engine.getNetLoad(anyLong(), any(), any(), any(Resolution.class), anyBoolean(),
        anyBoolean())).thenReturn(NetLoadSeries.empty());

    mockMvc.perform(get("/v1/jobs/313/load?" + WINDOW + "&resolution=15min"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.point_count").value(0))
        .andExpect(jsonPath("$.points").isEmpty())
        .andExpect(jsonPath("$.first_timestamp").doesNotExist());
  }

  @Test
  void netLoadAsCsvThroughFormatOrAccept() throws Exception {
    when(engine.getNetLoad(anyLong(), any(), any(), any(Resolution.class), anyBoolean(),
        anyBoolean())).thenReturn(series());

    mockMvc.perform(get("/v1/jobs/313/load?" + WINDOW + "&resolution=15min&format=csv"))
        .andExpect(status().isOk())
        .andExpect(content().contentTypeCompatibleWith(CsvHttpMessageConverter.TEXT_CSV))
        .andExpect(content().string(containsString("datetime,load")))
        .andExpect(content().string(containsString("2024-03-01T00:15:00Z,-2.5")));

    mockMvc.perform(get("/v1/jobs/313/load?" + WINDOW + "&resolution=15min")
            .header(HttpHeaders.ACCEPT, "text/csv"))
        .andExpect(status().isOk())
        .andExpect(content().contentTypeCompatibleWith(CsvHttpMessageConverter.TEXT_CSV));
  }

  @Test
  void resolutionDefaultsToTheJobsResolution() throws Exception {
    when(jobs.findById(313L)).thenReturn(Optional.of(new PredictionJob(313L, "North", 60, true)));
    when(engine.getNetLoad(anyLong(), any(), any(), any(Resolution.class), anyBoolean(),
        anyBoolean())).thenReturn(series());

    mockMvc.perform(get("/v1/jobs/313/load?" + WINDOW + "&ignore_factor=true&aggregated=false"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.resolution").value("1h"))
        .andExpect(jsonPath("$.ignore_factor").value(true));

    verify(engine).getNetLoad(eq(313L), eq(T0), eq(Instant.parse("2024-03-01T00:45:00Z")),
        eq(Resolution.ofMinutes(60)), eq(true), eq(false));
  }

  @Test
  void invalidResolutionIsBadRequestWithErrorCode() throws Exception {
    mockMvc.perform(get("/v1/jobs/313/load?" + WINDOW + "&resolution=fifteen"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.errorCode").value(1002))
        .andExpect(jsonPath("$.moreInfo").value("https://developers.company.com/docs/errors/1002"))
        .andExpect(jsonPath("$.path").value("/v1/jobs/313/load"));

    verifyNoInteractions(engine);
  }

  @Test
  void invalidFormatIsBadRequest() throws Exception {
    mockMvc.perform(get("/v1/jobs/313/load?" + WINDOW + "&resolution=15min&format=xml"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.errorCode").value(1007));
  }

  @Test
  void missingStartIsBadRequest() throws Exception {
    mockMvc.perform(get("/v1/jobs/313/load?end=2024-03-01T00:45:00Z&resolution=15min"))
        .andExpect(status().isBadRequest())
        .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_PROBLEM_JSON));
  }

  @Test
  void unknownJobIsNotFound() throws Exception {
    when(engine.getNetLoad(anyLong(), any(), any(), any(Resolution.class), anyBoolean(),
        anyBoolean())).thenThrow(new JobNotFoundException(99L));

    mockMvc.perform(get("/v1/jobs/99/load?" + WINDOW + "&resolution=15min"))
        .andExpect(status().isNotFound())
        .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_PROBLEM_JSON))
        .andExpect(jsonPath("$.errorCode").value(2001))
        .andExpect(jsonPath("$.detail").value("Prediction job not found: 99"));
  }

  @Test
  void jobWithoutSystemsIsUnprocessable() throws Exception {
    when(engine.getNetLoad(anyLong(), any(), any(), any(Resolution.class), anyBoolean(),
        anyBoolean())).thenThrow(new EmptySystemSetException(313L));

    mockMvc.perform(get("/v1/jobs/313/load?" + WINDOW + "&resolution=15min"))
        .andExpect(status().isUnprocessableEntity())
        .andExpect(jsonPath("$.errorCode").value(2002));
  }

  @Test
  void storeOutageIsServiceUnavailable() throws Exception {
    when(engine.getNetLoad(anyLong(), any(), any(), any(Resolution.class), anyBoolean(),
        anyBoolean())).thenThrow(new UpstreamUnavailableException("store down",
        new IllegalStateException("boom")));

    mockMvc.perform(get("/v1/jobs/313/load?" + WINDOW + "&resolution=15min"))
        .andExpect(status().isServiceUnavailable())
        .andExpect(jsonPath("$.errorCode").value(3001));
  }

  @Test
  void systemLoadsAsTable() throws Exception {
    TimeSeriesTable table = TimeSeriesTable.builder("pv_1", "pv_2")
        .put(T0, "pv_1", 4d)
        .put(T0, "pv_2", -1d)
        .build();
    when(engine.getSystemLoads(eq(313L), any(), any(), eq(Resolution.ofMinutes(15)), eq(false)))
        .thenReturn(table);

    mockMvc.perform(get("/v1/jobs/313/systems/load?" + WINDOW + "&resolution=15min"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.columns[0]").value("pv_1"))
        .andExpect(jsonPath("$.row_count").value(1))
        .andExpect(jsonPath("$.rows[0].datetime").value("2024-03-01T00:00:00Z"))
        .andExpect(jsonPath("$.rows[0].pv_2").value(-1.0));
  }

  @Test
  void measuredLoadForExplicitSystems() throws Exception {
    TimeSeriesTable table = TimeSeriesTable.builder(MeasuredLoadService.LOAD_COLUMN,
            MeasuredLoadService.ENTRIES_COLUMN)
        .put(T0, MeasuredLoadService.LOAD_COLUMN, 7d)
        .put(T0, MeasuredLoadService.ENTRIES_COLUMN, 2d)
        .build();
    when(measuredLoadService.getLoad(eq(List.of("pv_1", "pv_2")), any(), any(),
        eq(Resolution.ofMinutes(15)), eq(true), eq(true))).thenReturn(table);

    mockMvc.perform(get("/v1/systems/load?sid=pv_1&sid=pv_2&" + WINDOW
            + "&average=true&include_entries=true&format=csv"))
        .andExpect(status().isOk())
        .andExpect(content().string(containsString("datetime,load,nEntries")))
        .andExpect(content().string(containsString("2024-03-01T00:00:00Z,7.0,2.0")));
  }
}
