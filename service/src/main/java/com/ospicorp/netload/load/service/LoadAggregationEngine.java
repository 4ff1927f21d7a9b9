package com.ospicorp.netload.load.service;

import com.ospicorp.netload.load.exception.LoadDataException;
import com.ospicorp.netload.load.exception.UpstreamUnavailableException;
import com.ospicorp.netload.load.model.AggregationFunction;
import com.ospicorp.netload.load.model.EffectiveFactor;
import com.ospicorp.netload.load.model.NetLoadSeries;
import com.ospicorp.netload.load.model.Resolution;
import com.ospicorp.netload.load.model.SystemGroup;
import com.ospicorp.netload.load.model.SystemRecord;
import com.ospicorp.netload.load.model.TimeSeriesTable;
import com.ospicorp.netload.load.model.TimeWindow;
import com.ospicorp.netload.load.repository.SystemCatalog;
import com.ospicorp.netload.load.source.RangeSeriesSource;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Computes the signed, scaled net load of a prediction job.
 *
 * <p>Every system contributes {@code load * polarity * factor} (polarity 0 counts as +1, the
 * factor is skipped with {@code ignoreFactor}). Two fetch paths exist and must agree:
 * <ul>
 *   <li>direct: one raw query for all systems, averaged per bucket and scaled per system;</li>
 *   <li>optimized: systems grouped by effective factor, one aggregated query per group.</li>
 * </ul>
 * Both end in the same outer-join merge: a timestamp appears when any group has a value there,
 * and only present values are summed.
 *
 * <p>Holds no per-call state; safe to share between concurrent callers.
 */
@Service
public class LoadAggregationEngine {

  private static final Logger log = LoggerFactory.getLogger(LoadAggregationEngine.class);

  private final SystemCatalog systemCatalog;
  private final RangeSeriesSource seriesSource;
  private final WindowedQueryCorrector corrector;

  public LoadAggregationEngine(SystemCatalog systemCatalog, RangeSeriesSource seriesSource,
      WindowedQueryCorrector corrector) {
    this.systemCatalog = systemCatalog;
    this.seriesSource = seriesSource;
    this.corrector = corrector;
  }

  public NetLoadSeries getNetLoad(long jobId, Instant start, Instant end, Resolution resolution) {
    return getNetLoad(jobId, start, end, resolution, false, true);
  }

  public NetLoadSeries getNetLoad(long jobId, Instant start, Instant end, String resolution,
      boolean ignoreFactor, boolean aggregated) {
    return getNetLoad(jobId, start, end, Resolution.parse(resolution), ignoreFactor, aggregated);
  }

  public NetLoadSeries getNetLoad(long jobId, Instant start, Instant end, Resolution resolution,
      boolean ignoreFactor, boolean aggregated) {
    TimeWindow window = TimeWindow.of(start, end, resolution);
    List<SystemRecord> systems = systemsFor(jobId);

    boolean optimized = aggregated && !ignoreFactor;
    GroupingStrategy strategy = optimized
        ? GroupingStrategy.byEffectiveFactor()
        : GroupingStrategy.perSystem(ignoreFactor);
    List<SystemGroup> groups = strategy.group(systems);
    log.debug("Job {}: {} systems in {} groups, {} path, window {}", jobId, systems.size(),
        groups.size(), optimized ? "optimized" : "direct", window);

    Map<SystemGroup, NavigableMap<Instant, Double>> loads = optimized
        ? fetchAggregated(jobId, groups, window)
        : fetchRaw(jobId, groups, systems, window);

    NavigableMap<Instant, Double> net = merge(loads);
    if (net.isEmpty()) {
      log.warn("No load data available for job {} in {}; returning an empty series", jobId,
          window);
      return NetLoadSeries.empty();
    }
    return NetLoadSeries.of(net);
  }

  /**
   * Per-system load of a job, one column per system with data, each already multiplied by
   * its polarity and, unless ignored, its factor.
   */
  public TimeSeriesTable getSystemLoads(long jobId, Instant start, Instant end,
      Resolution resolution, boolean ignoreFactor) {
    TimeWindow window = TimeWindow.of(start, end, resolution);
    List<SystemRecord> systems = systemsFor(jobId);
    TimeSeriesTable present = fetchRawColumns(jobId, systems, window);
    if (present.isEmpty()) {
      log.warn("No load data available for job {} in {}; returning an empty table", jobId,
          window);
      return TimeSeriesTable.empty();
    }

    Map<String, Map<Instant, Double>> scaled = new LinkedHashMap<>();
    for (SystemGroup group : GroupingStrategy.perSystem(ignoreFactor).group(systems)) {
      String sid = group.members().get(0).sid();
      if (!present.hasColumn(sid)) {
        continue;
      }
      Map<Instant, Double> column = new TreeMap<>();
      present.column(sid).forEach((t, v) -> column.put(t, group.multiplier().apply(v)));
      scaled.put(sid, column);
    }
    return TimeSeriesTable.ofColumns(scaled);
  }

  private List<SystemRecord> systemsFor(long jobId) {
    List<SystemRecord> systems = call(() -> systemCatalog.getSystemsForJob(jobId),
        "system lookup for job " + jobId);
    for (SystemRecord system : systems) {
      if (!system.hasPolaritySet()) {
        log.warn("Polarity not set for system {} of job {}, using +1", system.sid(), jobId);
      }
    }
    return systems;
  }

  private Map<SystemGroup, NavigableMap<Instant, Double>> fetchAggregated(long jobId,
      List<SystemGroup> groups, TimeWindow window) {
    Map<SystemGroup, NavigableMap<Instant, Double>> loads = new LinkedHashMap<>();
    List<String> missing = new ArrayList<>();
    for (SystemGroup group : groups) {
      TimeSeriesTable table = call(
          () -> corrector.fetch(seriesSource, group.sids(), window, AggregationFunction.SUM),
          "job " + jobId + ", group " + group.multiplier() + " " + group.sids() + ", " + window);
      NavigableMap<Instant, Double> load = table.column(AggregationFunction.SUM.columnName());
      if (load.isEmpty()) {
        // an empty group sum means none of its members reported
        missing.addAll(group.sids());
        continue;
      }
      loads.put(group, load);
    }
    // a silent member of a group that still reported is not visible here
    if (!missing.isEmpty() && !loads.isEmpty()) {
      warnMissing(jobId, missing);
    }
    return loads;
  }

  private Map<SystemGroup, NavigableMap<Instant, Double>> fetchRaw(long jobId,
      List<SystemGroup> groups, List<SystemRecord> systems, TimeWindow window) {
    TimeSeriesTable present = fetchRawColumns(jobId, systems, window);
    Map<SystemGroup, NavigableMap<Instant, Double>> loads = new LinkedHashMap<>();
    if (present.isEmpty()) {
      return loads;
    }
    for (SystemGroup group : groups) {
      NavigableMap<Instant, Double> load = new TreeMap<>();
      for (String sid : group.sids()) {
        if (present.hasColumn(sid)) {
          present.column(sid).forEach((t, v) -> load.merge(t, v, Double::sum));
        }
      }
      if (!load.isEmpty()) {
        loads.put(group, load);
      }
    }
    return loads;
  }

  /**
   * One combined raw query for all systems, averaged per bucket and trimmed to the window.
   * Systems without any sample are reported and left out.
   */
  private TimeSeriesTable fetchRawColumns(long jobId, List<SystemRecord> systems,
      TimeWindow window) {
    List<String> sids = systems.stream().map(SystemRecord::sid).distinct().toList();
    TimeSeriesTable raw = call(
        () -> seriesSource.queryRaw(sids, window.start(), window.exclusiveStop(),
            window.resolution()),
        "job " + jobId + ", systems " + sids + ", " + window);
    TimeSeriesTable bucketed = Resampler.meanPerBucket(raw, window.resolution())
        .between(window.start(), window.end())
        .dropEmptyRows();
    if (bucketed.isEmpty()) {
      return TimeSeriesTable.empty();
    }

    List<String> present = new ArrayList<>();
    List<String> missing = new ArrayList<>();
    for (String sid : sids) {
      if (bucketed.hasColumn(sid) && !bucketed.column(sid).isEmpty()) {
        present.add(sid);
      } else {
        missing.add(sid);
      }
    }
    if (!missing.isEmpty()) {
      warnMissing(jobId, missing);
    }
    return bucketed.select(present);
  }

  private static void warnMissing(long jobId, List<String> missing) {
    log.warn("There are {} system(s) without load for job {}, ignoring them: {}",
        missing.size(), jobId, missing);
  }

  private static NavigableMap<Instant, Double> merge(
      Map<SystemGroup, NavigableMap<Instant, Double>> loads) {
    NavigableMap<Instant, Double> net = new TreeMap<>();
    loads.forEach((group, load) -> {
      EffectiveFactor multiplier = group.multiplier();
      load.forEach((t, v) -> net.merge(t, multiplier.apply(v), Double::sum));
    });
    return net;
  }

  private static <T> T call(Supplier<T> collaborator, String context) {
    try {
      return collaborator.get();
    } catch (LoadDataException ex) {
      throw ex;
    } catch (RuntimeException ex) {
      throw new UpstreamUnavailableException(
          "Upstream call failed (" + context + "): " + ex.getMessage(), ex);
    }
  }
}
