package com.historian.anomaly.engine;

import com.historian.anomaly.config.MetricsConfig;
import com.historian.anomaly.exception.InsufficientDataException;
import com.historian.anomaly.exception.InvalidConfigurationException;
import com.historian.anomaly.model.AnomalyRecord;
import com.historian.anomaly.model.DeviationAnalysisOptions;
import com.historian.anomaly.model.MethodResult;
import com.historian.anomaly.model.OutlierMethod;
import com.historian.anomaly.model.StatisticalSummary;
import com.historian.anomaly.model.TimeSeriesPoint;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Runs single-method outlier tests against a validated working set.
 * Uses the Strategy pattern: each OutlierMethod is handled by exactly one registered OutlierDetector.
 */
@Component
public class StatisticalDeviationEngine {

    private static final Logger log = LoggerFactory.getLogger(StatisticalDeviationEngine.class);

    public static final int MIN_SAMPLES = 3;
    public static final List<OutlierMethod> DEFAULT_METHODS =
            List.of(OutlierMethod.ZSCORE, OutlierMethod.MODIFIED_ZSCORE);

    private final Map<OutlierMethod, OutlierDetector> detectorMap;
    private final Tracer tracer;
    private final MetricsConfig metricsConfig;

    public StatisticalDeviationEngine(List<OutlierDetector> detectors, Tracer tracer,
                                      MetricsConfig metricsConfig) {
        this.detectorMap = new EnumMap<>(OutlierMethod.class);
        this.tracer = tracer;
        this.metricsConfig = metricsConfig;

        for (OutlierDetector detector : detectors) {
            OutlierDetector previous = detectorMap.put(detector.getSupportedMethod(), detector);
            if (previous != null) {
                throw new IllegalStateException("Two detectors registered for " + detector.getSupportedMethod()
                        + ": " + previous.getClass().getSimpleName() + ", " + detector.getClass().getSimpleName());
            }
            log.info("Registered outlier detector: {} -> {}",
                    detector.getSupportedMethod(), detector.getClass().getSimpleName());
        }

        Set<OutlierMethod> missing = EnumSet.allOf(OutlierMethod.class);
        missing.removeAll(detectorMap.keySet());
        if (!missing.isEmpty()) {
            throw new IllegalStateException("No outlier detector registered for " + missing);
        }
    }

    /**
     * Z-score detection over raw historian samples.
     *
     * @throws InvalidConfigurationException when {@code threshold} is not positive
     * @throws InsufficientDataException     when fewer than 3 finite samples remain
     */
    public List<AnomalyRecord> detectAnomalies(List<TimeSeriesPoint> data, double threshold) {
        InvalidConfigurationException.requirePositive("threshold", threshold);
        List<TimeSeriesPoint> samples = SampleValidator.normalize(data);
        InsufficientDataException.requireAtLeast("anomaly detection", MIN_SAMPLES, samples.size());

        StatisticalSummary summary = StatisticsCalculator.summarize(SampleValidator.values(samples));
        DeviationAnalysisOptions options = DeviationAnalysisOptions.builder()
                .zscoreThreshold(threshold)
                .build();
        return detect(OutlierMethod.ZSCORE, samples, summary, options);
    }

    /**
     * Side-by-side comparison of outlier tests over raw historian samples.
     * Method names are resolved (and rejected when unknown) before any statistic is computed.
     *
     * @param methodNames test names such as "zscore" or "grubbs"; null selects zscore and modified-zscore
     */
    public List<MethodResult> performStatisticalDeviationAnalysis(List<TimeSeriesPoint> data,
                                                                  List<String> methodNames,
                                                                  DeviationAnalysisOptions options) {
        List<OutlierMethod> methods = resolveMethods(methodNames);
        options.validate();
        List<TimeSeriesPoint> samples = SampleValidator.normalize(data);
        InsufficientDataException.requireAtLeast("statistical deviation analysis", MIN_SAMPLES, samples.size());

        StatisticalSummary summary = StatisticsCalculator.summarize(SampleValidator.values(samples));
        return analyze(methods, samples, summary, options);
    }

    static List<OutlierMethod> resolveMethods(List<String> methodNames) {
        if (methodNames == null) {
            return DEFAULT_METHODS;
        }
        if (methodNames.isEmpty()) {
            throw new InvalidConfigurationException("methods", "At least one detection method must be requested");
        }
        Set<OutlierMethod> methods = new LinkedHashSet<>();
        for (String name : methodNames) {
            methods.add(OutlierMethod.fromName(name));
        }
        return new ArrayList<>(methods);
    }

    /**
     * Run one test.
     *
     * @param samples validated samples (see {@link SampleValidator#normalize})
     * @param summary statistics of {@code samples}
     */
    public List<AnomalyRecord> detect(OutlierMethod method, List<TimeSeriesPoint> samples,
                                      StatisticalSummary summary, DeviationAnalysisOptions options) {
        OutlierDetector detector = detectorMap.get(method);

        Span span = tracer.nextSpan()
                .name("detector." + method.getMethodName())
                .tag("detector.method", method.getMethodName())
                .tag("detector.samples", String.valueOf(samples.size()))
                .start();

        try (Tracer.SpanInScope ws = tracer.withSpan(span)) {
            List<AnomalyRecord> anomalies = detector.detect(samples, summary, options);
            span.tag("detector.anomalies", String.valueOf(anomalies.size()));

            if (!anomalies.isEmpty()) {
                metricsConfig.recordDetectorTriggered(method.getMethodName(), anomalies.size());
                log.debug("Detector {} flagged {} of {} samples", method.getMethodName(),
                        anomalies.size(), samples.size());
            }
            return anomalies;
        } catch (RuntimeException e) {
            span.error(e);
            throw e;
        } finally {
            span.end();
        }
    }

    /**
     * Run each requested test independently against the same statistics.
     * Results are returned in request order, one per method; nothing is merged.
     */
    public List<MethodResult> analyze(List<OutlierMethod> methods, List<TimeSeriesPoint> samples,
                                      StatisticalSummary summary, DeviationAnalysisOptions options) {
        List<MethodResult> results = new ArrayList<>(methods.size());
        for (OutlierMethod method : methods) {
            results.add(MethodResult.builder()
                    .method(method)
                    .anomalies(detect(method, samples, summary, options))
                    .statistics(summary)
                    .build());
        }
        return results;
    }
}
