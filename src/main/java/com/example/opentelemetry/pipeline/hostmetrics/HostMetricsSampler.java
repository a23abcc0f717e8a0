package com.example.opentelemetry.pipeline.hostmetrics;

import com.example.opentelemetry.pipeline.CollectorContext;
import com.example.opentelemetry.pipeline.model.InstrumentationScopeInfo;
import com.example.opentelemetry.pipeline.model.SignalType;
import com.example.opentelemetry.pipeline.model.TelemetryRecord;
import com.example.opentelemetry.pipeline.processor.BackpressureException;
import com.example.opentelemetry.pipeline.receiver.TelemetryIngest;
import com.example.opentelemetry.pipeline.util.Threads;
import com.google.common.base.Verify;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Runs the scrapers on a fixed interval and pushes their points into the pipeline as metric records.
 * <p>
 * A scraper that fails is skipped for that tick; the others still report. When the pipeline is full the
 * points of the tick are dropped.
 */
public class HostMetricsSampler {
    static final String TRANSPORT = "hostmetrics";
    static final AttributeKey<String> SCRAPER = AttributeKey.stringKey("scraper");

    final Logger logger = LoggerFactory.getLogger(getClass());

    private final ScheduledThreadPoolExecutor executor;
    private final CollectorContext context;
    private final TelemetryIngest ingest;
    private final List<HostMetricsScraper> scrapers;
    private final Duration collectionInterval;
    private final long bootTimeUnixNano;
    private final LongCounter scrapeErrorsCounter;

    public HostMetricsSampler(CollectorContext context, TelemetryIngest ingest, List<HostMetricsScraper> scrapers,
                              Duration collectionInterval, long bootTimeUnixNano) {
        Verify.verify(!collectionInterval.isNegative() && !collectionInterval.isZero(), "collection interval must be positive");
        this.context = Objects.requireNonNull(context);
        this.ingest = Objects.requireNonNull(ingest);
        this.scrapers = List.copyOf(scrapers);
        this.collectionInterval = collectionInterval;
        this.bootTimeUnixNano = bootTimeUnixNano;
        this.scrapeErrorsCounter = context.meter().counterBuilder("hostmetrics.scrape_errors")
                .setDescription("Number of scrapes that failed").build();
        this.executor = Threads.newScheduler("hostmetrics-sampler", logger);
    }

    public void start() {
        logger.info("Starting host metrics sampler with an interval of {} for scrapers {}", collectionInterval,
                scrapers.stream().map(HostMetricsScraper::name).toList());
        executor.scheduleAtFixedRate(this::sampleAndSubmit, collectionInterval.toMillis(),
                collectionInterval.toMillis(), TimeUnit.MILLISECONDS);
    }

    void sampleAndSubmit() {
        List<TelemetryRecord> records = sample(TimeUnit.MILLISECONDS.toNanos(System.currentTimeMillis()));
        if (records.isEmpty()) {
            return;
        }
        try {
            ingest.submit(SignalType.METRIC, records, TRANSPORT);
        } catch (BackpressureException e) {
            logger.warn("Dropped {} host metric point(s): {}", records.size(), e.getMessage());
        }
    }

    List<TelemetryRecord> sample(long timeUnixNano) {
        List<TelemetryRecord> records = new ArrayList<>();
        for (HostMetricsScraper scraper : scrapers) {
            InstrumentationScopeInfo scope = InstrumentationScopeInfo.of(
                    CollectorContext.INSTRUMENTATION_NAME + "/hostmetrics/" + scraper.name(), "");
            MetricPoints points = new MetricPoints(context.resource(), scope, bootTimeUnixNano, timeUnixNano);
            try {
                scraper.scrape(points);
                records.addAll(points.records());
                logger.trace("Collected {} point(s) from {}", points.size(), scraper.name());
            } catch (RuntimeException e) {
                scrapeErrorsCounter.add(1, Attributes.of(SCRAPER, scraper.name()));
                logger.warn("failed to scrape {} metrics", scraper.name(), e);
            }
        }
        return records;
    }

    public void stop() {
        executor.shutdown();
    }
}
