package com.example.opentelemetry.pipeline.receiver;

import com.example.opentelemetry.pipeline.CollectorContext;
import com.example.opentelemetry.pipeline.model.SignalType;
import com.example.opentelemetry.pipeline.model.TelemetryRecord;
import com.example.opentelemetry.pipeline.otlp.OtlpDecoder;
import com.example.opentelemetry.pipeline.processor.BackpressureException;
import com.example.opentelemetry.pipeline.processor.IngressQueue;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;

import java.time.Duration;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Entry point of the pipeline shared by the receivers: decodes OTLP requests against the collector's resource
 * and enqueues the resulting records.
 */
public class TelemetryIngest {

    static final AttributeKey<String> TRANSPORT = AttributeKey.stringKey("transport");
    static final AttributeKey<String> SIGNAL = AttributeKey.stringKey("signal");

    private final IngressQueue queue;
    private final Duration enqueueTimeout;
    private final OtlpDecoder decoder;
    private final Set<SignalType> acceptedSignals = EnumSet.noneOf(SignalType.class);
    private final LongCounter acceptedRecordsCounter;
    private final LongCounter refusedRecordsCounter;

    public TelemetryIngest(CollectorContext context, IngressQueue queue) {
        this.queue = Objects.requireNonNull(queue);
        this.enqueueTimeout = context.config().processors().queue().enqueueTimeout();
        this.decoder = new OtlpDecoder(context.resource());
        for (SignalType signal : SignalType.values()) {
            if (!context.config().exportersFor(signal).isEmpty()) {
                acceptedSignals.add(signal);
            }
        }
        this.acceptedRecordsCounter = context.meter().counterBuilder("receiver.accepted_records")
                .setDescription("Number of records pushed into the pipeline").build();
        this.refusedRecordsCounter = context.meter().counterBuilder("receiver.refused_records")
                .setDescription("Number of records refused because the pipeline was full").build();
    }

    public OtlpDecoder decoder() {
        return decoder;
    }

    public boolean accepts(SignalType signal) {
        return acceptedSignals.contains(signal);
    }

    public Duration retryAfter() {
        return enqueueTimeout.compareTo(Duration.ofSeconds(1)) < 0 ? Duration.ofSeconds(1) : enqueueTimeout;
    }

    public void submit(SignalType signal, List<TelemetryRecord> records, String transport) throws BackpressureException {
        Attributes attributes = Attributes.of(TRANSPORT, transport, SIGNAL, signal.pipelineName());
        try {
            queue.offer(records, enqueueTimeout);
        } catch (BackpressureException e) {
            refusedRecordsCounter.add(records.size(), attributes);
            throw e;
        }
        acceptedRecordsCounter.add(records.size(), attributes);
    }
}
