package com.example.opentelemetry.pipeline.receiver;

import com.example.opentelemetry.pipeline.model.SignalType;
import com.example.opentelemetry.pipeline.otlp.MalformedPayloadException;
import com.example.opentelemetry.pipeline.processor.BackpressureException;
import io.grpc.stub.StreamObserver;
import io.opentelemetry.proto.collector.metrics.v1.ExportMetricsServiceRequest;
import io.opentelemetry.proto.collector.metrics.v1.ExportMetricsServiceResponse;
import io.opentelemetry.proto.collector.metrics.v1.MetricsServiceGrpc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class MetricsHandler extends MetricsServiceGrpc.MetricsServiceImplBase {
    final Logger logger = LoggerFactory.getLogger(getClass());
    final TelemetryIngest ingest;

    public MetricsHandler(TelemetryIngest ingest) {
        this.ingest = ingest;
    }

    @Override
    public void export(ExportMetricsServiceRequest request, StreamObserver<ExportMetricsServiceResponse> responseObserver) {
        long receivedNanoTime = System.nanoTime();
        if (!ingest.accepts(SignalType.METRIC)) {
            responseObserver.onError(GrpcStatuses.signalDisabled(SignalType.METRIC));
            return;
        }
        try {
            ingest.submit(SignalType.METRIC, ingest.decoder().decodeMetrics(request, receivedNanoTime), OtlpGrpcReceiver.TRANSPORT);
        } catch (MalformedPayloadException e) {
            logger.debug("Reject metrics request: {}", e.getMessage());
            responseObserver.onError(GrpcStatuses.malformed(e));
            return;
        } catch (BackpressureException e) {
            responseObserver.onError(GrpcStatuses.backpressure(e));
            return;
        }
        responseObserver.onNext(ExportMetricsServiceResponse.getDefaultInstance());
        responseObserver.onCompleted();
    }
}
