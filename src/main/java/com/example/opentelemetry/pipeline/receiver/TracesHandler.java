package com.example.opentelemetry.pipeline.receiver;

import com.example.opentelemetry.pipeline.model.SignalType;
import com.example.opentelemetry.pipeline.otlp.MalformedPayloadException;
import com.example.opentelemetry.pipeline.processor.BackpressureException;
import io.grpc.stub.StreamObserver;
import io.opentelemetry.proto.collector.trace.v1.ExportTraceServiceRequest;
import io.opentelemetry.proto.collector.trace.v1.ExportTraceServiceResponse;
import io.opentelemetry.proto.collector.trace.v1.TraceServiceGrpc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class TracesHandler extends TraceServiceGrpc.TraceServiceImplBase {
    final Logger logger = LoggerFactory.getLogger(getClass());
    final TelemetryIngest ingest;

    public TracesHandler(TelemetryIngest ingest) {
        this.ingest = ingest;
    }

    @Override
    public void export(ExportTraceServiceRequest request, StreamObserver<ExportTraceServiceResponse> responseObserver) {
        long receivedNanoTime = System.nanoTime();
        if (!ingest.accepts(SignalType.SPAN)) {
            responseObserver.onError(GrpcStatuses.signalDisabled(SignalType.SPAN));
            return;
        }
        try {
            ingest.submit(SignalType.SPAN, ingest.decoder().decodeTraces(request, receivedNanoTime), OtlpGrpcReceiver.TRANSPORT);
        } catch (MalformedPayloadException e) {
            logger.debug("Reject traces request: {}", e.getMessage());
            responseObserver.onError(GrpcStatuses.malformed(e));
            return;
        } catch (BackpressureException e) {
            responseObserver.onError(GrpcStatuses.backpressure(e));
            return;
        }
        responseObserver.onNext(ExportTraceServiceResponse.getDefaultInstance());
        responseObserver.onCompleted();
    }
}
