package com.example.opentelemetry.pipeline.receiver;

import com.example.opentelemetry.pipeline.model.SignalType;
import com.example.opentelemetry.pipeline.otlp.MalformedPayloadException;
import com.example.opentelemetry.pipeline.processor.BackpressureException;
import io.grpc.stub.StreamObserver;
import io.opentelemetry.proto.collector.logs.v1.ExportLogsServiceRequest;
import io.opentelemetry.proto.collector.logs.v1.ExportLogsServiceResponse;
import io.opentelemetry.proto.collector.logs.v1.LogsServiceGrpc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LogsHandler extends LogsServiceGrpc.LogsServiceImplBase {
    final Logger logger = LoggerFactory.getLogger(getClass());
    final TelemetryIngest ingest;

    public LogsHandler(TelemetryIngest ingest) {
        this.ingest = ingest;
    }

    @Override
    public void export(ExportLogsServiceRequest request, StreamObserver<ExportLogsServiceResponse> responseObserver) {
        long receivedNanoTime = System.nanoTime();
        if (!ingest.accepts(SignalType.LOG)) {
            responseObserver.onError(GrpcStatuses.signalDisabled(SignalType.LOG));
            return;
        }
        try {
            ingest.submit(SignalType.LOG, ingest.decoder().decodeLogs(request, receivedNanoTime), OtlpGrpcReceiver.TRANSPORT);
        } catch (MalformedPayloadException e) {
            logger.debug("Reject logs request: {}", e.getMessage());
            responseObserver.onError(GrpcStatuses.malformed(e));
            return;
        } catch (BackpressureException e) {
            responseObserver.onError(GrpcStatuses.backpressure(e));
            return;
        }
        responseObserver.onNext(ExportLogsServiceResponse.getDefaultInstance());
        responseObserver.onCompleted();
    }
}
