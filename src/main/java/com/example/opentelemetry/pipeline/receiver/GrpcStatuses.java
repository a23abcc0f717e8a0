package com.example.opentelemetry.pipeline.receiver;

import com.example.opentelemetry.pipeline.model.SignalType;
import com.example.opentelemetry.pipeline.otlp.MalformedPayloadException;
import com.example.opentelemetry.pipeline.processor.BackpressureException;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;

final class GrpcStatuses {

    private GrpcStatuses() {
    }

    static StatusRuntimeException malformed(MalformedPayloadException e) {
        return Status.INVALID_ARGUMENT.withDescription(e.getMessage()).asRuntimeException();
    }

    static StatusRuntimeException backpressure(BackpressureException e) {
        return Status.UNAVAILABLE.withDescription(e.getMessage()).asRuntimeException();
    }

    static StatusRuntimeException signalDisabled(SignalType signal) {
        return Status.UNIMPLEMENTED.withDescription("no " + signal.pipelineName() + " pipeline configured").asRuntimeException();
    }
}
