/*
 * (c) Copyright 2018 Palantir Technologies Inc. All rights reserved.
 */

package com.github.jared2501.grpc.reflection;

import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import io.grpc.reflection.v1alpha.ServerReflectionRequest;
import io.grpc.reflection.v1alpha.ServerReflectionResponse;
import io.grpc.stub.ServerCallStreamObserver;
import io.grpc.stub.StreamObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives one reflection stream: every request is answered with exactly one response, in order, until the client
 * half-closes, the transport fails, or a request is invalid.
 * <p>
 * When the stream supports it, inbound flow control is manual so that the next request is only pulled once the
 * previous response has been written.
 */
final class ReflectionRequestObserver implements StreamObserver<ServerReflectionRequest> {

    private static final Logger log = LoggerFactory.getLogger(ReflectionRequestObserver.class);

    private enum State {
        OPEN,
        CLOSED
    }

    private final ReflectionRequestHandler handler;
    private final StreamObserver<ServerReflectionResponse> responseObserver;
    private final ServerCallStreamObserver<ServerReflectionResponse> flowControl;

    private State state = State.OPEN;

    ReflectionRequestObserver(
            ReflectionRequestHandler handler, StreamObserver<ServerReflectionResponse> responseObserver) {
        this.handler = handler;
        this.responseObserver = responseObserver;
        if (responseObserver instanceof ServerCallStreamObserver) {
            flowControl = (ServerCallStreamObserver<ServerReflectionResponse>) responseObserver;
            flowControl.disableAutoInboundFlowControl();
        } else {
            flowControl = null;
        }
    }

    /** Requests the first message. Must be called before the observer is returned to the transport. */
    void start() {
        requestNext();
    }

    @Override
    public void onNext(ServerReflectionRequest request) {
        if (state == State.CLOSED) {
            log.debug("Ignoring reflection request received after the stream closed. case={}",
                    request.getMessageRequestCase());
            return;
        }

        ServerReflectionResponse response;
        try {
            response = handler.handle(request);
        } catch (StatusRuntimeException e) {
            log.warn("Closing reflection stream on invalid request. status={}", e.getStatus());
            state = State.CLOSED;
            responseObserver.onError(e);
            return;
        }

        try {
            responseObserver.onNext(response);
        } catch (RuntimeException e) {
            state = State.CLOSED;
            throw e;
        }
        requestNext();
    }

    @Override
    public void onError(Throwable error) {
        log.debug("Reflection stream failed. status={}", Status.fromThrowable(error), error);
        state = State.CLOSED;
    }

    @Override
    public void onCompleted() {
        if (state == State.CLOSED) {
            return;
        }
        log.debug("Reflection stream completed by client");
        state = State.CLOSED;
        responseObserver.onCompleted();
    }

    private void requestNext() {
        if (flowControl != null) {
            flowControl.request(1);
        }
    }
}
