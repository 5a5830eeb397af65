/*
 * (c) Copyright 2018 Palantir Technologies Inc. All rights reserved.
 */

package com.github.jared2501.grpc.reflection.test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import com.google.protobuf.Empty;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import io.grpc.stub.StreamObserver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class KeyValueServiceImplTest {
    private static final Entry ENTRY = Entry.newBuilder()
            .setKey("key")
            .setValue("value")
            .setVisibility(Entry.Visibility.SECRET)
            .build();

    @Mock
    private StreamObserver<GetValueResponse> getObs;

    @Mock
    private StreamObserver<Empty> setObs;

    private KeyValueServiceImpl service;

    @BeforeEach
    void before() {
        service = new KeyValueServiceImpl();
    }

    @Test
    void setThenGet() {
        service.setValue(SetValueRequest.newBuilder().setEntry(ENTRY).build(), setObs);
        verify(setObs).onNext(Empty.getDefaultInstance());
        verify(setObs).onCompleted();

        service.getValue(GetValueRequest.newBuilder().setKey("key").build(), getObs);
        verify(getObs).onNext(GetValueResponse.newBuilder().setEntry(ENTRY).build());
        verify(getObs).onCompleted();
    }

    @Test
    void getMissingKey() {
        service.getValue(GetValueRequest.newBuilder().setKey("missing").build(), getObs);

        ArgumentCaptor<Throwable> error = ArgumentCaptor.forClass(Throwable.class);
        verify(getObs).onError(error.capture());
        verify(getObs, never()).onNext(any());
        assertThat(error.getValue()).isInstanceOf(StatusRuntimeException.class);
        assertThat(Status.fromThrowable(error.getValue()).getCode()).isEqualTo(Status.Code.NOT_FOUND);
    }

    @Test
    void setEmptyKey() {
        service.setValue(SetValueRequest.newBuilder().setEntry(Entry.getDefaultInstance()).build(), setObs);

        ArgumentCaptor<Throwable> error = ArgumentCaptor.forClass(Throwable.class);
        verify(setObs).onError(error.capture());
        verify(setObs, never()).onCompleted();
        assertThat(Status.fromThrowable(error.getValue()).getCode()).isEqualTo(Status.Code.INVALID_ARGUMENT);
    }
}
