/*
 * (c) Copyright 2018 Palantir Technologies Inc. All rights reserved.
 */

package com.github.jared2501.grpc.reflection;

import static org.assertj.core.api.Assertions.assertThat;

import com.github.jared2501.grpc.reflection.test.KeyValueGrpc;
import com.github.jared2501.grpc.reflection.test.KeyValueServiceImpl;
import com.google.common.collect.ImmutableList;
import com.google.protobuf.ByteString;
import com.google.protobuf.DescriptorProtos.FileDescriptorProto;
import com.google.protobuf.InvalidProtocolBufferException;
import io.grpc.BindableService;
import io.grpc.ManagedChannel;
import io.grpc.Server;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import io.grpc.inprocess.InProcessChannelBuilder;
import io.grpc.inprocess.InProcessServerBuilder;
import io.grpc.reflection.v1alpha.ExtensionRequest;
import io.grpc.reflection.v1alpha.ServerReflectionGrpc;
import io.grpc.reflection.v1alpha.ServerReflectionProto;
import io.grpc.reflection.v1alpha.ServerReflectionRequest;
import io.grpc.reflection.v1alpha.ServerReflectionResponse;
import io.grpc.reflection.v1alpha.ServiceResponse;
import io.grpc.stub.StreamObserver;
import java.io.IOException;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ServerReflectionServiceIntegrationTest {

    private static final String PACKAGE = "com.github.jared2501.grpc.reflection.test";

    private Server server;
    private ManagedChannel channel;

    @BeforeEach
    void setUp() throws IOException {
        BindableService keyValue = new KeyValueServiceImpl();
        server = InProcessServerBuilder.forName("reflection-test")
                .addService(keyValue)
                .addService(ServerReflectionService.forServices(ImmutableList.of(keyValue.bindService())))
                .build()
                .start();
        channel = InProcessChannelBuilder.forName("reflection-test").build();
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        channel.shutdown();
        channel.awaitTermination(5, TimeUnit.SECONDS);
        server.shutdown();
        server.awaitTermination();
    }

    @Test
    void successfulRoundTrip() throws InvalidProtocolBufferException {
        List<ServerReflectionResponse> responses = exchange(
                ServerReflectionRequest.newBuilder().setHost("localhost").setListServices("*").build(),
                ServerReflectionRequest.newBuilder().setFileContainingSymbol(KeyValueGrpc.SERVICE_NAME).build(),
                ServerReflectionRequest.newBuilder().setFileByFilename("transitive.proto").build(),
                ServerReflectionRequest.newBuilder().setFileContainingSymbol("google.protobuf.Empty").build(),
                ServerReflectionRequest.newBuilder()
                        .setFileContainingExtension(ExtensionRequest.newBuilder()
                                .setContainingType(PACKAGE + ".read_only")
                                .setExtensionNumber(50001))
                        .build(),
                ServerReflectionRequest.newBuilder().setAllExtensionNumbersOfType(PACKAGE + ".read_only").build(),
                ServerReflectionRequest.newBuilder().setFileByFilename("missing.proto").build());

        assertThat(responses).hasSize(7);
        assertThat(responses.get(0).getValidHost()).isEqualTo("localhost");
        assertThat(responses.get(0).getListServicesResponse().getServiceList())
                .extracting(ServiceResponse::getName)
                .containsExactly(KeyValueGrpc.SERVICE_NAME, ServerReflectionGrpc.SERVICE_NAME);
        assertThat(fileName(responses.get(1))).isEqualTo("test.proto");
        assertThat(fileName(responses.get(2))).isEqualTo("transitive.proto");
        assertThat(fileName(responses.get(3))).isEqualTo("google/protobuf/empty.proto");
        assertThat(fileName(responses.get(4))).isEqualTo("test.proto");
        assertThat(responses.get(5).getAllExtensionNumbersResponse().getExtensionNumberList()).containsExactly(50001);
        assertThat(responses.get(6).getErrorResponse().getErrorCode()).isEqualTo(Status.Code.NOT_FOUND.value());
    }

    @Test
    void reflectionServiceDescribesItself() throws InvalidProtocolBufferException {
        List<ServerReflectionResponse> responses = exchange(ServerReflectionRequest.newBuilder()
                .setFileContainingSymbol(ServerReflectionGrpc.SERVICE_NAME + ".ServerReflectionInfo")
                .build());

        assertThat(fileName(responses.get(0))).isEqualTo(ServerReflectionProto.getDescriptor().getName());
    }

    @Test
    void invalidRequestFailsStream() {
        CollectingResponseObserver observer = new CollectingResponseObserver();
        StreamObserver<ServerReflectionRequest> requests =
                ServerReflectionGrpc.newStub(channel).serverReflectionInfo(observer);

        requests.onNext(ServerReflectionRequest.newBuilder().setListServices("*").build());
        requests.onNext(ServerReflectionRequest.getDefaultInstance());
        observer.waitUntilComplete();

        assertThat(observer.getResponses()).hasSize(1);
        assertThat(observer.getError())
                .isInstanceOf(StatusRuntimeException.class)
                .matches(error -> ((StatusRuntimeException) error).getStatus().getCode()
                        == Status.Code.INVALID_ARGUMENT);
    }

    private List<ServerReflectionResponse> exchange(ServerReflectionRequest... requests) {
        CollectingResponseObserver observer = new CollectingResponseObserver();
        StreamObserver<ServerReflectionRequest> requestStream =
                ServerReflectionGrpc.newStub(channel).serverReflectionInfo(observer);
        for (ServerReflectionRequest request : requests) {
            requestStream.onNext(request);
        }
        requestStream.onCompleted();
        observer.waitUntilComplete();
        assertThat(observer.getError()).isNull();
        return observer.getResponses();
    }

    private static String fileName(ServerReflectionResponse response) throws InvalidProtocolBufferException {
        List<ByteString> files = response.getFileDescriptorResponse().getFileDescriptorProtoList();
        assertThat(files).hasSize(1);
        return FileDescriptorProto.parseFrom(files.get(0)).getName();
    }
}
