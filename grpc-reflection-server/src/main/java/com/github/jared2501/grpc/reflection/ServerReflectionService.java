/*
 * (c) Copyright 2018 Palantir Technologies Inc. All rights reserved.
 */

package com.github.jared2501.grpc.reflection;

import com.google.common.collect.ImmutableList;
import io.grpc.ServerServiceDefinition;
import io.grpc.reflection.v1alpha.ServerReflectionGrpc;
import io.grpc.reflection.v1alpha.ServerReflectionProto;
import io.grpc.reflection.v1alpha.ServerReflectionRequest;
import io.grpc.reflection.v1alpha.ServerReflectionResponse;
import io.grpc.stub.StreamObserver;
import java.util.List;

/**
 * A {@code grpc.reflection.v1alpha.ServerReflection} service answering from a fixed set of {@link ServiceMetadata}
 * indexed once at construction. The reflection service always reflects on itself as well.
 * <p>
 * Example:
 * <pre>{@code
 * KeyValueServiceImpl keyValue = new KeyValueServiceImpl();
 * Server server = ServerBuilder.forPort(8080)
 *         .addService(keyValue)
 *         .addService(ServerReflectionService.forServices(ImmutableList.of(keyValue.bindService())))
 *         .build();
 * }</pre>
 */
public final class ServerReflectionService extends ServerReflectionGrpc.ServerReflectionImplBase {

    private static final ServiceMetadata SELF_METADATA =
            ServiceMetadatas.forFileDescriptor(ServerReflectionGrpc.SERVICE_NAME, ServerReflectionProto.getDescriptor());

    private final ReflectionRequestHandler handler;

    private ServerReflectionService(IndexedServices indexedServices) {
        this.handler = new ReflectionRequestHandler(indexedServices.serviceNames(), indexedServices.index());
    }

    /**
     * Indexes {@code metadata}, followed by the reflection service's own metadata.
     *
     * @throws DescriptorIndexException if the metadata cannot be decoded or declares conflicting descriptors
     */
    public static ServerReflectionService newInstance(List<ServiceMetadata> metadata) {
        List<ServiceMetadata> allMetadata = ImmutableList.<ServiceMetadata>builder()
                .addAll(metadata)
                .add(SELF_METADATA)
                .build();
        return new ServerReflectionService(DescriptorIndexBuilder.index(allMetadata));
    }

    /** Reflects on every protobuf service in {@code services}; services without a file descriptor are skipped. */
    public static ServerReflectionService forServices(Iterable<ServerServiceDefinition> services) {
        return newInstance(ServiceMetadatas.forServices(services));
    }

    /** The metadata describing {@code grpc.reflection.v1alpha.ServerReflection} itself. */
    public static ServiceMetadata selfMetadata() {
        return SELF_METADATA;
    }

    @Override
    public StreamObserver<ServerReflectionRequest> serverReflectionInfo(
            StreamObserver<ServerReflectionResponse> responseObserver) {
        ReflectionRequestObserver requestObserver = new ReflectionRequestObserver(handler, responseObserver);
        requestObserver.start();
        return requestObserver;
    }
}
