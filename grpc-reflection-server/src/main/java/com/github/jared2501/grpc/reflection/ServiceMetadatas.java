/*
 * (c) Copyright 2018 Palantir Technologies Inc. All rights reserved.
 */

package com.github.jared2501.grpc.reflection;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Queues;
import com.google.common.collect.Sets;
import com.google.protobuf.ByteString;
import com.google.protobuf.Descriptors.FileDescriptor;
import io.grpc.ServerServiceDefinition;
import io.grpc.ServiceDescriptor;
import io.grpc.protobuf.ProtoFileDescriptorSupplier;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Optional;
import java.util.Queue;
import java.util.Set;
import java.util.zip.GZIPOutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Static utilities for collecting {@link ServiceMetadata} from compiled protobuf services. */
public final class ServiceMetadatas {

    private static final Logger log = LoggerFactory.getLogger(ServiceMetadatas.class);

    private ServiceMetadatas() {}

    /**
     * Creates the metadata for {@code serviceName} declared in {@code file}: the file itself followed by its transitive
     * dependencies in breadth-first order, each included once.
     */
    public static ServiceMetadata forFileDescriptor(String serviceName, FileDescriptor file) {
        ServiceMetadata.Builder metadata = ServiceMetadata.builder().serviceName(serviceName);

        Set<String> seenFiles = Sets.newHashSet(file.getName());
        Queue<FileDescriptor> frontier = Queues.newArrayDeque();
        frontier.add(file);
        while (!frontier.isEmpty()) {
            FileDescriptor next = frontier.remove();
            metadata.addFileDescriptors(compress(next.toProto().toByteString()));
            for (FileDescriptor dependency : next.getDependencies()) {
                if (seenFiles.add(dependency.getName())) {
                    frontier.add(dependency);
                }
            }
        }
        return metadata.build();
    }

    /** Returns the metadata of a generated protobuf service, or empty if it carries no file descriptor. */
    public static Optional<ServiceMetadata> forService(ServerServiceDefinition service) {
        ServiceDescriptor serviceDescriptor = service.getServiceDescriptor();
        Object schemaDescriptor = serviceDescriptor.getSchemaDescriptor();
        if (!(schemaDescriptor instanceof ProtoFileDescriptorSupplier)) {
            return Optional.empty();
        }
        FileDescriptor file = ((ProtoFileDescriptorSupplier) schemaDescriptor).getFileDescriptor();
        return Optional.of(forFileDescriptor(serviceDescriptor.getName(), file));
    }

    public static List<ServiceMetadata> forServices(Iterable<ServerServiceDefinition> services) {
        ImmutableList.Builder<ServiceMetadata> metadata = ImmutableList.builder();
        for (ServerServiceDefinition service : services) {
            Optional<ServiceMetadata> serviceMetadata = forService(service);
            if (serviceMetadata.isPresent()) {
                metadata.add(serviceMetadata.get());
            } else {
                log.debug("Service has no protobuf file descriptor, not reflecting it. service={}",
                        service.getServiceDescriptor().getName());
            }
        }
        return metadata.build();
    }

    static ByteString compress(ByteString raw) {
        ByteString.Output out = ByteString.newOutput();
        try (GZIPOutputStream gzip = new GZIPOutputStream(out)) {
            raw.writeTo(gzip);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to compress file descriptor", e);
        }
        return out.toByteString();
    }
}
