/*
 * (c) Copyright 2018 Palantir Technologies Inc. All rights reserved.
 */

package com.github.jared2501.grpc.reflection;

import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.io.ByteStreams;
import com.google.protobuf.ByteString;
import com.google.protobuf.DescriptorProtos.DescriptorProto;
import com.google.protobuf.DescriptorProtos.EnumDescriptorProto;
import com.google.protobuf.DescriptorProtos.FieldDescriptorProto;
import com.google.protobuf.DescriptorProtos.FileDescriptorProto;
import com.google.protobuf.DescriptorProtos.MethodDescriptorProto;
import com.google.protobuf.DescriptorProtos.ServiceDescriptorProto;
import com.google.protobuf.InvalidProtocolBufferException;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Map;
import java.util.zip.GZIPInputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds a {@link DescriptorIndex} from the {@link ServiceMetadata} of every registered service.
 * <p>
 * Each service carries the full transitive closure of the files it needs, so the same file is usually supplied by
 * several services. Re-registering a file name, symbol or extension with byte-identical contents is a no-op; doing so
 * with different contents fails the whole build, and the first registration in iteration order is reported as the
 * baseline.
 */
public final class DescriptorIndexBuilder {

    private static final Logger log = LoggerFactory.getLogger(DescriptorIndexBuilder.class);

    private final List<String> serviceNames = Lists.newArrayList();
    private final Map<String, ByteString> descriptorsByFile = Maps.newLinkedHashMap();
    private final Map<String, String> serviceNamesByFile = Maps.newHashMap();
    private final Map<String, ByteString> descriptorsBySymbol = Maps.newLinkedHashMap();
    private final Map<String, Map<Integer, ByteString>> descriptorsByExtensionAndNumber = Maps.newLinkedHashMap();

    private DescriptorIndexBuilder() {}

    /**
     * Indexes {@code metadata} in order.
     *
     * @throws DescriptorDecodeException if a descriptor is not gzip-compressed or is not a file descriptor
     * @throws DescriptorConflictException if two different descriptors declare the same file, symbol or extension
     */
    public static IndexedServices index(List<ServiceMetadata> metadata) {
        DescriptorIndexBuilder builder = new DescriptorIndexBuilder();
        for (ServiceMetadata serviceMetadata : metadata) {
            builder.add(serviceMetadata);
        }
        return builder.build();
    }

    private void add(ServiceMetadata metadata) {
        serviceNames.add(metadata.serviceName());
        for (ByteString compressed : metadata.fileDescriptors()) {
            ByteString raw = decompress(compressed);
            FileDescriptorProto file = parse(raw);
            if (registerFile(metadata.serviceName(), file.getName(), raw)) {
                indexFile(raw, file);
            }
        }
    }

    private IndexedServices build() {
        DescriptorIndexImpl index =
                new DescriptorIndexImpl(descriptorsByFile, descriptorsBySymbol, descriptorsByExtensionAndNumber);
        log.info("Indexed reflection metadata. services={} files={} symbols={} extensions={}",
                serviceNames.size(),
                descriptorsByFile.size(),
                descriptorsBySymbol.size(),
                index.extensionCount());
        return IndexedServices.builder()
                .addAllServiceNames(serviceNames)
                .index(index)
                .build();
    }

    /** Returns false if an identical file was already indexed, in which case its declarations are too. */
    private boolean registerFile(String serviceName, String fileName, ByteString raw) {
        ByteString existing = descriptorsByFile.get(fileName);
        if (existing == null) {
            descriptorsByFile.put(fileName, raw);
            serviceNamesByFile.put(fileName, serviceName);
            return true;
        }
        if (!existing.equals(raw)) {
            throw DescriptorConflictException.forFile(fileName, serviceName, serviceNamesByFile.get(fileName));
        }
        log.debug("File already indexed, skipping. file={} service={} baseline={}",
                fileName, serviceName, serviceNamesByFile.get(fileName));
        return false;
    }

    private void indexFile(ByteString raw, FileDescriptorProto file) {
        String scope = file.getPackage();
        for (DescriptorProto message : file.getMessageTypeList()) {
            indexMessage(raw, scope, message);
        }
        for (EnumDescriptorProto enumType : file.getEnumTypeList()) {
            registerSymbol(raw, qualify(scope, enumType.getName()));
        }
        for (FieldDescriptorProto extension : file.getExtensionList()) {
            registerExtension(raw, scope, extension);
        }
        for (ServiceDescriptorProto service : file.getServiceList()) {
            indexService(raw, scope, service);
        }
    }

    private void indexMessage(ByteString raw, String scope, DescriptorProto message) {
        String messageName = qualify(scope, message.getName());
        registerSymbol(raw, messageName);
        for (DescriptorProto nested : message.getNestedTypeList()) {
            indexMessage(raw, messageName, nested);
        }
        for (EnumDescriptorProto enumType : message.getEnumTypeList()) {
            registerSymbol(raw, qualify(messageName, enumType.getName()));
        }
        for (FieldDescriptorProto extension : message.getExtensionList()) {
            registerExtension(raw, messageName, extension);
        }
    }

    private void indexService(ByteString raw, String scope, ServiceDescriptorProto service) {
        String serviceName = qualify(scope, service.getName());
        registerSymbol(raw, serviceName);
        for (MethodDescriptorProto method : service.getMethodList()) {
            registerSymbol(raw, qualify(serviceName, method.getName()));
        }
    }

    private void registerSymbol(ByteString raw, String symbol) {
        ByteString existing = descriptorsBySymbol.putIfAbsent(symbol, raw);
        if (existing != null && !existing.equals(raw)) {
            throw DescriptorConflictException.forSymbol(symbol);
        }
    }

    // Keyed by the extension's own scoped name, e.g. "Foo.isAFoo" for an extension declared inside message Foo.
    private void registerExtension(ByteString raw, String scope, FieldDescriptorProto extension) {
        String extensionName = qualify(scope, extension.getName());
        int number = extension.getNumber();
        ByteString existing = descriptorsByExtensionAndNumber
                .computeIfAbsent(extensionName, name -> Maps.newLinkedHashMap())
                .putIfAbsent(number, raw);
        if (existing != null && !existing.equals(raw)) {
            throw DescriptorConflictException.forExtension(extensionName, number);
        }
    }

    private static String qualify(String scope, String name) {
        if (scope.isEmpty()) {
            return name;
        }
        return scope + "." + name;
    }

    private static ByteString decompress(ByteString compressed) {
        try (InputStream in = new GZIPInputStream(compressed.newInput())) {
            return ByteString.copyFrom(ByteStreams.toByteArray(in));
        } catch (IOException e) {
            throw new DescriptorDecodeException("failed to decompress descriptor: " + e.getMessage(), e);
        }
    }

    private static FileDescriptorProto parse(ByteString raw) {
        try {
            return FileDescriptorProto.parseFrom(raw);
        } catch (InvalidProtocolBufferException e) {
            throw new DescriptorDecodeException("bad descriptor: " + e.getMessage(), e);
        }
    }
}
