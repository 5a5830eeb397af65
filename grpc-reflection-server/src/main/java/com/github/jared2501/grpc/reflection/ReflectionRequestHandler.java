/*
 * (c) Copyright 2018 Palantir Technologies Inc. All rights reserved.
 */

package com.github.jared2501.grpc.reflection;

import com.google.common.collect.ImmutableList;
import com.google.protobuf.ByteString;
import io.grpc.Status;
import io.grpc.reflection.v1alpha.ErrorResponse;
import io.grpc.reflection.v1alpha.ExtensionNumberResponse;
import io.grpc.reflection.v1alpha.ExtensionRequest;
import io.grpc.reflection.v1alpha.FileDescriptorResponse;
import io.grpc.reflection.v1alpha.ListServiceResponse;
import io.grpc.reflection.v1alpha.ServerReflectionRequest;
import io.grpc.reflection.v1alpha.ServerReflectionResponse;
import io.grpc.reflection.v1alpha.ServiceResponse;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/** Answers a single {@link ServerReflectionRequest} from a {@link DescriptorIndex}. */
final class ReflectionRequestHandler {

    private final ImmutableList<String> serviceNames;
    private final DescriptorIndex index;

    ReflectionRequestHandler(List<String> serviceNames, DescriptorIndex index) {
        this.serviceNames = ImmutableList.copyOf(serviceNames);
        this.index = index;
    }

    /**
     * Builds the response to {@code request}. Lookup misses are answered with an in-band {@link ErrorResponse}.
     *
     * @throws io.grpc.StatusRuntimeException with {@link Status#INVALID_ARGUMENT} if the request sets no known case
     */
    ServerReflectionResponse handle(ServerReflectionRequest request) {
        ServerReflectionResponse.Builder response = ServerReflectionResponse.newBuilder()
                .setValidHost(request.getHost())
                .setOriginalRequest(request);

        switch (request.getMessageRequestCase()) {
            case FILE_BY_FILENAME:
                return fileByFilename(request.getFileByFilename(), response);
            case FILE_CONTAINING_SYMBOL:
                return fileContainingSymbol(request.getFileContainingSymbol(), response);
            case FILE_CONTAINING_EXTENSION:
                return fileContainingExtension(request.getFileContainingExtension(), response);
            case ALL_EXTENSION_NUMBERS_OF_TYPE:
                return allExtensionNumbersOfType(request.getAllExtensionNumbersOfType(), response);
            case LIST_SERVICES:
                return listServices(response);
            case MESSAGEREQUEST_NOT_SET:
            default:
                throw Status.INVALID_ARGUMENT
                        .withDescription("invalid MessageRequest: " + request.getMessageRequestCase())
                        .asRuntimeException();
        }
    }

    private ServerReflectionResponse fileByFilename(String fileName, ServerReflectionResponse.Builder response) {
        Optional<ByteString> descriptor = index.descriptorForFile(fileName);
        if (!descriptor.isPresent()) {
            return notFound(response, String.format("could not find descriptor for file \"%s\"", fileName));
        }
        return fileDescriptor(response, descriptor.get());
    }

    private ServerReflectionResponse fileContainingSymbol(String symbol, ServerReflectionResponse.Builder response) {
        Optional<ByteString> descriptor = index.descriptorForSymbol(symbol);
        if (!descriptor.isPresent()) {
            return notFound(response, String.format("could not find descriptor for symbol \"%s\"", symbol));
        }
        return fileDescriptor(response, descriptor.get());
    }

    private ServerReflectionResponse fileContainingExtension(
            ExtensionRequest extension, ServerReflectionResponse.Builder response) {
        String typeName = extension.getContainingType();
        int number = extension.getExtensionNumber();
        if (!index.extensionNumbersOfType(typeName).isPresent()) {
            return notFound(response, String.format("could not find extension type \"%s\"", typeName));
        }
        Optional<ByteString> descriptor = index.descriptorForExtensionAndNumber(typeName, number);
        if (!descriptor.isPresent()) {
            return notFound(
                    response, String.format("could not find extension number %d on type \"%s\"", number, typeName));
        }
        return fileDescriptor(response, descriptor.get());
    }

    private ServerReflectionResponse allExtensionNumbersOfType(
            String typeName, ServerReflectionResponse.Builder response) {
        Optional<Set<Integer>> numbers = index.extensionNumbersOfType(typeName);
        if (!numbers.isPresent()) {
            return notFound(response, String.format("could not find extension type \"%s\"", typeName));
        }
        return response
                .setAllExtensionNumbersResponse(ExtensionNumberResponse.newBuilder()
                        .setBaseTypeName(typeName)
                        .addAllExtensionNumber(numbers.get()))
                .build();
    }

    private ServerReflectionResponse listServices(ServerReflectionResponse.Builder response) {
        ListServiceResponse.Builder services = ListServiceResponse.newBuilder();
        for (String serviceName : serviceNames) {
            services.addService(ServiceResponse.newBuilder().setName(serviceName));
        }
        return response.setListServicesResponse(services).build();
    }

    // Descriptors are served exactly as indexed: one uncompressed file, without its dependencies.
    private static ServerReflectionResponse fileDescriptor(
            ServerReflectionResponse.Builder response, ByteString descriptor) {
        return response
                .setFileDescriptorResponse(FileDescriptorResponse.newBuilder().addFileDescriptorProto(descriptor))
                .build();
    }

    private static ServerReflectionResponse notFound(ServerReflectionResponse.Builder response, String message) {
        return response
                .setErrorResponse(ErrorResponse.newBuilder()
                        .setErrorCode(Status.Code.NOT_FOUND.value())
                        .setErrorMessage(message))
                .build();
    }
}
