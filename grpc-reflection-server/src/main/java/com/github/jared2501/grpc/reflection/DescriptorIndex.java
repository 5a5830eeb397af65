/*
 * (c) Copyright 2018 Palantir Technologies Inc. All rights reserved.
 */

package com.github.jared2501.grpc.reflection;

import com.google.protobuf.ByteString;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves file names, symbols and extensions to the serialized, uncompressed
 * {@link com.google.protobuf.DescriptorProtos.FileDescriptorProto} that declares them.
 */
public interface DescriptorIndex {

    Optional<ByteString> descriptorForFile(String fileName);

    /** Looks up a message, enum, service or method by its fully-qualified dotted name. */
    Optional<ByteString> descriptorForSymbol(String symbol);

    Optional<ByteString> descriptorForExtensionAndNumber(String extensionName, int number);

    /** Every extension number indexed under {@code extensionName}, or empty if the name is unknown. */
    Optional<Set<Integer>> extensionNumbersOfType(String extensionName);
}
