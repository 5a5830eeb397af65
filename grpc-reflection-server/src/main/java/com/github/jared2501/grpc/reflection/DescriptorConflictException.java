/*
 * (c) Copyright 2018 Palantir Technologies Inc. All rights reserved.
 */

package com.github.jared2501.grpc.reflection;

/** Two descriptors with different contents claim the same file name, symbol or extension. */
public final class DescriptorConflictException extends DescriptorIndexException {

    private DescriptorConflictException(String message) {
        super(message);
    }

    static DescriptorConflictException forFile(String fileName, String serviceName, String baselineServiceName) {
        return new DescriptorConflictException(String.format(
                "raw filedescriptor for \"%s\" provided by service \"%s\" do not match bytes provided by service \"%s\"",
                fileName, serviceName, baselineServiceName));
    }

    static DescriptorConflictException forSymbol(String symbol) {
        return new DescriptorConflictException(String.format("symbol name already indexed: \"%s\"", symbol));
    }

    static DescriptorConflictException forExtension(String extensionName, int number) {
        return new DescriptorConflictException(String.format(
                "extension name and number already indexed: \"%s\" %d", extensionName, number));
    }
}
