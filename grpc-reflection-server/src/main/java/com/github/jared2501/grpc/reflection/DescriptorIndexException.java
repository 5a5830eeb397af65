/*
 * (c) Copyright 2018 Palantir Technologies Inc. All rights reserved.
 */

package com.github.jared2501.grpc.reflection;

/** Raised when a {@link DescriptorIndex} cannot be built from the supplied {@link ServiceMetadata}. */
public class DescriptorIndexException extends RuntimeException {

    DescriptorIndexException(String message) {
        super(message);
    }

    DescriptorIndexException(String message, Throwable cause) {
        super(message, cause);
    }
}
