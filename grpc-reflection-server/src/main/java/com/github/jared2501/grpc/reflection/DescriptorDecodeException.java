/*
 * (c) Copyright 2018 Palantir Technologies Inc. All rights reserved.
 */

package com.github.jared2501.grpc.reflection;

/** A compressed descriptor could not be decompressed, or its bytes are not a file descriptor. */
public final class DescriptorDecodeException extends DescriptorIndexException {

    DescriptorDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
