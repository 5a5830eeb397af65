/*
 * (c) Copyright 2018 Palantir Technologies Inc. All rights reserved.
 */

package com.github.jared2501.grpc.reflection;

import com.google.protobuf.ByteString;
import java.util.List;
import org.immutables.value.Value;
import org.immutables.value.Value.Style.ImplementationVisibility;

/**
 * The schema of a single registered service, as handed to the {@link ServerReflectionService reflection service}.
 */
@Value.Immutable
@Value.Style(visibility = ImplementationVisibility.PACKAGE)
public interface ServiceMetadata {

    /** The fully-qualified service name. May be empty for anonymous registrations. */
    String serviceName();

    /**
     * Gzip-compressed serialized {@link com.google.protobuf.DescriptorProtos.FileDescriptorProto}s: the file
     * declaring the service followed by every file it transitively depends on.
     */
    List<ByteString> fileDescriptors();

    final class Builder extends ImmutableServiceMetadata.Builder {}

    static Builder builder() {
        return new Builder();
    }
}
