/*
 * (c) Copyright 2018 Palantir Technologies Inc. All rights reserved.
 */

package com.github.jared2501.grpc.reflection;

import java.util.List;
import org.immutables.value.Value;
import org.immutables.value.Value.Style.ImplementationVisibility;

@Value.Immutable
@Value.Style(visibility = ImplementationVisibility.PACKAGE)
public interface IndexedServices {

    /** Service names in the order their metadata was indexed. */
    List<String> serviceNames();

    DescriptorIndex index();

    final class Builder extends ImmutableIndexedServices.Builder {}

    static Builder builder() {
        return new Builder();
    }
}
