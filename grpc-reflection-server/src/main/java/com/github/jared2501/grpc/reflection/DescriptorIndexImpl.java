/*
 * (c) Copyright 2018 Palantir Technologies Inc. All rights reserved.
 */

package com.github.jared2501.grpc.reflection;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableMap;
import com.google.protobuf.ByteString;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/** An immutable {@link DescriptorIndex}, safe to share between any number of concurrent reflection streams. */
final class DescriptorIndexImpl implements DescriptorIndex {

    private final ImmutableMap<String, ByteString> descriptorsByFile;
    private final ImmutableMap<String, ByteString> descriptorsBySymbol;
    private final ImmutableMap<String, ImmutableMap<Integer, ByteString>> descriptorsByExtensionAndNumber;

    DescriptorIndexImpl(
            Map<String, ByteString> descriptorsByFile,
            Map<String, ByteString> descriptorsBySymbol,
            Map<String, ? extends Map<Integer, ByteString>> descriptorsByExtensionAndNumber) {
        this.descriptorsByFile = ImmutableMap.copyOf(descriptorsByFile);
        this.descriptorsBySymbol = ImmutableMap.copyOf(descriptorsBySymbol);
        ImmutableMap.Builder<String, ImmutableMap<Integer, ByteString>> extensions = ImmutableMap.builder();
        descriptorsByExtensionAndNumber.forEach((name, numbers) -> extensions.put(name, ImmutableMap.copyOf(numbers)));
        this.descriptorsByExtensionAndNumber = extensions.build();
    }

    @Override
    public Optional<ByteString> descriptorForFile(String fileName) {
        return Optional.ofNullable(descriptorsByFile.get(fileName));
    }

    @Override
    public Optional<ByteString> descriptorForSymbol(String symbol) {
        return Optional.ofNullable(descriptorsBySymbol.get(symbol));
    }

    @Override
    public Optional<ByteString> descriptorForExtensionAndNumber(String extensionName, int number) {
        ImmutableMap<Integer, ByteString> numbers = descriptorsByExtensionAndNumber.get(extensionName);
        if (numbers == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(numbers.get(number));
    }

    @Override
    public Optional<Set<Integer>> extensionNumbersOfType(String extensionName) {
        ImmutableMap<Integer, ByteString> numbers = descriptorsByExtensionAndNumber.get(extensionName);
        if (numbers == null) {
            return Optional.empty();
        }
        return Optional.of(numbers.keySet());
    }

    /** Number of distinct (extension name, number) pairs. */
    int extensionCount() {
        return descriptorsByExtensionAndNumber.values().stream().mapToInt(ImmutableMap::size).sum();
    }

    @VisibleForTesting
    ImmutableMap<String, ByteString> descriptorsByFile() {
        return descriptorsByFile;
    }

    @VisibleForTesting
    ImmutableMap<String, ByteString> descriptorsBySymbol() {
        return descriptorsBySymbol;
    }

    @VisibleForTesting
    ImmutableMap<String, ImmutableMap<Integer, ByteString>> descriptorsByExtensionAndNumber() {
        return descriptorsByExtensionAndNumber;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("files", descriptorsByFile.keySet())
                .add("symbols", descriptorsBySymbol.keySet())
                .add("extensions", descriptorsByExtensionAndNumber.keySet())
                .toString();
    }
}
