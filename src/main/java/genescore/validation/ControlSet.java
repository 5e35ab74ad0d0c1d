/*
 * The MIT License
 *
 * Copyright (c) 2025 The Broad Institute
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */

package genescore.validation;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.base.Preconditions;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A named, immutable set of gene symbols used as positive or negative controls. Every symbol carries the sources
 * that list it; a symbol listed by several sources is still one control gene.
 */
public final class ControlSet {
    private final String name;
    private final ControlRole role;
    private final ImmutableMap<String, ImmutableSet<String>> sourcesBySymbol;

    private ControlSet(final String name, final ControlRole role, final Map<String, Set<String>> sourcesBySymbol) {
        this.name = name;
        this.role = role;
        final ImmutableMap.Builder<String, ImmutableSet<String>> builder = ImmutableMap.builder();
        sourcesBySymbol.forEach((symbol, sources) -> builder.put(symbol, ImmutableSet.copyOf(sources)));
        this.sourcesBySymbol = builder.build();
    }

    public static Builder builder(final String name, final ControlRole role) {
        return new Builder(name, role);
    }

    public String getName() {
        return name;
    }

    public ControlRole getRole() {
        return role;
    }

    /** Unique symbols in the order they were first added. */
    public ImmutableSet<String> getSymbols() {
        return sourcesBySymbol.keySet();
    }

    public ImmutableSet<String> getSources(final String symbol) {
        final ImmutableSet<String> sources = sourcesBySymbol.get(symbol);
        return sources == null ? ImmutableSet.of() : sources;
    }

    /** All source tags, sorted. */
    public Set<String> getAllSources() {
        return sourcesBySymbol.values().stream()
                .flatMap(Set::stream)
                .sorted()
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    public Set<String> getSymbolsForSource(final String source) {
        return sourcesBySymbol.entrySet().stream()
                .filter(e -> e.getValue().contains(source))
                .map(Map.Entry::getKey)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    public int size() {
        return sourcesBySymbol.size();
    }

    /** A new set holding the symbols of both; the name and role are this set's. */
    public ControlSet union(final ControlSet other) {
        final Builder builder = builder(name, role);
        for (final ControlSet set : new ControlSet[]{this, other}) {
            set.sourcesBySymbol.forEach((symbol, sources) -> sources.forEach(source -> builder.add(symbol, source)));
        }
        return builder.build();
    }

    @Override
    public String toString() {
        return name + " (" + role + ", " + size() + " genes)";
    }

    public static class Builder {
        private final String name;
        private final ControlRole role;
        private final Map<String, Set<String>> sourcesBySymbol = new LinkedHashMap<>();

        private Builder(final String name, final ControlRole role) {
            this.name = Preconditions.checkNotNull(name);
            this.role = Preconditions.checkNotNull(role);
        }

        public Builder add(final String symbol, final String source) {
            Preconditions.checkArgument(symbol != null && !symbol.isEmpty(), "control gene symbol must not be empty");
            sourcesBySymbol.computeIfAbsent(symbol, s -> new LinkedHashSet<>()).add(source == null || source.isEmpty() ? name : source);
            return this;
        }

        public ControlSet build() {
            return new ControlSet(name, role, sourcesBySymbol);
        }
    }
}
