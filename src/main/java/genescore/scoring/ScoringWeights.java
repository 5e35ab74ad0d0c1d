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

package genescore.scoring;

import com.google.common.collect.ImmutableMap;
import genescore.ConfigurationException;

import java.util.EnumMap;
import java.util.Map;

/**
 * Immutable per-layer weights. Every layer has a weight in [0,1] and the weights sum to 1.0 within
 * {@link #SUM_TOLERANCE}. An instance that violates either rule cannot be constructed.
 */
public final class ScoringWeights {
    public static final double SUM_TOLERANCE = 1e-6;

    private final EnumMap<EvidenceLayer, Double> weights;

    private ScoringWeights(final Map<EvidenceLayer, Double> weights) {
        this.weights = new EnumMap<>(EvidenceLayer.class);
        double total = 0;
        for (final EvidenceLayer layer : EvidenceLayer.values()) {
            final Double weight = weights.get(layer);
            if (weight == null) {
                throw new ConfigurationException("No weight given for layer " + layer.getKey());
            }
            if (!Double.isFinite(weight) || weight < 0 || weight > 1) {
                throw new ConfigurationException(String.format("Weight for layer %s must be in [0,1] but was %s", layer.getKey(), weight));
            }
            this.weights.put(layer, weight);
            total += weight;
        }
        if (Math.abs(total - 1.0) > SUM_TOLERANCE) {
            throw new ConfigurationException(String.format("Weights must sum to 1.0 (+/- %s) but sum to %.8f: %s", SUM_TOLERANCE, total, this.weights));
        }
    }

    /**
     * @throws ConfigurationException unless every layer has a weight in [0,1] and the weights sum to 1.0
     */
    public static ScoringWeights of(final Map<EvidenceLayer, Double> weights) {
        return new ScoringWeights(weights);
    }

    /** The default weighting: 0.20 for constraint and expression, 0.15 for every other layer. */
    public static ScoringWeights defaults() {
        return builder()
                .weight(EvidenceLayer.GNOMAD, 0.20)
                .weight(EvidenceLayer.EXPRESSION, 0.20)
                .weight(EvidenceLayer.ANNOTATION, 0.15)
                .weight(EvidenceLayer.LOCALIZATION, 0.15)
                .weight(EvidenceLayer.ANIMAL_MODEL, 0.15)
                .weight(EvidenceLayer.LITERATURE, 0.15)
                .build();
    }

    /** Equal weight on every layer. */
    public static ScoringWeights uniform() {
        final Builder builder = builder();
        for (final EvidenceLayer layer : EvidenceLayer.values()) {
            builder.weight(layer, 1.0 / EvidenceLayer.values().length);
        }
        return builder.build();
    }

    /** A builder in which every layer starts at weight 0. */
    public static Builder builder() {
        return new Builder();
    }

    public double get(final EvidenceLayer layer) {
        return weights.get(layer);
    }

    public ImmutableMap<EvidenceLayer, Double> asMap() {
        return ImmutableMap.copyOf(weights);
    }

    public double sum() {
        double total = 0;
        for (final EvidenceLayer layer : EvidenceLayer.values()) {
            total += weights.get(layer);
        }
        return total;
    }

    /**
     * Adds delta to one layer's weight, clamps it to [0,1] and divides every weight by the new total. When every
     * weight ends up at zero the result is {@link #uniform()}. A delta of zero returns this instance.
     */
    public ScoringWeights perturb(final EvidenceLayer layer, final double delta) {
        if (!Double.isFinite(delta)) {
            throw new ConfigurationException("Perturbation delta must be finite but was " + delta);
        }
        if (delta == 0) return this;

        final EnumMap<EvidenceLayer, Double> raw = new EnumMap<>(weights);
        raw.put(layer, Math.min(1.0, Math.max(0.0, weights.get(layer) + delta)));

        double total = 0;
        for (final EvidenceLayer l : EvidenceLayer.values()) {
            total += raw.get(l);
        }
        if (total == 0) return uniform();

        final EnumMap<EvidenceLayer, Double> normalized = new EnumMap<>(EvidenceLayer.class);
        for (final EvidenceLayer l : EvidenceLayer.values()) {
            normalized.put(l, raw.get(l) / total);
        }
        return new ScoringWeights(normalized);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return weights.equals(((ScoringWeights) o).weights);
    }

    @Override
    public int hashCode() {
        return weights.hashCode();
    }

    @Override
    public String toString() {
        final StringBuilder builder = new StringBuilder();
        for (final EvidenceLayer layer : EvidenceLayer.values()) {
            if (builder.length() > 0) builder.append(", ");
            builder.append(layer.getKey()).append('=').append(String.format("%.4f", weights.get(layer)));
        }
        return builder.toString();
    }

    public static class Builder {
        private final EnumMap<EvidenceLayer, Double> weights = new EnumMap<>(EvidenceLayer.class);

        private Builder() {
            for (final EvidenceLayer layer : EvidenceLayer.values()) {
                weights.put(layer, 0.0);
            }
        }

        public Builder weight(final EvidenceLayer layer, final double weight) {
            weights.put(layer, weight);
            return this;
        }

        /** @throws ConfigurationException if the accumulated weights are invalid */
        public ScoringWeights build() {
            return new ScoringWeights(weights);
        }
    }
}
