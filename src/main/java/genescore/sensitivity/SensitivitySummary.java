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

package genescore.sensitivity;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import genescore.scoring.EvidenceLayer;
import genescore.util.MathUtil;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Aggregate view of a sensitivity sweep. The ranking is considered stable overall only when at least one
 * correlation could be computed and none of them fell below the stability threshold.
 */
public final class SensitivitySummary {
    private final OptionalDouble minRho;
    private final OptionalDouble meanRho;
    private final OptionalDouble maxRho;
    private final int stableCount;
    private final int unstableCount;
    private final int indeterminateCount;
    private final ImmutableMap<EvidenceLayer, OptionalDouble> meanRhoByLayer;
    private final Optional<EvidenceLayer> mostSensitiveLayer;
    private final Optional<EvidenceLayer> mostRobustLayer;

    public SensitivitySummary(final List<SensitivityResult> results) {
        final double[] rhos = results.stream()
                .filter(r -> r.getRho().isPresent())
                .mapToDouble(r -> r.getRho().getAsDouble())
                .toArray();
        this.minRho = rhos.length == 0 ? OptionalDouble.empty() : OptionalDouble.of(MathUtil.min(rhos));
        this.meanRho = rhos.length == 0 ? OptionalDouble.empty() : OptionalDouble.of(MathUtil.mean(rhos));
        this.maxRho = rhos.length == 0 ? OptionalDouble.empty() : OptionalDouble.of(MathUtil.max(rhos));

        this.stableCount = (int) results.stream().filter(r -> r.getStability() == Stability.STABLE).count();
        this.unstableCount = (int) results.stream().filter(r -> r.getStability() == Stability.UNSTABLE).count();
        this.indeterminateCount = (int) results.stream().filter(r -> r.getStability() == Stability.INDETERMINATE).count();

        final Map<EvidenceLayer, OptionalDouble> layerMeans = new EnumMap<>(EvidenceLayer.class);
        EvidenceLayer sensitive = null;
        EvidenceLayer robust = null;
        for (final EvidenceLayer layer : EvidenceLayer.values()) {
            final double[] layerRhos = results.stream()
                    .filter(r -> r.getLayer() == layer && r.getRho().isPresent())
                    .mapToDouble(r -> r.getRho().getAsDouble())
                    .toArray();
            if (layerRhos.length == 0) {
                layerMeans.put(layer, OptionalDouble.empty());
                continue;
            }
            final double mean = MathUtil.mean(layerRhos);
            layerMeans.put(layer, OptionalDouble.of(mean));
            if (sensitive == null || mean < layerMeans.get(sensitive).getAsDouble()) sensitive = layer;
            if (robust == null || mean > layerMeans.get(robust).getAsDouble()) robust = layer;
        }
        this.meanRhoByLayer = Maps.immutableEnumMap(layerMeans);
        this.mostSensitiveLayer = Optional.ofNullable(sensitive);
        this.mostRobustLayer = Optional.ofNullable(robust);
    }

    public OptionalDouble getMinRho() {
        return minRho;
    }

    public OptionalDouble getMeanRho() {
        return meanRho;
    }

    public OptionalDouble getMaxRho() {
        return maxRho;
    }

    public int getStableCount() {
        return stableCount;
    }

    public int getUnstableCount() {
        return unstableCount;
    }

    public int getIndeterminateCount() {
        return indeterminateCount;
    }

    public boolean isOverallStable() {
        return stableCount > 0 && unstableCount == 0;
    }

    /** Mean rho per layer in layer order; empty for a layer without a computed rho. */
    public ImmutableMap<EvidenceLayer, OptionalDouble> getMeanRhoByLayer() {
        return meanRhoByLayer;
    }

    /** The layer with the lowest mean rho; empty when no rho was computed. */
    public Optional<EvidenceLayer> getMostSensitiveLayer() {
        return mostSensitiveLayer;
    }

    /** The layer with the highest mean rho; empty when no rho was computed. */
    public Optional<EvidenceLayer> getMostRobustLayer() {
        return mostRobustLayer;
    }
}
