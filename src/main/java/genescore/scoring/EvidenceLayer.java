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

import genescore.ConfigurationException;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * The closed set of evidence layers that contribute to a composite score. The declaration order is the order in
 * which layers are always visited, so sums over layers are reproducible.
 */
public enum EvidenceLayer {
    /** Genetic constraint (normalized LOEUF). */
    GNOMAD("gnomad"),
    /** Tissue expression specificity. */
    EXPRESSION("expression"),
    /** Annotation depth and completeness. */
    ANNOTATION("annotation"),
    /** Subcellular localization evidence. */
    LOCALIZATION("localization"),
    /** Animal-model phenotype evidence. */
    ANIMAL_MODEL("animal_model"),
    /** Literature evidence. */
    LITERATURE("literature");

    private final String key;

    EvidenceLayer(final String key) {
        this.key = key;
    }

    /** The lower-case name used in configuration keys, command lines and reports. */
    public String getKey() {
        return key;
    }

    /**
     * Looks up a layer by its key, ignoring case.
     * @throws ConfigurationException if no layer has that key
     */
    public static EvidenceLayer fromKey(final String key) {
        for (final EvidenceLayer layer : values()) {
            if (layer.key.equalsIgnoreCase(key.trim())) return layer;
        }
        throw new ConfigurationException("Unknown evidence layer '" + key + "'. Known layers are: " +
                Arrays.stream(values()).map(EvidenceLayer::getKey).collect(Collectors.joining(", ")));
    }
}
