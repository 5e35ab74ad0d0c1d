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

import java.util.OptionalDouble;

/**
 * Fraction of the known genes present in the population that fall within the top k.
 */
public final class RecallAtK {
    private final String label;
    private final int k;
    private final int foundInTopK;
    private final int knownPresent;

    public RecallAtK(final String label, final int k, final int foundInTopK, final int knownPresent) {
        this.label = label;
        this.k = k;
        this.foundInTopK = foundInTopK;
        this.knownPresent = knownPresent;
    }

    /** Either the absolute k, or the requested percentage followed by '%'. */
    public String getLabel() {
        return label;
    }

    /** The effective k after clamping to the population size. */
    public int getK() {
        return k;
    }

    public int getFoundInTopK() {
        return foundInTopK;
    }

    public int getKnownPresent() {
        return knownPresent;
    }

    /** Empty when no known gene is present. */
    public OptionalDouble getRecall() {
        return knownPresent == 0 ? OptionalDouble.empty() : OptionalDouble.of(foundInTopK / (double) knownPresent);
    }
}
