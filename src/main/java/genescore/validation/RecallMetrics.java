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

import htsjdk.samtools.metrics.MetricBase;

/**
 * Recall of positive controls within the top k ranked genes, overall and per control source.
 */
public class RecallMetrics extends MetricBase {
    public String CONTROL_SET;
    /** The control source, or {@value ValidateGeneScores#ALL_SOURCES} for the whole set. */
    public String SOURCE;
    /** The requested cutoff, either an absolute count or a percentage such as "5%". */
    public String CUTOFF;
    /** The effective k after clamping to the population size. */
    public int K;
    /** Known genes ranked within the top K. */
    public int FOUND_IN_TOP_K;
    /** Known genes present among the scored genes. */
    public int KNOWN_PRESENT;
    /** FOUND_IN_TOP_K / KNOWN_PRESENT; empty when no known gene is present. */
    public Double RECALL;

    public static RecallMetrics of(final String controlSet, final String source, final RecallAtK recall) {
        final RecallMetrics metrics = new RecallMetrics();
        metrics.CONTROL_SET = controlSet;
        metrics.SOURCE = source;
        metrics.CUTOFF = recall.getLabel();
        metrics.K = recall.getK();
        metrics.FOUND_IN_TOP_K = recall.getFoundInTopK();
        metrics.KNOWN_PRESENT = recall.getKnownPresent();
        metrics.RECALL = ControlValidationMetrics.orNull(recall.getRecall());
        return metrics;
    }
}
