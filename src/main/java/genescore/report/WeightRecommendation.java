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

package genescore.report;

import genescore.scoring.EvidenceLayer;

/**
 * Non-binding guidance to change one layer's weight. Acting on it means the controls that motivated it can no
 * longer validate the result, so every recommendation requires independent re-validation.
 */
public final class WeightRecommendation {
    public static final String CIRCULAR_VALIDATION_WARNING =
            "Tuning weights with the same control genes used to validate them is circular and invalidates the validation. " +
            "Any adjusted weights must be re-validated against an independent gene set.";

    public enum Direction {
        INCREASE, DECREASE
    }

    public enum Trigger {
        POSITIVE_CONTROLS_FAILED, NEGATIVE_CONTROLS_FAILED, SENSITIVITY_UNSTABLE
    }

    private final Trigger trigger;
    private final EvidenceLayer layer;
    private final Direction direction;
    private final String rationale;

    public WeightRecommendation(final Trigger trigger, final EvidenceLayer layer, final Direction direction, final String rationale) {
        this.trigger = trigger;
        this.layer = layer;
        this.direction = direction;
        this.rationale = rationale;
    }

    public Trigger getTrigger() {
        return trigger;
    }

    public EvidenceLayer getLayer() {
        return layer;
    }

    public Direction getDirection() {
        return direction;
    }

    public String getRationale() {
        return rationale;
    }

    public String getWarning() {
        return CIRCULAR_VALIDATION_WARNING;
    }

    public boolean requiresIndependentRevalidation() {
        return true;
    }

    @Override
    public String toString() {
        return direction + " " + layer.getKey() + ": " + rationale;
    }
}
