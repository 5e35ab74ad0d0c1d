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

import com.google.common.collect.ImmutableList;
import genescore.qc.QcReport;
import genescore.qc.QcThresholds;
import genescore.qc.QualityControl;
import genescore.scoring.CompositeScoreRecord;
import genescore.scoring.EvidenceLayer;
import genescore.scoring.ScoringResult;
import genescore.scoring.ScoringWeights;
import genescore.sensitivity.SensitivityAnalysisResult;
import genescore.sensitivity.SensitivityParameters;
import genescore.sensitivity.SensitivityResult;
import genescore.sensitivity.SensitivitySummary;
import genescore.sensitivity.Stability;
import genescore.tier.TierClassifier;
import genescore.tier.TierSummary;
import genescore.tier.TierThresholds;
import genescore.validation.ControlRole;
import genescore.validation.ControlSet;
import genescore.validation.ControlValidationParameters;
import genescore.validation.ControlValidator;
import genescore.validation.NegativeControlResult;
import genescore.validation.PositiveControlResult;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.OptionalDouble;

import static genescore.scoring.ScoringTestUtils.record;

/**
 * A small population of twenty genes S0..S19 with GNOMAD scores 0.00..0.95 and the validation results built on it.
 */
final class ReportTestData {
    static final TierClassifier CLASSIFIER = new TierClassifier(TierThresholds.DEFAULT);
    static final ControlValidator VALIDATOR = new ControlValidator(ControlValidationParameters.DEFAULT, CLASSIFIER);

    private ReportTestData() {}

    static List<CompositeScoreRecord> population() {
        final List<CompositeScoreRecord> records = new ArrayList<>();
        for (int i = 0; i < 20; ++i) {
            records.add(record("G" + i, "S" + i, i / 20.0));
        }
        return records;
    }

    static QcReport qc() {
        return new QualityControl(QcThresholds.DEFAULT)
                .runQc(new ScoringResult(population(), Collections.emptyList(), ScoringWeights.defaults()), Collections.emptyMap());
    }

    static TierSummary tiers() {
        return new TierSummary(population(), CLASSIFIER);
    }

    static PositiveControlResult positive(final String... symbols) {
        final ControlSet.Builder builder = ControlSet.builder("known", ControlRole.POSITIVE);
        for (final String symbol : symbols) builder.add(symbol, "test");
        return VALIDATOR.validatePositive(population(), builder.build());
    }

    static NegativeControlResult negative(final String... symbols) {
        final ControlSet.Builder builder = ControlSet.builder("housekeeping", ControlRole.NEGATIVE);
        for (final String symbol : symbols) builder.add(symbol, "test");
        return VALIDATOR.validateNegative(population(), builder.build());
    }

    static SensitivityResult sensitivityResult(final EvidenceLayer layer, final Double rho, final Stability stability) {
        return new SensitivityResult(layer, 0.05, ScoringWeights.defaults().perturb(layer, 0.05), rho == null ? 2 : 10,
                rho == null ? OptionalDouble.empty() : OptionalDouble.of(rho),
                rho == null ? OptionalDouble.empty() : OptionalDouble.of(0.001), stability);
    }

    static SensitivityAnalysisResult sensitivity(final SensitivityResult... results) {
        return new SensitivityAnalysisResult(ScoringWeights.defaults(), SensitivityParameters.DEFAULT, 20, ImmutableList.copyOf(results));
    }

    static SensitivitySummary summary(final SensitivityResult... results) {
        return sensitivity(results).getSummary();
    }
}
