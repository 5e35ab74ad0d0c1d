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

package genescore.config;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.hash.Hashing;
import genescore.ConfigurationException;
import genescore.qc.QcThresholds;
import genescore.scoring.EvidenceLayer;
import genescore.scoring.QualityFlagThresholds;
import genescore.scoring.ScoringWeights;
import genescore.sensitivity.SensitivityParameters;
import genescore.tier.TierThresholds;
import genescore.util.PropertyUtils;
import genescore.validation.ControlValidationParameters;
import htsjdk.samtools.util.Log;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * The effective run configuration: the defaults shipped in {@value #DEFAULTS_RESOURCE}, overridden by any keys a
 * user supplies. Every value is parsed and validated on construction, so an instance only exists if the whole
 * configuration is usable.
 */
public final class ScoringConfiguration {
    private static final Log log = Log.getInstance(ScoringConfiguration.class);

    public static final String DEFAULTS_RESOURCE = "genescore/scoring-defaults.properties";

    /** Key prefixes owned by GeneScore; an unrecognized key under one of these is an error. */
    static final List<String> KNOWN_PREFIXES = ImmutableList.of("weights.", "quality.", "tier.", "qc.", "controls.", "sensitivity.");

    private final ImmutableSortedMap<String, String> values;
    private final ScoringWeights weights;
    private final QualityFlagThresholds qualityFlagThresholds;
    private final TierThresholds tierThresholds;
    private final QcThresholds qcThresholds;
    private final ControlValidationParameters controlValidationParameters;
    private final SensitivityParameters sensitivityParameters;

    private ScoringConfiguration(final Properties overrides) {
        final Properties defaults = PropertyUtils.loadPropertiesFile(DEFAULTS_RESOURCE, ScoringConfiguration.class);
        if (defaults == null) {
            throw new ConfigurationException("Default configuration resource not found: " + DEFAULTS_RESOURCE);
        }

        final Map<String, String> merged = new TreeMap<>();
        defaults.stringPropertyNames().forEach(key -> merged.put(key, defaults.getProperty(key).trim()));
        for (final String key : overrides.stringPropertyNames()) {
            if (merged.containsKey(key)) {
                merged.put(key, overrides.getProperty(key).trim());
            } else if (KNOWN_PREFIXES.stream().anyMatch(key::startsWith)) {
                throw new ConfigurationException("Unknown configuration key '" + key + "'");
            } else {
                log.warn("Ignoring unrecognized configuration key ", key);
            }
        }
        this.values = ImmutableSortedMap.copyOf(merged);

        final ScoringWeights.Builder builder = ScoringWeights.builder();
        for (final EvidenceLayer layer : EvidenceLayer.values()) {
            builder.weight(layer, getDouble("weights." + layer.getKey()));
        }
        this.weights = builder.build();

        this.qualityFlagThresholds = new QualityFlagThresholds(
                getInt("quality.sufficient.min_evidence"),
                getInt("quality.moderate.min_evidence"),
                getInt("quality.sparse.min_evidence"));

        this.tierThresholds = new TierThresholds(
                getDouble("tier.high.min_score"),
                getInt("tier.high.min_evidence"),
                getDouble("tier.medium.min_score"),
                getInt("tier.medium.min_evidence"));

        this.qcThresholds = new QcThresholds(
                getDouble("qc.missing.warn_rate"),
                getDouble("qc.missing.error_rate"),
                getDouble("qc.min_std"),
                getDouble("qc.outlier.mad_multiplier"));

        this.controlValidationParameters = new ControlValidationParameters(
                getDouble("controls.positive.min_median_percentile"),
                getDouble("controls.negative.max_median_percentile"),
                getDouble("controls.top_quartile_percentile"),
                getList("controls.recall.k_absolute", Integer::parseInt),
                getList("controls.recall.k_percent", Double::parseDouble));

        this.sensitivityParameters = new SensitivityParameters(
                getList("sensitivity.deltas", Double::parseDouble),
                getInt("sensitivity.top_n"),
                getInt("sensitivity.min_overlap"),
                getDouble("sensitivity.stability_threshold"));
    }

    public static ScoringConfiguration defaults() {
        return new ScoringConfiguration(new Properties());
    }

    /**
     * @param overrides keys replacing the defaults
     * @throws ConfigurationException if any resulting value is invalid
     */
    public static ScoringConfiguration fromProperties(final Properties overrides) {
        return new ScoringConfiguration(overrides);
    }

    /**
     * @param file properties file overriding the defaults; null means defaults only
     * @throws ConfigurationException if the file cannot be read or any resulting value is invalid
     */
    public static ScoringConfiguration load(final File file) {
        if (file == null) return defaults();
        log.info("Loading configuration overrides from ", file);
        return new ScoringConfiguration(PropertyUtils.loadPropertiesFile(file));
    }

    private String getRaw(final String key) {
        final String value = values.get(key);
        if (value == null || value.isEmpty()) {
            throw new ConfigurationException("Missing value for configuration key '" + key + "'");
        }
        return value;
    }

    private double getDouble(final String key) {
        try {
            return Double.parseDouble(getRaw(key));
        } catch (final NumberFormatException e) {
            throw new ConfigurationException(String.format("Configuration key '%s' must be a number but was '%s'", key, values.get(key)), e);
        }
    }

    private int getInt(final String key) {
        try {
            return Integer.parseInt(getRaw(key));
        } catch (final NumberFormatException e) {
            throw new ConfigurationException(String.format("Configuration key '%s' must be an integer but was '%s'", key, values.get(key)), e);
        }
    }

    private <T> List<T> getList(final String key, final Function<String, T> parser) {
        final List<T> list = new ArrayList<>();
        for (final String part : getRaw(key).split(",")) {
            if (part.trim().isEmpty()) continue;
            try {
                list.add(parser.apply(part.trim()));
            } catch (final NumberFormatException e) {
                throw new ConfigurationException(String.format("Configuration key '%s' has an invalid entry '%s'", key, part.trim()), e);
            }
        }
        return list;
    }

    /** The effective key/value pairs, sorted by key. */
    public ImmutableSortedMap<String, String> getValues() {
        return values;
    }

    /** SHA-256 over the sorted effective key/value pairs; identical configurations have identical fingerprints. */
    public String getFingerprint() {
        final StringBuilder canonical = new StringBuilder();
        values.forEach((key, value) -> canonical.append(key).append('=').append(value).append('\n'));
        return Hashing.sha256().hashString(canonical.toString(), StandardCharsets.UTF_8).toString();
    }

    public ScoringWeights getWeights() {
        return weights;
    }

    public QualityFlagThresholds getQualityFlagThresholds() {
        return qualityFlagThresholds;
    }

    public TierThresholds getTierThresholds() {
        return tierThresholds;
    }

    public QcThresholds getQcThresholds() {
        return qcThresholds;
    }

    public ControlValidationParameters getControlValidationParameters() {
        return controlValidationParameters;
    }

    public SensitivityParameters getSensitivityParameters() {
        return sensitivityParameters;
    }
}
