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

package genescore.tier;

import genescore.scoring.CompositeScoreRecord;
import genescore.scoring.QualityFlag;

import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;

/**
 * Gene counts per tier, and per quality flag within each tier.
 */
public final class TierSummary {
    private final Map<Tier, Integer> tierCounts = new EnumMap<>(Tier.class);
    private final Map<Tier, Map<QualityFlag, Integer>> flagCountsByTier = new EnumMap<>(Tier.class);

    public TierSummary(final Collection<CompositeScoreRecord> records, final TierClassifier classifier) {
        for (final Tier tier : Tier.values()) {
            tierCounts.put(tier, 0);
            final Map<QualityFlag, Integer> flags = new EnumMap<>(QualityFlag.class);
            for (final QualityFlag flag : QualityFlag.values()) flags.put(flag, 0);
            flagCountsByTier.put(tier, flags);
        }
        for (final CompositeScoreRecord record : records) {
            final Tier tier = classifier.classify(record);
            tierCounts.merge(tier, 1, Integer::sum);
            flagCountsByTier.get(tier).merge(record.getQualityFlag(), 1, Integer::sum);
        }
    }

    public int getCount(final Tier tier) {
        return tierCounts.get(tier);
    }

    public int getCount(final Tier tier, final QualityFlag flag) {
        return flagCountsByTier.get(tier).get(flag);
    }

    public int getTotal() {
        return tierCounts.values().stream().mapToInt(Integer::intValue).sum();
    }
}
