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

import com.google.common.collect.ImmutableSet;

import java.util.Set;

/**
 * A control symbol that could not be ranked.
 */
public final class MissingControl {
    public enum Reason {
        /** No gene in the universe has this symbol. */
        NOT_IN_UNIVERSE,
        /** The symbol is in the universe but its canonical record has no composite score. */
        NO_SCORE
    }

    private final String symbol;
    private final ImmutableSet<String> sources;
    private final Reason reason;

    public MissingControl(final String symbol, final Set<String> sources, final Reason reason) {
        this.symbol = symbol;
        this.sources = ImmutableSet.copyOf(sources);
        this.reason = reason;
    }

    public String getSymbol() {
        return symbol;
    }

    public ImmutableSet<String> getSources() {
        return sources;
    }

    public Reason getReason() {
        return reason;
    }

    @Override
    public String toString() {
        return symbol + " (" + reason + ")";
    }
}
