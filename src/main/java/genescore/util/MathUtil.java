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

package genescore.util;

import java.util.Arrays;

/**
 * General math utilities
 */
final public class MathUtil {
    private MathUtil(){};

    /** Scale factor that makes the median absolute deviation a consistent estimator of the standard deviation of a normal. */
    public static final double MAD_NORMAL_CONSISTENCY = 1.4826d;

    /** Returns the sum of the elements in the array, added in array order. */
    public static double sum(final double[] arr) {
        double result = 0;
        for (final double next : arr) result += next;
        return result;
    }

    /** Calculates the mean of an array of doubles. */
    public static double mean(final double... in) {
        if (in.length == 0) {
            throw new IllegalArgumentException("Attempting to find the mean of an empty array");
        }
        return sum(in) / in.length;
    }

    /** Calculates the population standard deviation of an array of doubles. */
    public static double stddev(final double... in) {
        final double mean = mean(in);
        double total = 0;
        for (final double v : in) {
            total += (v - mean) * (v - mean);
        }

        return Math.sqrt(total / in.length);
    }

    /** Calculate the median of an array of doubles. The input does not need to be sorted and is not modified. */
    public static double median(final double... in) {
        if (in.length == 0) {
            throw new IllegalArgumentException("Attempting to find the median of an empty array");
        }

        final double[] data = Arrays.copyOf(in, in.length);
        Arrays.sort(data);
        final int middle = data.length / 2;
        return data.length % 2 == 1 ? data[middle] : (data[middle - 1] + data[middle]) / 2.0;
    }

    /**
     * Median absolute deviation, median(|x - median(x)|), multiplied by {@link #MAD_NORMAL_CONSISTENCY}
     * so it is comparable to a standard deviation for normally distributed data.
     */
    public static double scaledMedianAbsoluteDeviation(final double... in) {
        final double median = median(in);
        final double[] deviations = new double[in.length];
        for (int i = 0; i < in.length; ++i) {
            deviations[i] = Math.abs(in[i] - median);
        }
        return median(deviations) * MAD_NORMAL_CONSISTENCY;
    }

    /** Returns the largest value stored in the array. */
    public static double max(final double[] nums) {
        double max = nums[0];
        for (int i = 1; i < nums.length; ++i) {
            if (nums[i] > max) max = nums[i];
        }
        return max;
    }

    /** Returns the smallest value stored in the array. */
    public static double min(final double[] nums) {
        double min = nums[0];
        for (int i = 1; i < nums.length; ++i) {
            if (nums[i] < min) min = nums[i];
        }

        return min;
    }
}
