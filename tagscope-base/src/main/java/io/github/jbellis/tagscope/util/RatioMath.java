/*
 * Copyright DataStax, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.github.jbellis.tagscope.util;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.List;
import java.util.Locale;
import java.util.OptionalDouble;

/**
 * Utility methods for ratio arithmetic and display.
 */
public class RatioMath {
    private static final int SIGNIFICANT_DIGITS = 6;
    private static final MathContext DISPLAY_CONTEXT = new MathContext(SIGNIFICANT_DIGITS, RoundingMode.HALF_EVEN);

    /** Private constructor to prevent instantiation. */
    private RatioMath() {
    }

    /**
     * Divides likes by views. A zero view count yields 0 and is never used as a divisor.
     *
     * @param likes the like count
     * @param views the view count
     * @return likes / views, or 0 when views is 0
     */
    public static double ratio(double likes, double views) {
        return views == 0.0 ? 0.0 : likes / views;
    }

    /**
     * Arithmetic mean of the samples, summed in list order.
     *
     * @param samples the values to average
     * @return the mean, or empty if there are no samples
     */
    public static OptionalDouble mean(List<Double> samples) {
        if (samples.isEmpty()) {
            return OptionalDouble.empty();
        }
        double sum = 0;
        for (double s : samples) {
            sum += s;
        }
        return OptionalDouble.of(sum / samples.size());
    }

    /**
     * Formats a value with six significant digits, dropping trailing zeros, and switching to
     * exponent notation for very small or very large magnitudes (the {@code %g} convention).
     * For example 0.2 renders as "0.2", 0.0123456789 as "0.0123457" and 0.00001 as "1e-05".
     *
     * @param value the value to format
     * @return the formatted value
     */
    public static String format(double value) {
        if (value == 0.0) {
            return "0";
        }
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return Double.toString(value);
        }
        BigDecimal rounded = new BigDecimal(value).round(DISPLAY_CONTEXT);
        int exponent = rounded.precision() - rounded.scale() - 1;
        if (exponent < -4 || exponent >= SIGNIFICANT_DIGITS) {
            String scientific = String.format(Locale.ROOT, "%." + (SIGNIFICANT_DIGITS - 1) + "e", value);
            int e = scientific.indexOf('e');
            return stripZeros(scientific.substring(0, e)) + scientific.substring(e);
        }
        return rounded.stripTrailingZeros().toPlainString();
    }

    private static String stripZeros(String mantissa) {
        if (mantissa.indexOf('.') < 0) {
            return mantissa;
        }
        int end = mantissa.length();
        while (mantissa.charAt(end - 1) == '0') {
            end--;
        }
        if (mantissa.charAt(end - 1) == '.') {
            end--;
        }
        return mantissa.substring(0, end);
    }
}
