/*
 * MIT License
 *
 * Copyright (c) 2025 tinemuz
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 *
 * This file contains derivative works. See the NOTICE file for attribution and
 * original license information.
 */
package com.github.tinemuz.solarhijri;

/**
 * Small numeric helpers shared by the calendar and solar code.
 *
 * <p>All trigonometric helpers take angles in degrees and fold the argument
 * into [0, 360) before converting to radians, so that the large multiples
 * produced by century-scale series keep their precision.</p>
 */
final class CalendarMath {

    private CalendarMath() {}

    /**
     * Floating modulus whose result carries the sign of the divisor,
     * e.g. {@code mod(-1, 360) == 359}.
     */
    static double mod(double x, double y) {
        double m = x % y;
        if (m != 0.0 && (m < 0.0) != (y < 0.0)) m += y;
        return m;
    }

    /** The value of x shifted into the range [a, b). Returns x if a == b. */
    static double mod3(double x, double a, double b) {
        if (a == b) return x;
        return a + mod(x - a, b - a);
    }

    /**
     * Evaluate a polynomial with coefficients ordered from degree 0 upward,
     * using Horner's scheme. An empty coefficient list evaluates to 0.
     */
    static double poly(double x, double... coefficients) {
        double acc = 0.0;
        for (int i = coefficients.length - 1; i >= 0; i--) {
            acc = coefficients[i] + x * acc;
        }
        return acc;
    }

    static int sign(double y) {
        if (y < 0) return -1;
        if (y > 0) return 1;
        return 0;
    }

    /** Integer division rounding towards positive infinity. */
    static long ceilDiv(long a, long b) {
        return -Math.floorDiv(-a, b);
    }

    /** x hours as a fraction of a day. */
    static double hr(double x) {
        return x / 24;
    }

    /** d degrees, m arcminutes, s arcseconds. */
    static double angle(double d, double m, double s) {
        return d + (m + s / 60) / 60;
    }

    static double radiansFromDegrees(double theta) {
        return mod(theta, 360) * Math.PI / 180;
    }

    static double sinDegrees(double theta) {
        return Math.sin(radiansFromDegrees(theta));
    }

    static double cosDegrees(double theta) {
        return Math.cos(radiansFromDegrees(theta));
    }

    static double tanDegrees(double theta) {
        return Math.tan(radiansFromDegrees(theta));
    }
}
