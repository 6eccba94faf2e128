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

import static com.github.tinemuz.solarhijri.CalendarMath.poly;

/**
 * Dynamical Time minus Universal Time (ΔT), modelled piecewise by era.
 *
 * <p>Years 1600 to 1986 follow Meeus, <i>Astronomical Algorithms</i>
 * (Willmann-Bell, 1991); the other eras follow the polynomials published on
 * the NASA eclipse web site. Eras are selected by the Gregorian year that
 * contains the moment and are not smoothed at their boundaries.</p>
 */
public final class EphemerisCorrection {
    private static final double SECONDS_PER_DAY = 86400;

    private EphemerisCorrection() {}

    /**
     * ΔT in days for a moment given in universal time.
     *
     * @param tee moment (fixed date plus fraction of day)
     * @return correction to add to universal time to get dynamical time
     */
    public static double ephemerisCorrection(double tee) {
        long year = Gregorian.gregorianYearFromFixed((long) Math.floor(tee));

        if (2051 <= year && year <= 2150) {
            double u = (year - 1820) / 100.0;
            return (-20 + 32 * u * u + 0.5628 * (2150 - year)) / SECONDS_PER_DAY;
        }
        if (2006 <= year && year <= 2050) {
            return poly(year - 2000, 62.92, 0.32217, 0.005589) / SECONDS_PER_DAY;
        }
        if (1987 <= year && year <= 2005) {
            return poly(year - 2000,
                    63.86, 0.3345, -0.060374, 0.0017275, 0.000651814, 0.00002373599)
                    / SECONDS_PER_DAY;
        }
        if (1900 <= year && year <= 1986) {
            return poly(centuriesFrom1900(year),
                    -0.00002, 0.000297, 0.025184, -0.181133, 0.553040, -0.861938,
                    0.677066, -0.212591);
        }
        if (1800 <= year && year <= 1899) {
            return poly(centuriesFrom1900(year),
                    -0.000009, 0.003844, 0.083563, 0.865736, 4.867575, 15.845535,
                    31.332267, 38.291999, 28.316289, 11.636204, 2.043794);
        }
        if (1700 <= year && year <= 1799) {
            return poly(year - 1700, 8.118780842, -0.005092142, 0.003336121, -0.0000266484)
                    / SECONDS_PER_DAY;
        }
        if (1600 <= year && year <= 1699) {
            return poly(year - 1600, 120, -0.9808, -0.01532, 0.000140272128) / SECONDS_PER_DAY;
        }
        if (500 <= year && year <= 1599) {
            return poly((year - 1000) / 100.0,
                    1574.2, -556.01, 71.23472, 0.319781, -0.8503463, -0.005050998,
                    0.0083572073)
                    / SECONDS_PER_DAY;
        }
        if (-500 < year && year < 500) {
            return poly(year / 100.0,
                    10583.6, -1014.41, 33.78311, -5.952053, -0.1798452, 0.022174192,
                    0.0090316521)
                    / SECONDS_PER_DAY;
        }
        // Long-term parabola outside the tabulated eras
        return poly((year - 1820) / 100.0, -20, 0, 32) / SECONDS_PER_DAY;
    }

    /** Dynamical time at a universal moment. */
    public static double dynamicalFromUniversal(double tee) {
        return tee + ephemerisCorrection(tee);
    }

    // Julian centuries from 1900-01-01 to July 1 of the year
    private static double centuriesFrom1900(long year) {
        return Gregorian.gregorianDateDifference(
                        new GregorianDate(1900, 1, 1), new GregorianDate((int) year, 7, 1))
                / 36525.0;
    }
}
