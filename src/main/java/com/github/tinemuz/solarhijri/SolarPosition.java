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

import static com.github.tinemuz.solarhijri.CalendarMath.angle;
import static com.github.tinemuz.solarhijri.CalendarMath.cosDegrees;
import static com.github.tinemuz.solarhijri.CalendarMath.hr;
import static com.github.tinemuz.solarhijri.CalendarMath.mod;
import static com.github.tinemuz.solarhijri.CalendarMath.poly;
import static com.github.tinemuz.solarhijri.CalendarMath.sign;
import static com.github.tinemuz.solarhijri.CalendarMath.sinDegrees;
import static com.github.tinemuz.solarhijri.CalendarMath.tanDegrees;

/**
 * Apparent position of the Sun and the sundial-time corrections derived from it.
 *
 * <p>Moments are fixed dates plus a fraction of a day, in universal time unless
 * stated otherwise. Angles are in degrees. Every function is pure.</p>
 */
public final class SolarPosition {
    /** Noon at the start of Gregorian year 2000, the J2000.0 epoch. */
    public static final double J2000 = hr(12) + Gregorian.gregorianNewYear(2000);

    /** Mean length of the tropical year in days. */
    public static final double MEAN_TROPICAL_YEAR = 365.242189;

    // Periodic terms of the solar longitude series (Bretagnon and Simon,
    // "Planetary Programs and Tables from -4000 to +2800", Willmann-Bell, 1986).
    // Term i contributes COEFFICIENTS[i] * sin(ADDENDS[i] + MULTIPLIERS[i] * c).
    private static final double[] COEFFICIENTS = {
        403406, 195207, 119433, 112392, 3891, 2819, 1721, 660, 350, 334,
        314, 268, 242, 234, 158, 132, 129, 114, 99, 93,
        86, 78, 72, 68, 64, 46, 38, 37, 32, 29,
        28, 27, 27, 25, 24, 21, 21, 20, 18, 17,
        14, 13, 13, 13, 12, 10, 10, 10, 10
    };
    private static final double[] MULTIPLIERS = {
        0.9287892, 35999.1376958, 35999.4089666, 35998.7287385, 71998.20261,
        71998.4403, 36000.35726, 71997.4812, 32964.4678, -19.4410,
        445267.1117, 45036.8840, 3.1008, 22518.4434, -19.9739,
        65928.9345, 9038.0293, 3034.7684, 33718.148, 3034.448,
        -2280.773, 29929.992, 31556.493, 149.588, 9037.750,
        107997.405, -4444.176, 151.771, 67555.316, 31556.080,
        -4561.540, 107996.706, 1221.655, 62894.167, 31437.369,
        14578.298, -31931.757, 34777.243, 1221.999, 62894.511,
        -4442.039, 107997.909, 119.066, 16859.071, -4.578,
        26895.292, -39.127, 12297.536, 90073.778
    };
    private static final double[] ADDENDS = {
        270.54861, 340.19128, 63.91854, 331.26220, 317.843,
        86.631, 240.052, 310.26, 247.23, 260.87,
        297.82, 343.14, 166.79, 81.53, 3.50,
        132.75, 182.95, 162.03, 29.8, 266.4,
        249.2, 157.6, 257.8, 185.1, 69.9,
        8.0, 197.1, 250.4, 65.3, 162.7,
        341.5, 291.6, 98.5, 146.7, 110.0,
        5.2, 342.6, 230.9, 256.1, 45.3,
        242.9, 115.2, 151.8, 285.3, 53.3,
        126.6, 205.7, 85.9, 146.1
    };

    // Scale of the periodic sum: 1e-7 radians expressed in degrees
    private static final double SERIES_SCALE = 0.000005729577951308232;

    private SolarPosition() {}

    /** Julian centuries of dynamical time since J2000 at a universal moment. */
    public static double julianCenturies(double tee) {
        return (EphemerisCorrection.dynamicalFromUniversal(tee) - J2000) / 36525;
    }

    /** Mean obliquity of the ecliptic. */
    public static double obliquity(double tee) {
        double c = julianCenturies(tee);
        return angle(23, 26, 21.448)
                + poly(c, 0, angle(0, 0, -46.8150), angle(0, 0, -0.00059), angle(0, 0, 0.001813));
    }

    /**
     * Equation of time as a fraction of a day, after Meeus, <i>Astronomical
     * Algorithms</i>, 2nd edn., p. 185. The magnitude is capped at 12 hours.
     */
    public static double equationOfTime(double tee) {
        double c = julianCenturies(tee);
        double lambda = poly(c, 280.46645, 36000.76983, 0.0003032);
        double anomaly = poly(c, 357.52910, 35999.05030, -0.0001559, -0.00000048);
        double eccentricity = poly(c, 0.016708617, -0.000042037, -0.0000001236);
        double varepsilon = obliquity(tee);
        double y = Math.pow(tanDegrees(varepsilon / 2), 2);
        double equation = (1.0 / 2 / Math.PI)
                * (y * sinDegrees(2 * lambda)
                        - 2 * eccentricity * sinDegrees(anomaly)
                        + 4 * eccentricity * y * sinDegrees(anomaly) * cosDegrees(2 * lambda)
                        - 0.5 * y * y * sinDegrees(4 * lambda)
                        - 1.25 * eccentricity * eccentricity * sinDegrees(2 * anomaly));
        return sign(equation) * Math.min(Math.abs(equation), hr(12));
    }

    /** Longitudinal nutation. */
    public static double nutation(double tee) {
        double c = julianCenturies(tee);
        double capA = poly(c, 124.90, -1934.134, 0.002063);
        double capB = poly(c, 201.11, 72001.5377, 0.00057);
        return -0.004778 * sinDegrees(capA) - 0.0003667 * sinDegrees(capB);
    }

    /** Aberration. */
    public static double aberration(double tee) {
        double c = julianCenturies(tee);
        return 0.0000974 * cosDegrees(177.63 + 35999.01848 * c) - 0.005575;
    }

    /**
     * Apparent longitude of the Sun, in [0, 360).
     *
     * @param tee universal moment
     */
    public static double solarLongitude(double tee) {
        double c = julianCenturies(tee);
        double sum = 0;
        for (int i = 0; i < COEFFICIENTS.length; i++) {
            sum += COEFFICIENTS[i] * sinDegrees(ADDENDS[i] + MULTIPLIERS[i] * c);
        }
        double lambda = 282.7771834 + 36000.76953744 * c + SERIES_SCALE * sum;
        return mod(lambda + aberration(tee) + nutation(tee), 360);
    }

    /** Universal time from local mean time at a location. */
    public static double universalFromLocal(double teeLocal, Location location) {
        return teeLocal - location.zoneFromLongitude();
    }

    /** Local mean time from sundial time at a location. */
    public static double localFromApparent(double tee, Location location) {
        return tee - equationOfTime(universalFromLocal(tee, location));
    }

    /** Universal time from sundial time at a location. */
    public static double universalFromApparent(double tee, Location location) {
        return universalFromLocal(localFromApparent(tee, location), location);
    }

    /** Universal time of true (sundial) noon on a fixed date at a location. */
    public static double midday(long date, Location location) {
        return universalFromApparent(date + hr(12), location);
    }
}
