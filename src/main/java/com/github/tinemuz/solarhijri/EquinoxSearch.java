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

import static com.github.tinemuz.solarhijri.CalendarMath.mod;
import static com.github.tinemuz.solarhijri.CalendarMath.mod3;
import static com.github.tinemuz.solarhijri.SolarPosition.MEAN_TROPICAL_YEAR;
import static com.github.tinemuz.solarhijri.SolarPosition.midday;
import static com.github.tinemuz.solarhijri.SolarPosition.solarLongitude;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds the day on which the Sun's apparent longitude passes a target value.
 *
 * <p>The search first extrapolates linearly at the mean rate of one degree per
 * {@code MEAN_TROPICAL_YEAR / 360} days, then walks forward day by day, looking
 * at the longitude at true noon. The linear estimate is off by a few days at
 * most, so the walk is short; it is still capped and fails with
 * {@link CalendarComputationException} rather than running away.</p>
 */
public final class EquinoxSearch {
    private static final Logger log = LoggerFactory.getLogger(EquinoxSearch.class);

    /** Solar longitude at the vernal equinox. */
    public static final double SPRING = 0;

    /** Solar longitude at the summer solstice. */
    public static final double SUMMER = 90;

    /** Solar longitude at the autumnal equinox. */
    public static final double AUTUMN = 180;

    /** Solar longitude at the winter solstice. */
    public static final double WINTER = 270;

    // Degrees past the target still treated as "just crossed" at noon
    private static final double NOON_TOLERANCE = 2;

    private EquinoxSearch() {}

    /**
     * Approximate moment at or before {@code tee} when the solar longitude
     * last passed {@code lambda} degrees.
     */
    public static double estimatePriorSolarLongitude(double lambda, double tee) {
        double rate = MEAN_TROPICAL_YEAR / 360;
        double tau = tee - rate * mod(solarLongitude(tee) - lambda, 360);
        double capDelta = mod3(solarLongitude(tau) - lambda, -180, 180);
        return Math.min(tee, tau - rate * capDelta);
    }

    /**
     * First day, at or before the given date, on whose true noon at
     * {@code location} the solar longitude has passed {@code lambda} by no
     * more than two degrees.
     *
     * @param lambda   target solar longitude in degrees
     * @param date     fixed date bounding the search from above
     * @param location observation point defining true noon
     * @param maxSteps cap on the day-by-day refinement
     * @return fixed date of the crossing day
     * @throws CalendarComputationException if refinement needs more than maxSteps days
     */
    public static long dayOfSolarLongitudeOnOrBefore(
            double lambda, long date, Location location, int maxSteps) {
        double approx = estimatePriorSolarLongitude(lambda, midday(date, location));
        long day = (long) Math.floor(approx) - 1;
        int steps = 0;
        while (mod(solarLongitude(midday(day, location)) - lambda, 360) > NOON_TOLERANCE) {
            if (++steps > maxSteps) {
                log.error("Solar longitude {} search before fixed date {} at {} did not settle in {} days",
                        lambda, date, location, maxSteps);
                throw new CalendarComputationException(
                        "Solar longitude " + lambda + " search before fixed date " + date
                                + " did not settle in " + maxSteps + " days");
            }
            day++;
        }
        if (log.isTraceEnabled()) {
            log.trace("Solar longitude {} crossed on fixed date {} after {} refinement steps",
                    lambda, day, steps);
        }
        return day;
    }

    /**
     * Fixed date of the astronomical vernal equinox day on or before {@code date},
     * judged at true noon at {@code location}.
     */
    public static long springOnOrBefore(long date, Location location, int maxSteps) {
        return dayOfSolarLongitudeOnOrBefore(SPRING, date, location, maxSteps);
    }
}
