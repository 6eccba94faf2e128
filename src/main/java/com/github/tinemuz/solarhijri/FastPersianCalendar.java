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

import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Constant-time Persian calendar built on the 33-year intercalation cycle.
 *
 * <p>A year {@code y} is leap under the plain cycle when
 * {@code (25 y + 11) mod 33 < 8}. The cycle drifts from the astronomical
 * calendar, and {@link #NON_LEAP_CORRECTION} lists every year in the supported
 * range where it does: such a year is common although the cycle makes it leap,
 * and the year after it is leap although the cycle makes it common. With those
 * corrections the results equal those of {@link AstronomicalPersianCalendar}
 * at {@link Location#IRAN} for every day of years
 * {@value #SUPPORTED_FIRST_YEAR} to {@value #SUPPORTED_LAST_YEAR}.</p>
 *
 * <p>Outside that range the results are unverified. By default such calls are
 * rejected with {@link UnsupportedYearException}; a lenient calendar answers
 * them and logs one warning. Years before 1 are always rejected because the
 * cycle formula does not skip year 0.</p>
 */
public final class FastPersianCalendar implements PersianCalendar {
    private static final Logger log = LoggerFactory.getLogger(FastPersianCalendar.class);

    /** Fixed date of 1 Farvardin of year 1, precomputed from Julian 622-03-19. */
    public static final long EPOCH = 226896;

    public static final int SUPPORTED_FIRST_YEAR = 1178;
    public static final int SUPPORTED_LAST_YEAR = 3000;

    /**
     * Years that are common although the 33-year cycle makes them leap; each is
     * followed by a leap year that the cycle makes common. Found by comparing
     * against the astronomical calendar on the 52.5°E meridian, day by day,
     * from 1178 to 3000.
     */
    public static final Set<Integer> NON_LEAP_CORRECTION = Set.of(
            1502,
            1601, 1634, 1667,
            1700, 1733, 1766, 1799,
            1832, 1865, 1898,
            1931, 1964, 1997,
            2030, 2059, 2063, 2096,
            2129, 2158, 2162, 2191, 2195,
            2224, 2228, 2257, 2261, 2290, 2294,
            2323, 2327, 2356, 2360, 2389, 2393,
            2422, 2426, 2455, 2459, 2488, 2492,
            2521, 2525, 2554, 2558, 2587, 2591,
            2620, 2624, 2653, 2657, 2686, 2690,
            2719, 2723, 2748, 2752, 2756, 2781, 2785, 2789,
            2818, 2822, 2847, 2851, 2855, 2880, 2884, 2888,
            2913, 2917, 2921, 2946, 2950, 2954, 2979, 2983, 2987);

    // Days in 33 years of the cycle: 33 * 365 + 8
    private static final long CYCLE_DAYS = 12053;

    private final boolean strictRange;
    private volatile boolean warnedOutOfRange = false;

    /** A calendar that rejects years outside the supported range. */
    public FastPersianCalendar() {
        this(true);
    }

    public FastPersianCalendar(boolean strictRange) {
        this.strictRange = strictRange;
    }

    /** Calendar honouring the configured range policy. */
    public static FastPersianCalendar withDefaultSettings() {
        return of(CalendarSettings.get());
    }

    public static FastPersianCalendar of(CalendarSettings settings) {
        return new FastPersianCalendar(settings.isStrictFastRange());
    }

    public boolean isStrictRange() {
        return strictRange;
    }

    public static boolean isSupportedYear(int year) {
        return SUPPORTED_FIRST_YEAR <= year && year <= SUPPORTED_LAST_YEAR;
    }

    /** The plain 33-year rule, without corrections. */
    static boolean isLeapYearByCycle(int year) {
        return Math.floorMod(25L * year + 11, 33) < 8;
    }

    @Override
    public long fixedFromPersian(PersianDate date) {
        checkYear(date.year());
        return fixedFromPersian(date.year(), date.month(), date.day());
    }

    @Override
    public PersianDate persianFromFixed(long date) {
        long daysSinceEpoch = date - fixedFromPersian(1, 1, 1);
        long y = 1 + Math.floorDiv(33 * daysSinceEpoch + 3, CYCLE_DAYS);
        if (y < 1) {
            throw new UnsupportedYearException(
                    (int) Math.max(y, Integer.MIN_VALUE), SUPPORTED_FIRST_YEAR, SUPPORTED_LAST_YEAR);
        }
        int year = Math.toIntExact(y);
        long dayOfYear = date - fixedFromPersian(year, 1, 1) + 1;
        if (dayOfYear == 366 && NON_LEAP_CORRECTION.contains(year)) {
            year++;
            dayOfYear = 1;
        }
        checkYear(year);
        int month = PersianDate.monthOfDayOfYear(dayOfYear);
        int day = (int) (date - fixedFromPersian(year, month, 1) + 1);
        return new PersianDate(year, month, day);
    }

    @Override
    public boolean isLeapYear(int year) {
        checkYear(year);
        if (NON_LEAP_CORRECTION.contains(year)) return false;
        if (NON_LEAP_CORRECTION.contains(year - 1)) return true;
        return isLeapYearByCycle(year);
    }

    private static long fixedFromPersian(int year, int month, int day) {
        long newYear = EPOCH - 1 + 365L * (year - 1) + Math.floorDiv(8L * year + 21, 33);
        if (NON_LEAP_CORRECTION.contains(year - 1)) newYear--;
        return newYear - 1 + PersianDate.daysBeforeMonth(month) + day;
    }

    private void checkYear(int year) {
        if (year < 1) throw new UnsupportedYearException(year, SUPPORTED_FIRST_YEAR, SUPPORTED_LAST_YEAR);
        if (isSupportedYear(year)) return;
        if (strictRange) throw new UnsupportedYearException(year, SUPPORTED_FIRST_YEAR, SUPPORTED_LAST_YEAR);
        if (!warnedOutOfRange) {
            synchronized (this) {
                if (!warnedOutOfRange) {
                    warnedOutOfRange = true;
                    log.warn("Persian year {} is outside the verified range [{}, {}]; "
                                    + "33-year cycle results may differ from the astronomical calendar",
                            year, SUPPORTED_FIRST_YEAR, SUPPORTED_LAST_YEAR);
                }
            }
        }
    }

    @Override
    public String toString() {
        return "FastPersianCalendar[strictRange=" + strictRange + "]";
    }
}
