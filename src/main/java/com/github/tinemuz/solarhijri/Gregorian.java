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

import java.time.LocalDate;

/**
 * Proleptic Gregorian calendar arithmetic on fixed dates.
 *
 * <p>Fixed date 1 is January 1 of year 1. Years are astronomical, so year 0
 * exists and precedes year 1.</p>
 */
public final class Gregorian {
    /** Fixed date of the start of the proleptic Gregorian calendar. */
    public static final long EPOCH = 1;

    // Fixed date of 1970-01-01, used to bridge java.time epoch days
    private static final long UNIX_EPOCH = 719163;

    private Gregorian() {}

    public static boolean isLeapYear(long year) {
        long r = Math.floorMod(year, 400);
        return Math.floorMod(year, 4) == 0 && r != 100 && r != 200 && r != 300;
    }

    /**
     * Fixed date of the given Gregorian date.
     *
     * @throws IllegalArgumentException when month is less than 1 or more than 12
     */
    public static long fixedFromGregorian(long year, int month, int day) {
        if (month < 1 || month > 12)
            throw new IllegalArgumentException("invalid month " + month);
        long y = year - 1;
        int february;
        if (month <= 2) february = 0;
        else february = isLeapYear(year) ? -1 : -2;
        return EPOCH - 1
                + 365 * y
                + Math.floorDiv(y, 4)
                - Math.floorDiv(y, 100)
                + Math.floorDiv(y, 400)
                + Math.floorDiv(367 * month - 362, 12) // assumes a 30-day February
                + february
                + day;
    }

    public static long fixedFromGregorian(GregorianDate date) {
        return fixedFromGregorian(date.year(), date.month(), date.day());
    }

    /** Gregorian year containing the fixed date. */
    public static long gregorianYearFromFixed(long date) {
        long d0 = date - EPOCH;
        long n400 = Math.floorDiv(d0, 146097);
        long d1 = Math.floorMod(d0, 146097);
        long n100 = d1 / 36524;
        long d2 = d1 % 36524;
        long n4 = d2 / 1461;
        long d3 = d2 % 1461;
        long n1 = d3 / 365;
        long year = 400 * n400 + 100 * n100 + 4 * n4 + n1;
        // Day 366 of a leap year belongs to the year just counted
        return (n100 == 4 || n1 == 4) ? year : year + 1;
    }

    public static long gregorianNewYear(long year) {
        return fixedFromGregorian(year, 1, 1);
    }

    public static GregorianDate gregorianFromFixed(long date) {
        long year = gregorianYearFromFixed(date);
        long priorDays = date - gregorianNewYear(year);
        int correction;
        if (date < fixedFromGregorian(year, 3, 1)) correction = 0;
        else correction = isLeapYear(year) ? 1 : 2;
        int month = (int) Math.floorDiv(12 * (priorDays + correction) + 373, 367);
        int day = (int) (date - fixedFromGregorian(year, month, 1) + 1);
        return new GregorianDate(Math.toIntExact(year), month, day);
    }

    /** Number of days from the first date until the second. */
    public static long gregorianDateDifference(GregorianDate from, GregorianDate to) {
        return fixedFromGregorian(to) - fixedFromGregorian(from);
    }

    public static long fixedFromLocalDate(LocalDate date) {
        return date.toEpochDay() + UNIX_EPOCH;
    }

    public static LocalDate localDateFromFixed(long date) {
        return LocalDate.ofEpochDay(date - UNIX_EPOCH);
    }
}
