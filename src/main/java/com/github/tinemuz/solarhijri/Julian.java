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
 * Julian calendar arithmetic. Years run ..., -2, -1, 1, 2, ... with no year zero.
 */
public final class Julian {
    /** Fixed date of the start of the Julian calendar (Gregorian 0-12-30). */
    public static final long EPOCH = Gregorian.fixedFromGregorian(0, 12, 30);

    private Julian() {}

    public static boolean isLeapYear(long year) {
        return Math.floorMod(year, 4) == (year > 0 ? 0 : 3);
    }

    /**
     * Fixed date of the given Julian date.
     *
     * @throws IllegalArgumentException for year 0 or a month outside 1..12
     */
    public static long fixedFromJulian(long year, int month, int day) {
        if (year == 0)
            throw new IllegalArgumentException("the Julian calendar has no year 0");
        if (month < 1 || month > 12)
            throw new IllegalArgumentException("invalid month " + month);
        long y = year < 0 ? year + 1 : year;
        int february;
        if (month <= 2) february = 0;
        else february = isLeapYear(year) ? -1 : -2;
        return EPOCH - 1
                + 365 * (y - 1)
                + Math.floorDiv(y - 1, 4)
                + Math.floorDiv(367 * month - 362, 12)
                + february
                + day;
    }
}
