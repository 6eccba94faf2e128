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
 */
package com.github.tinemuz.solarhijri;

/**
 * A Persian (solar Hijri) date.
 *
 * <p>The constructor only checks what holds in every year: there is no year 0,
 * months run 1..12 and days 1..31. Whether day 30 of month 12 exists depends
 * on the leap rule of a particular {@link PersianCalendar}; use
 * {@link PersianCalendar#date(int, int, int)} for a fully validated value.</p>
 *
 * <p>Months 1 to 6 have 31 days, months 7 to 11 have 30 days and month 12
 * has 29, or 30 in a leap year.</p>
 */
public record PersianDate(int year, int month, int day) {

    public PersianDate {
        if (year == 0)
            throw new InvalidDateException("the Persian calendar has no year 0");
        if (month < 1 || month > 12)
            throw new InvalidDateException("invalid month " + month + " in Persian year " + year);
        if (day < 1 || day > 31)
            throw new InvalidDateException("invalid day " + day + " in Persian month " + month);
    }

    /** Days in the months of a year before the given month. */
    static int daysBeforeMonth(int month) {
        return month <= 7 ? 31 * (month - 1) : 30 * (month - 1) + 6;
    }

    /** Month containing the given 1-based day of the year. */
    static int monthOfDayOfYear(long dayOfYear) {
        if (dayOfYear <= 186) return (int) CalendarMath.ceilDiv(dayOfYear, 31);
        return (int) CalendarMath.ceilDiv(dayOfYear - 6, 30);
    }

    /** Year after the given one, skipping year 0. */
    static int nextYear(int year) {
        return year == -1 ? 1 : year + 1;
    }

    @Override
    public String toString() {
        return year + "/" + month + "/" + day;
    }
}
