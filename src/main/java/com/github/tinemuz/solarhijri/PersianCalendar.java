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
 * Conversions between Persian (solar Hijri) dates and fixed dates.
 *
 * <p>{@link #fixedFromPersian} and {@link #persianFromFixed} trust their
 * input; they do not check that day 30 of month 12 exists in the year.
 * Callers holding unchecked input go through {@link #date} or
 * {@link #validate} first.</p>
 */
public interface PersianCalendar {

    /** Gregorian year in which Persian year 1 began. */
    int EPOCH_GREGORIAN_YEAR = 622;

    long fixedFromPersian(PersianDate date);

    PersianDate persianFromFixed(long date);

    boolean isLeapYear(int year);

    default int yearLength(int year) {
        return isLeapYear(year) ? 366 : 365;
    }

    /** Number of days in a month of a year. */
    default int monthLength(int year, int month) {
        if (month < 1 || month > 12)
            throw new InvalidDateException("invalid month " + month + " in Persian year " + year);
        if (month <= 6) return 31;
        if (month <= 11) return 30;
        return isLeapYear(year) ? 30 : 29;
    }

    default boolean isValid(PersianDate date) {
        return date.day() <= monthLength(date.year(), date.month());
    }

    /**
     * Check that the date exists in this calendar.
     *
     * @return the same date
     * @throws InvalidDateException if the day is past the end of its month
     */
    default PersianDate validate(PersianDate date) {
        if (!isValid(date))
            throw new InvalidDateException("Persian month " + date.month() + " of year "
                    + date.year() + " has " + monthLength(date.year(), date.month())
                    + " days, not " + date.day());
        return date;
    }

    /**
     * A validated Persian date.
     *
     * @throws InvalidDateException if the fields do not name a day of this calendar
     */
    default PersianDate date(int year, int month, int day) {
        return validate(new PersianDate(year, month, day));
    }

    /** Fixed date of Nowruz, the Persian New Year, that falls in a Gregorian year. */
    default long nowruz(int gregorianYear) {
        int year = gregorianYear - EPOCH_GREGORIAN_YEAR + 1;
        return fixedFromPersian(new PersianDate(year <= 0 ? year - 1 : year, 1, 1));
    }
}
