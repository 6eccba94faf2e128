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

import static com.github.tinemuz.solarhijri.SolarPosition.MEAN_TROPICAL_YEAR;

/**
 * The astronomical Persian calendar: each year begins on the day whose true
 * noon, at the calendar's observation point, follows the vernal equinox.
 *
 * <p>Instances are immutable and thread-safe. The observation point is fixed at
 * construction; {@link #withDefaultLocation()} takes it from
 * {@link CalendarSettings}.</p>
 */
public final class AstronomicalPersianCalendar implements PersianCalendar {
    /** Fixed date of 1 Farvardin of year 1: Julian 622-03-19. */
    public static final long EPOCH = Julian.fixedFromJulian(622, 3, 19);

    private final Location location;
    private final int maxEquinoxSteps;

    public AstronomicalPersianCalendar(Location location) {
        this(location, CalendarSettings.DEFAULT_MAX_EQUINOX_STEPS);
    }

    public AstronomicalPersianCalendar(Location location, int maxEquinoxSteps) {
        if (location == null) throw new IllegalArgumentException("location must not be null");
        if (maxEquinoxSteps < 1)
            throw new IllegalArgumentException("max equinox steps must be positive: " + maxEquinoxSteps);
        this.location = location;
        this.maxEquinoxSteps = maxEquinoxSteps;
    }

    /** Calendar at the configured default location, using the configured step cap. */
    public static AstronomicalPersianCalendar withDefaultLocation() {
        return of(CalendarSettings.get());
    }

    public static AstronomicalPersianCalendar of(CalendarSettings settings) {
        return new AstronomicalPersianCalendar(settings.getDefaultLocation(), settings.getMaxEquinoxSteps());
    }

    public Location getLocation() {
        return location;
    }

    /** Universal time of true noon on a fixed date at this calendar's location. */
    public double midday(long date) {
        return SolarPosition.midday(date, location);
    }

    /** Fixed date of the Persian New Year on or before a fixed date. */
    public long newYearOnOrBefore(long date) {
        return EquinoxSearch.springOnOrBefore(date, location, maxEquinoxSteps);
    }

    @Override
    public long fixedFromPersian(PersianDate date) {
        int year = date.year();
        // Half a year into the wanted year; no year 0
        long autumn = EPOCH + 180
                + (long) Math.floor(MEAN_TROPICAL_YEAR * (year > 0 ? year - 1 : year));
        long newYear = newYearOnOrBefore(autumn);
        return newYear - 1 + PersianDate.daysBeforeMonth(date.month()) + date.day();
    }

    @Override
    public PersianDate persianFromFixed(long date) {
        long newYear = newYearOnOrBefore(date);
        long y = (long) Math.rint((newYear - EPOCH) / MEAN_TROPICAL_YEAR) + 1;
        int year = Math.toIntExact(y > 0 ? y : y - 1);
        long dayOfYear = date - fixedFromPersian(new PersianDate(year, 1, 1)) + 1;
        int month = PersianDate.monthOfDayOfYear(dayOfYear);
        int day = (int) (date - fixedFromPersian(new PersianDate(year, month, 1)) + 1);
        return new PersianDate(year, month, day);
    }

    /** A year is leap when the next New Year comes 366 days after its own. */
    @Override
    public boolean isLeapYear(int year) {
        long start = fixedFromPersian(new PersianDate(year, 1, 1));
        long next = fixedFromPersian(new PersianDate(PersianDate.nextYear(year), 1, 1));
        return next - start == 366;
    }

    @Override
    public String toString() {
        return "AstronomicalPersianCalendar[" + location + "]";
    }
}
