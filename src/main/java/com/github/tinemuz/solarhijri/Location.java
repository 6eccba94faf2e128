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
 * An observation point used to turn local apparent (sundial) time into
 * universal time.
 *
 * @param latitude  degrees, north positive, in [-90, 90]
 * @param longitude degrees, east positive, in [-180, 180]
 * @param elevation metres above mean sea level
 * @param zone      difference from UTC in hours
 */
public record Location(double latitude, double longitude, double elevation, double zone) {

    /** Middle of Iran, on the 52.5°E meridian of Iran Standard Time. */
    public static final Location IRAN = new Location(35.5, 52.5, 0, 3.5);

    /** Tehran. */
    public static final Location TEHRAN = new Location(35.68, 51.42, 1100, 3.5);

    public Location {
        if (!Double.isFinite(latitude) || latitude < -90.0 || latitude > 90.0)
            throw new IllegalArgumentException("latitude must be in [-90, 90]: " + latitude);
        if (!Double.isFinite(longitude) || longitude < -180.0 || longitude > 180.0)
            throw new IllegalArgumentException("longitude must be in [-180, 180]: " + longitude);
        if (!Double.isFinite(elevation))
            throw new IllegalArgumentException("elevation must be finite: " + elevation);
        if (!Double.isFinite(zone) || zone < -14.0 || zone > 14.0)
            throw new IllegalArgumentException("zone must be in [-14, 14] hours: " + zone);
    }

    /** Difference between UT and local mean time at this longitude, as a fraction of a day. */
    public double zoneFromLongitude() {
        return longitude / 360;
    }
}
