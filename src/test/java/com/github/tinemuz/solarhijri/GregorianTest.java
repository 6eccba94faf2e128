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

import static org.junit.jupiter.api.Assertions.*;

import java.time.LocalDate;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class GregorianTest {

    @Nested
    @DisplayName("Fixed dates from Gregorian dates")
    class ToFixedTests {

        @Test
        @DisplayName("Epoch and well-known dates")
        void knownDates() {
            assertEquals(1, Gregorian.fixedFromGregorian(1, 1, 1), "Epoch is fixed date 1");
            assertEquals(719163, Gregorian.fixedFromGregorian(1970, 1, 1), "Unix epoch");
            assertEquals(738965, Gregorian.fixedFromGregorian(2024, 3, 20), "Nowruz 1403");
            assertEquals(730120, Gregorian.fixedFromGregorian(2000, 1, 1));
        }

        @Test
        @DisplayName("Leap day only exists in leap years")
        void leapDay() {
            assertEquals(
                    Gregorian.fixedFromGregorian(2024, 3, 1) - 1,
                    Gregorian.fixedFromGregorian(2024, 2, 29));
            assertEquals(
                    Gregorian.fixedFromGregorian(2023, 3, 1) - 1,
                    Gregorian.fixedFromGregorian(2023, 2, 28));
            assertEquals(
                    Gregorian.fixedFromGregorian(1900, 3, 1) - 1,
                    Gregorian.fixedFromGregorian(1900, 2, 28));
        }

        @Test
        @DisplayName("Invalid month is rejected")
        void invalidMonth() {
            assertThrows(IllegalArgumentException.class, () -> Gregorian.fixedFromGregorian(2024, 13, 1));
            assertThrows(IllegalArgumentException.class, () -> Gregorian.fixedFromGregorian(2024, 0, 1));
        }
    }

    @Nested
    @DisplayName("Gregorian dates from fixed dates")
    class FromFixedTests {

        @Test
        @DisplayName("Leap year rule")
        void leapYears() {
            assertTrue(Gregorian.isLeapYear(2000));
            assertTrue(Gregorian.isLeapYear(2024));
            assertTrue(Gregorian.isLeapYear(0));
            assertFalse(Gregorian.isLeapYear(1900));
            assertFalse(Gregorian.isLeapYear(2023));
            assertTrue(Gregorian.isLeapYear(-4));
            assertFalse(Gregorian.isLeapYear(-100));
        }

        @Test
        @DisplayName("Year boundaries")
        void yearBoundaries() {
            assertEquals(2023, Gregorian.gregorianYearFromFixed(Gregorian.fixedFromGregorian(2023, 12, 31)));
            assertEquals(2024, Gregorian.gregorianYearFromFixed(Gregorian.fixedFromGregorian(2024, 1, 1)));
            assertEquals(2024, Gregorian.gregorianYearFromFixed(Gregorian.fixedFromGregorian(2024, 12, 31)));
            assertEquals(0, Gregorian.gregorianYearFromFixed(0));
            assertEquals(1, Gregorian.gregorianYearFromFixed(1));
        }

        @Test
        @DisplayName("Round trip over four centuries, checked against java.time")
        void roundTrip() {
            long start = Gregorian.fixedFromGregorian(1800, 1, 1);
            long end = Gregorian.fixedFromGregorian(2200, 1, 1);
            for (long date = start; date < end; date++) {
                GregorianDate g = Gregorian.gregorianFromFixed(date);
                assertEquals(date, Gregorian.fixedFromGregorian(g), "Round trip of " + g);
                LocalDate iso = Gregorian.localDateFromFixed(date);
                assertEquals(iso.getYear(), g.year());
                assertEquals(iso.getMonthValue(), g.month());
                assertEquals(iso.getDayOfMonth(), g.day());
            }
        }

        @Test
        @DisplayName("March 1 follows the last day of February")
        void marchFirst() {
            assertEquals(new GregorianDate(2024, 3, 1),
                    Gregorian.gregorianFromFixed(Gregorian.fixedFromGregorian(2024, 3, 1)));
            assertEquals(new GregorianDate(2024, 2, 29),
                    Gregorian.gregorianFromFixed(Gregorian.fixedFromGregorian(2024, 2, 29)));
        }

        @Test
        @DisplayName("Date difference and java.time bridge")
        void differenceAndBridge() {
            assertEquals(366, Gregorian.gregorianDateDifference(
                    new GregorianDate(2024, 1, 1), new GregorianDate(2025, 1, 1)));
            assertEquals(-365, Gregorian.gregorianDateDifference(
                    new GregorianDate(2024, 1, 1), new GregorianDate(2023, 1, 1)));
            assertEquals(738965, Gregorian.fixedFromLocalDate(LocalDate.of(2024, 3, 20)));
            assertEquals(LocalDate.of(1970, 1, 1), Gregorian.localDateFromFixed(719163));
            assertEquals("2024-03-20", new GregorianDate(2024, 3, 20).toString());
        }
    }

    @Nested
    @DisplayName("Julian calendar")
    class JulianTests {

        @Test
        @DisplayName("Epoch is Gregorian 0-12-30")
        void epoch() {
            assertEquals(-1, Julian.EPOCH);
            assertEquals(-1, Julian.fixedFromJulian(1, 1, 1));
            assertEquals(-2, Julian.fixedFromJulian(-1, 12, 31), "No year 0 between 1 BC and AD 1");
        }

        @Test
        @DisplayName("Persian epoch is Julian 622-03-19")
        void persianEpoch() {
            assertEquals(226896, Julian.fixedFromJulian(622, 3, 19));
            assertEquals(new GregorianDate(622, 3, 22), Gregorian.gregorianFromFixed(226896));
        }

        @Test
        @DisplayName("Leap years, including before year 1")
        void leapYears() {
            assertTrue(Julian.isLeapYear(4));
            assertTrue(Julian.isLeapYear(1900), "Every fourth year, centuries included");
            assertFalse(Julian.isLeapYear(622));
            assertTrue(Julian.isLeapYear(-1));
            assertTrue(Julian.isLeapYear(-5));
            assertFalse(Julian.isLeapYear(-4));
        }

        @Test
        @DisplayName("Julian and Gregorian differ by 13 days in the 20th century")
        void offset() {
            assertEquals(Gregorian.fixedFromGregorian(1918, 2, 14), Julian.fixedFromJulian(1918, 2, 1));
        }

        @Test
        @DisplayName("Year 0 and invalid months are rejected")
        void invalid() {
            assertThrows(IllegalArgumentException.class, () -> Julian.fixedFromJulian(0, 1, 1));
            assertThrows(IllegalArgumentException.class, () -> Julian.fixedFromJulian(100, 13, 1));
        }
    }
}
