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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class PersianDateTest {

    @Nested
    @DisplayName("Construction")
    class ConstructionTests {

        @Test
        @DisplayName("Fields outside their fixed ranges are rejected")
        void invalidFields() {
            assertThrows(InvalidDateException.class, () -> new PersianDate(0, 1, 1));
            assertThrows(InvalidDateException.class, () -> new PersianDate(1403, 0, 1));
            assertThrows(InvalidDateException.class, () -> new PersianDate(1403, 13, 1));
            assertThrows(InvalidDateException.class, () -> new PersianDate(1403, 1, 0));
            assertThrows(InvalidDateException.class, () -> new PersianDate(1403, 1, 32));
        }

        @Test
        @DisplayName("Invalid dates are IllegalArgumentExceptions")
        void exceptionType() {
            assertTrue(IllegalArgumentException.class.isAssignableFrom(InvalidDateException.class));
        }

        @Test
        @DisplayName("Value semantics")
        void valueSemantics() {
            assertEquals(new PersianDate(1403, 1, 1), new PersianDate(1403, 1, 1));
            assertEquals(new PersianDate(1403, 1, 1).hashCode(), new PersianDate(1403, 1, 1).hashCode());
            assertNotEquals(new PersianDate(1403, 1, 1), new PersianDate(-1403, 1, 1));
            assertEquals("1403/1/1", new PersianDate(1403, 1, 1).toString());
        }
    }

    @Nested
    @DisplayName("Month arithmetic")
    class MonthTests {

        @Test
        @DisplayName("Days before each month")
        void daysBeforeMonth() {
            assertEquals(0, PersianDate.daysBeforeMonth(1));
            assertEquals(155, PersianDate.daysBeforeMonth(6));
            assertEquals(186, PersianDate.daysBeforeMonth(7));
            assertEquals(216, PersianDate.daysBeforeMonth(8));
            assertEquals(336, PersianDate.daysBeforeMonth(12));
        }

        @Test
        @DisplayName("Month of a day of the year")
        void monthOfDayOfYear() {
            assertEquals(1, PersianDate.monthOfDayOfYear(1));
            assertEquals(1, PersianDate.monthOfDayOfYear(31));
            assertEquals(2, PersianDate.monthOfDayOfYear(32));
            assertEquals(6, PersianDate.monthOfDayOfYear(186));
            assertEquals(7, PersianDate.monthOfDayOfYear(187));
            assertEquals(7, PersianDate.monthOfDayOfYear(216));
            assertEquals(8, PersianDate.monthOfDayOfYear(217));
            assertEquals(12, PersianDate.monthOfDayOfYear(365));
            assertEquals(12, PersianDate.monthOfDayOfYear(366));
        }

        @Test
        @DisplayName("Both functions agree on every day of a leap year")
        void consistent() {
            for (int dayOfYear = 1; dayOfYear <= 366; dayOfYear++) {
                int month = PersianDate.monthOfDayOfYear(dayOfYear);
                int day = dayOfYear - PersianDate.daysBeforeMonth(month);
                assertTrue(day >= 1 && day <= 31, "Day " + dayOfYear + " maps to " + month + "/" + day);
            }
        }

        @Test
        @DisplayName("Neighbouring years skip year 0")
        void neighbours() {
            assertEquals(1, PersianDate.nextYear(-1));
            assertEquals(1404, PersianDate.nextYear(1403));
            assertEquals(-2, PersianDate.nextYear(-3));
        }
    }
}
