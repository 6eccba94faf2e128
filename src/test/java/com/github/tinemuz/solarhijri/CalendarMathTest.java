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

class CalendarMathTest {

    @Nested
    @DisplayName("Modulus")
    class ModulusTests {

        @Test
        @DisplayName("Result takes the sign of the divisor")
        void signOfDivisor() {
            assertEquals(359.0, CalendarMath.mod(-1, 360), 0.0);
            assertEquals(1.0, CalendarMath.mod(361, 360), 0.0);
            assertEquals(-359.0, CalendarMath.mod(1, -360), 0.0);
            assertEquals(0.0, CalendarMath.mod(720, 360), 0.0);
            assertEquals(0.5, CalendarMath.mod(-359.5, 360), 1e-12);
        }

        @Test
        @DisplayName("mod3 shifts into [a, b)")
        void shiftedRange() {
            assertEquals(-170.0, CalendarMath.mod3(190, -180, 180), 1e-12);
            assertEquals(170.0, CalendarMath.mod3(-190, -180, 180), 1e-12);
            assertEquals(-180.0, CalendarMath.mod3(180, -180, 180), 1e-12);
            assertEquals(10.0, CalendarMath.mod3(10, -180, 180), 1e-12);
        }

        @Test
        @DisplayName("mod3 is the identity for an empty range")
        void emptyRange() {
            assertEquals(1234.5, CalendarMath.mod3(1234.5, 7, 7), 0.0);
        }

        @Test
        @DisplayName("Ceiling division rounds up for both signs")
        void ceilDiv() {
            assertEquals(1, CalendarMath.ceilDiv(1, 31));
            assertEquals(1, CalendarMath.ceilDiv(31, 31));
            assertEquals(2, CalendarMath.ceilDiv(32, 31));
            assertEquals(0, CalendarMath.ceilDiv(-5, 31));
            assertEquals(-1, CalendarMath.ceilDiv(-31, 31));
        }
    }

    @Nested
    @DisplayName("Polynomials and angles")
    class PolynomialTests {

        @Test
        @DisplayName("Horner evaluation matches the expanded polynomial")
        void horner() {
            double x = 1.7;
            double expected = 2 - 3 * x + 0.5 * x * x + 4 * x * x * x;
            assertEquals(expected, CalendarMath.poly(x, 2, -3, 0.5, 4), 1e-12);
        }

        @Test
        @DisplayName("Empty and constant polynomials")
        void degenerate() {
            assertEquals(0.0, CalendarMath.poly(3.0), 0.0);
            assertEquals(42.0, CalendarMath.poly(1e9, 42), 0.0);
        }

        @Test
        @DisplayName("Sexagesimal angles and hours")
        void angleAndHours() {
            assertEquals(23.439291111, CalendarMath.angle(23, 26, 21.448), 1e-9);
            assertEquals(0.5, CalendarMath.hr(12), 0.0);
            assertEquals(-1, CalendarMath.sign(-0.1));
            assertEquals(0, CalendarMath.sign(0.0));
            assertEquals(1, CalendarMath.sign(7));
        }
    }

    @Nested
    @DisplayName("Degree trigonometry")
    class TrigonometryTests {

        @Test
        @DisplayName("Known values")
        void knownValues() {
            assertEquals(1.0, CalendarMath.sinDegrees(90), 1e-15);
            assertEquals(-1.0, CalendarMath.cosDegrees(180), 1e-15);
            assertEquals(1.0, CalendarMath.tanDegrees(45), 1e-15);
            assertEquals(0.5, CalendarMath.sinDegrees(30), 1e-15);
        }

        @Test
        @DisplayName("Large arguments are folded before conversion")
        void largeArguments() {
            double big = 360.0 * 1_000_000 + 30;
            assertEquals(0.5, CalendarMath.sinDegrees(big), 1e-9);
            assertEquals(CalendarMath.cosDegrees(-60), CalendarMath.cosDegrees(300), 1e-15);
            assertTrue(CalendarMath.radiansFromDegrees(-10) > 0, "Negative angles fold into [0, 2π)");
        }
    }
}
