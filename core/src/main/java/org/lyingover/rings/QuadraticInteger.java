/*
 * Copyright (c) 2021 VMware, Inc.
 * SPDX-License-Identifier: MIT
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

package org.lyingover.rings;

import java.math.BigInteger;
import java.util.Objects;

/**
 * An element a + b sqrt(d) of a quadratic ring Z[sqrt(d)].
 */
public final class QuadraticInteger {
    final BigInteger a;
    final BigInteger b;
    final long d;

    QuadraticInteger(BigInteger a, BigInteger b, long d) {
        this.a = a;
        this.b = b;
        this.d = d;
    }

    /**
     * Rational part.
     */
    public BigInteger rational() {
        return this.a;
    }

    /**
     * Coefficient of sqrt(d).
     */
    public BigInteger irrational() {
        return this.b;
    }

    /**
     * The norm a^2 - d b^2.
     */
    public BigInteger norm() {
        return this.a.multiply(this.a).subtract(BigInteger.valueOf(this.d).multiply(this.b).multiply(this.b));
    }

    /**
     * The trace 2a.
     */
    public BigInteger trace() {
        return this.a.shiftLeft(1);
    }

    public boolean isZero() {
        return this.a.signum() == 0 && this.b.signum() == 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        QuadraticInteger that = (QuadraticInteger) o;
        return this.d == that.d && this.a.equals(that.a) && this.b.equals(that.b);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.a, this.b, this.d);
    }

    @Override
    public String toString() {
        if (this.b.signum() == 0)
            return this.a.toString();
        String root = "sqrt(" + this.d + ")";
        if (this.a.signum() == 0)
            return this.b + "*" + root;
        return this.a + (this.b.signum() > 0 ? "+" : "") + this.b + "*" + root;
    }
}
