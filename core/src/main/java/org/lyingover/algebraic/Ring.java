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

package org.lyingover.algebraic;

/**
 * An algebraic structure of a commutative ring with identity.
 * The decision procedures at the end are answered only by rings that
 * know how to answer them; the others throw UnsupportedOperationException.
 * @param <T>  Type of elements in the ring.
 */
public interface Ring<T> extends Group<T> {
    /**
     * Multiplication in the ring.
     * @param left   Left value to multiply.
     * @param right  Right value to multiply.
     * @return       The result of the multiplication.  This operation better be
     *               associative and commutative.
     */
    T times(T left, T right);

    /**
     * The neutral element for multiplication.
     */
    T one();

    /**
     * Check if a value is one.
     * @param value  Value to compare.
     * @return       True if the value is the ring one element.
     */
    default boolean isOne(T value) {
        return this.equal(value, this.one());
    }

    /**
     * @param value     Value to raise.
     * @param exponent  Non-negative exponent.
     * @return          value multiplied with itself exponent times.
     */
    default T power(T value, int exponent) {
        if (exponent < 0)
            throw new IllegalArgumentException("Negative exponent " + exponent);
        T result = this.one();
        for (int i = 0; i < exponent; i++)
            result = this.times(result, value);
        return result;
    }

    /**
     * True for the zero ring, where one equals zero.
     */
    default boolean isTrivial() {
        return this.isZero(this.one());
    }

    /**
     * True if the ring has no zero divisors and is not trivial.
     */
    default boolean isDomain() {
        return false;
    }

    /**
     * True if multiplying by value never produces zero from a nonzero element.
     */
    default boolean isNonZeroDivisor(T value) {
        if (this.isDomain())
            return !this.isZero(value);
        throw new UnsupportedOperationException("Cannot decide zero divisors in " + this);
    }

    /**
     * Decide whether an ideal of this ring is prime.
     */
    default boolean isPrime(Ideal<T> ideal) {
        throw new UnsupportedOperationException("Cannot decide primality of " + ideal + " in " + this);
    }

    /**
     * Decide whether an ideal of this ring is maximal.
     */
    default boolean isMaximal(Ideal<T> ideal) {
        throw new UnsupportedOperationException("Cannot decide maximality of " + ideal + " in " + this);
    }
}
