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
 * A ring that can enumerate all its elements.  Every question about
 * elements and ideals is answered by exhaustive search.
 * @param <T>  Type of elements in the ring.
 */
public interface FiniteRing<T> extends Ring<T> {
    /**
     * All elements of the ring, each exactly once.
     */
    Iterable<T> elements();

    @Override
    default boolean isDomain() {
        if (this.isTrivial())
            return false;
        for (T x: this.elements()) {
            if (this.isZero(x))
                continue;
            if (!this.isNonZeroDivisor(x))
                return false;
        }
        return true;
    }

    @Override
    default boolean isNonZeroDivisor(T value) {
        for (T y: this.elements()) {
            if (this.isZero(this.times(value, y)) && !this.isZero(y))
                return false;
        }
        return true;
    }

    @Override
    default boolean isPrime(Ideal<T> ideal) {
        if (!ideal.isProper())
            return false;
        for (T x: this.elements()) {
            if (ideal.contains(x))
                continue;
            for (T y: this.elements()) {
                if (!ideal.contains(y) && ideal.contains(this.times(x, y)))
                    return false;
            }
        }
        return true;
    }

    /**
     * An ideal of a finite ring is maximal iff every element outside it
     * is invertible modulo the ideal.
     */
    @Override
    default boolean isMaximal(Ideal<T> ideal) {
        if (!ideal.isProper())
            return false;
        for (T x: this.elements()) {
            if (ideal.contains(x))
                continue;
            boolean invertible = false;
            for (T y: this.elements()) {
                if (ideal.contains(this.subtract(this.times(x, y), this.one()))) {
                    invertible = true;
                    break;
                }
            }
            if (!invertible)
                return false;
        }
        return true;
    }
}
