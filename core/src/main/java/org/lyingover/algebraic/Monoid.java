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
 * The additive structure underlying our rings: a commutative, associative
 * addition with a neutral element.
 * @param <T>  Type of the values.
 */
public interface Monoid<T> {
    T add(T left, T right);

    T zero();

    /**
     * Zero test.  The default compares with equals; structures whose values
     * are only representatives (quotients, fractions) override it.
     */
    default boolean isZero(T value) {
        return value.equals(this.zero());
    }

    /**
     * Add up a sequence of values; zero for an empty sequence.
     */
    default T sum(Iterable<T> values) {
        T result = this.zero();
        for (T v: values)
            result = this.add(result, v);
        return result;
    }
}
