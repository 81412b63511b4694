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
 * An element of a localization: a numerator from the localized ring
 * and a denominator from the base ring, outside the prime the
 * localization is taken at.  Equality is decided by the localization,
 * not by this class.
 * @param <R>  Type of denominators.
 * @param <S>  Type of numerators.
 */
public final class Fraction<R, S> {
    final S numerator;
    final R denominator;

    Fraction(S numerator, R denominator) {
        this.numerator = numerator;
        this.denominator = denominator;
    }

    public S numerator() {
        return this.numerator;
    }

    public R denominator() {
        return this.denominator;
    }

    @Override
    public String toString() {
        return this.numerator + "/" + this.denominator;
    }
}
