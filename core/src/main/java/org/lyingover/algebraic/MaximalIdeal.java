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

import com.google.common.base.Preconditions;

/**
 * An ideal certified to be maximal.  Maximal ideals are prime.
 * @param <T>  Type of elements in the ring.
 */
public class MaximalIdeal<T> extends PrimeIdeal<T> {
    MaximalIdeal(Ideal<T> ideal) {
        super(ideal);
    }

    /**
     * Certify an ideal as maximal; the ring must be able to decide maximality.
     * @throws IllegalArgumentException if the ideal is not maximal.
     */
    public static <T> MaximalIdeal<T> of(Ideal<T> ideal) {
        if (ideal instanceof MaximalIdeal)
            return (MaximalIdeal<T>)ideal;
        Preconditions.checkArgument(ideal.ring().isMaximal(ideal), "%s is not a maximal ideal", ideal);
        return new MaximalIdeal<T>(ideal);
    }

    /**
     * Wrap an ideal produced by a maximal ideal selection primitive.
     * Such a primitive stands in for the existence of maximal ideals in
     * nontrivial rings; only properness can be checked here.
     * @throws IllegalArgumentException if the ideal contains one.
     */
    public static <T> MaximalIdeal<T> selected(Ideal<T> ideal) {
        if (ideal instanceof MaximalIdeal)
            return (MaximalIdeal<T>)ideal;
        Preconditions.checkArgument(ideal.isProper(), "Selected ideal %s is not proper", ideal);
        return new MaximalIdeal<T>(ideal);
    }

    static <T> MaximalIdeal<T> derived(Ideal<T> ideal) {
        return new MaximalIdeal<T>(ideal);
    }
}
