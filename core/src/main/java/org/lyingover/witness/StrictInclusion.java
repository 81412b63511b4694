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

package org.lyingover.witness;

import org.lyingover.algebraic.Ideal;

/**
 * Evidence that one ideal is strictly contained in another: the
 * inclusion, and an element of the larger ideal outside the smaller one.
 * @param <R>  Type of elements in the ring of the ideals.
 */
public final class StrictInclusion<R> {
    final Ideal<R> lower;
    final Ideal<R> upper;
    final R separating;

    StrictInclusion(Ideal<R> lower, Ideal<R> upper, R separating) {
        this.lower = lower;
        this.upper = upper;
        this.separating = separating;
    }

    public Ideal<R> lower() {
        return this.lower;
    }

    public Ideal<R> upper() {
        return this.upper;
    }

    /**
     * An element of upper which is not in lower.
     */
    public R separatingElement() {
        return this.separating;
    }

    @Override
    public String toString() {
        return this.lower + " < " + this.upper + " (separated by " + this.separating + ")";
    }
}
