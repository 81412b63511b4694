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

package org.lyingover.lifting;

import org.lyingover.algebraic.PrimeIdeal;

/**
 * A prime of an extension lying over a prime of the base.
 * @param <R>  Type of elements of the base ring.
 * @param <S>  Type of elements of the extension.
 */
public final class PrimeOver<R, S> {
    final PrimeIdeal<R> base;
    final PrimeIdeal<S> lifted;

    PrimeOver(PrimeIdeal<R> base, PrimeIdeal<S> lifted) {
        this.base = base;
        this.lifted = lifted;
    }

    public PrimeIdeal<R> base() {
        return this.base;
    }

    /**
     * The prime Q of the extension; its preimage is the base prime.
     */
    public PrimeIdeal<S> lifted() {
        return this.lifted;
    }

    @Override
    public String toString() {
        return this.lifted + " over " + this.base;
    }
}
