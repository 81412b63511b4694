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
 * An ideal certified to be prime.  Certificates are produced either by
 * asking the ring to decide primality, or by the derivation rules of
 * this package (preimages, quotients, localizations).
 * @param <T>  Type of elements in the ring.
 */
public class PrimeIdeal<T> extends Ideal<T> {
    PrimeIdeal(Ideal<T> ideal) {
        super(ideal);
    }

    /**
     * Certify an ideal as prime; the ring of the ideal must be able to
     * decide primality.
     * @throws IllegalArgumentException if the ideal is not prime.
     */
    public static <T> PrimeIdeal<T> of(Ideal<T> ideal) {
        if (ideal instanceof PrimeIdeal)
            return (PrimeIdeal<T>)ideal;
        Preconditions.checkArgument(ideal.ring().isPrime(ideal), "%s is not a prime ideal", ideal);
        return new PrimeIdeal<T>(ideal);
    }

    static <T> PrimeIdeal<T> derived(Ideal<T> ideal) {
        return new PrimeIdeal<T>(ideal);
    }

    /**
     * The preimage of a prime ideal is prime.
     */
    @Override
    public <S> PrimeIdeal<S> comap(RingHom<S, T> map) {
        return new PrimeIdeal<S>(super.comap(map));
    }
}
