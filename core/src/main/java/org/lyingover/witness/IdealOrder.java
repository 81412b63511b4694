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

import com.google.common.base.Preconditions;
import org.lyingover.algebraic.Ideal;
import org.lyingover.algebraic.IntegralExtension;
import org.lyingover.algebraic.NonZeroDivisor;
import org.lyingover.algebraic.PrimeIdeal;
import org.lyingover.algebraic.RingHom;
import org.lyingover.polynomial.Polynomial;

/**
 * Consequences of the witness finder for the order of ideals under comap.
 */
public final class IdealOrder {
    private IdealOrder() {}

    /**
     * A nonzero element of comap(I), obtained from a non-zero-divisor of I
     * and a nonzero polynomial vanishing at it.
     */
    public static <R, S> R comapNonZero(
            RingHom<R, S> map, Ideal<S> ideal, S value, Polynomial<R> p, NonZeroDivisor<S> certificate) {
        return WitnessFinder.findWitness(map, ideal, value, p, certificate).coefficient();
    }

    /**
     * A nonzero element of comap(I) in an integral extension of a domain,
     * using the integrality witness of a nonzero element of I.
     */
    public static <R, S> R comapNonZeroOfIntegral(IntegralExtension<R, S> extension, Ideal<S> ideal, S value) {
        Preconditions.checkArgument(extension.target().isDomain(), "%s is not a domain", extension.target());
        Polynomial<R> p = extension.witness(value);
        return WitnessFinder.findWitnessInDomain(extension.structureMap(), ideal, value, p).coefficient();
    }

    /**
     * Comap is strictly monotone on primes: if I is strictly below J,
     * as witnessed by r, then comap(I) is strictly below comap(J).
     * @param p  Polynomial with p(r) in I, nonzero modulo comap(I).
     */
    public static <R, S> StrictInclusion<R> comapStrictMono(
            RingHom<R, S> map, PrimeIdeal<S> lower, Ideal<S> upper, S value, Polynomial<R> p) {
        CoefficientWitness<R> witness = WitnessFinder.findDifferenceWitness(map, lower, upper, value, p);
        return new StrictInclusion<R>(lower.comap(map), upper.comap(map), witness.coefficient());
    }

    /**
     * Strict monotonicity in an integral extension.  The integrality
     * witness of r is monic, so it stays nonzero modulo the proper
     * ideal comap(I).
     */
    public static <R, S> StrictInclusion<R> comapStrictMonoOfIntegral(
            IntegralExtension<R, S> extension, PrimeIdeal<S> lower, Ideal<S> upper, S value) {
        Polynomial<R> p = extension.witness(value);
        return comapStrictMono(extension.structureMap(), lower, upper, value, p);
    }
}
