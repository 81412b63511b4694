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

import com.google.common.collect.ImmutableList;
import org.lyingover.algebraic.Fraction;
import org.lyingover.algebraic.Ideal;
import org.lyingover.algebraic.IntegralExtension;
import org.lyingover.algebraic.Localization;
import org.lyingover.algebraic.PrimeIdeal;
import org.lyingover.algebraic.QuotientRing;
import org.lyingover.algebraic.Ring;
import org.lyingover.witness.IdealOrder;

import javax.annotation.Nullable;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Selects the maximal ideal of S_P generated by the first suitable prime
 * of an ordered list of candidate primes of S.  A candidate is suitable
 * if it is prime, contains the image of P, and the integrality witness
 * of each of its generators contracts into P.  Such a candidate lies
 * over P; its extension to S_P is then maximal.
 *
 * <p>When the extension has been replaced by a quotient S/I the
 * candidates are still ideals of S; they are carried into S/I when they
 * contain I and skipped otherwise.
 * @param <R>  Type of elements of the base ring.
 * @param <S>  Type of elements of the extension.
 */
public class CandidateSelector<R, S> implements MaximalIdealSelector<R, S> {
    private static final Logger LOG = Logger.getLogger(CandidateSelector.class.getName());

    final ImmutableList<Ideal<S>> candidates;

    public CandidateSelector(List<? extends Ideal<S>> candidates) {
        this.candidates = ImmutableList.copyOf(candidates);
    }

    @Override
    public Ideal<Fraction<R, S>> select(Localization<R, S> localization, IntegralExtension<R, S> extension) {
        for (Ideal<S> candidate: this.candidates) {
            Ideal<S> ideal = this.transfer(candidate, localization.base());
            if (ideal == null)
                continue;
            if (liesOver(ideal, localization.prime(), extension))
                return localization.extend(PrimeIdeal.of(ideal));
        }
        throw new LiftingException("No candidate lies over " + localization.prime()
                + " among " + this.candidates);
    }

    /**
     * Read a candidate as an ideal of ring.
     * @return null if the candidate has no counterpart in ring.
     */
    @Nullable
    Ideal<S> transfer(Ideal<S> candidate, Ring<S> ring) {
        if (candidate.ring().equals(ring))
            return candidate;
        if (ring instanceof QuotientRing) {
            QuotientRing<S> quotient = (QuotientRing<S>)ring;
            if (candidate.ring().equals(quotient.base())) {
                if (!quotient.modulus().hasGenerators() || quotient.modulus().isLe(candidate))
                    return quotient.image(candidate);
                if (LOG.isLoggable(Level.FINER))
                    LOG.finer("Rejected " + candidate + ": does not contain " + quotient.modulus());
                return null;
            }
        }
        if (LOG.isLoggable(Level.FINER))
            LOG.finer("Rejected " + candidate + ": not an ideal of " + ring);
        return null;
    }

    /**
     * True if ideal is a prime with generators, contains the image of
     * prime, and the integrality witness of each nonzero generator
     * contracts into prime.  Then comap(ideal) = prime.
     */
    static <R, S> boolean liesOver(Ideal<S> ideal, PrimeIdeal<R> prime, IntegralExtension<R, S> extension) {
        Ring<S> ring = ideal.ring();
        if (!ideal.hasGenerators() || !ring.isPrime(ideal)) {
            if (LOG.isLoggable(Level.FINER))
                LOG.finer("Rejected " + ideal + ": not a prime with generators");
            return false;
        }
        for (R g: prime.generators()) {
            if (!ideal.contains(extension.structureMap().apply(g))) {
                if (LOG.isLoggable(Level.FINER))
                    LOG.finer("Rejected " + ideal + ": does not contain the image of " + g);
                return false;
            }
        }
        for (S g: ideal.generators()) {
            if (ring.isZero(g))
                continue;
            R contracted = IdealOrder.comapNonZeroOfIntegral(extension, ideal, g);
            if (!prime.contains(contracted)) {
                if (LOG.isLoggable(Level.FINER))
                    LOG.finer("Rejected " + ideal + ": contains the image of " + contracted
                            + ", which is not in " + prime);
                return false;
            }
        }
        return true;
    }
}
