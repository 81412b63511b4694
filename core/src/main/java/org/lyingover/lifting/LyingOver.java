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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import org.lyingover.algebraic.Fraction;
import org.lyingover.algebraic.Ideal;
import org.lyingover.algebraic.IntegralExtension;
import org.lyingover.algebraic.Localization;
import org.lyingover.algebraic.MaximalIdeal;
import org.lyingover.algebraic.PrimeIdeal;
import org.lyingover.algebraic.QuotientRing;
import org.lyingover.witness.IdealOrder;

import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Lying over: given an integral extension R to S and a prime P of R
 * containing the kernel, construct a prime Q of S with comap(Q) = P.
 *
 * <p>The construction localizes both rings at the complement of P.
 * R_P is local with maximal ideal P R_P, and S_P is integral over R_P.
 * A maximal ideal Q_P of S_P contracts to a maximal ideal of R_P, which
 * must be P R_P; pulling Q_P back to S gives Q.
 * @param <R>  Type of elements of the base ring.
 * @param <S>  Type of elements of the extension.
 */
public class LyingOver<R, S> {
    private static final Logger LOG = Logger.getLogger(LyingOver.class.getName());

    final LiftingConfig<R, S> config;

    public LyingOver(LiftingConfig<R, S> config) {
        this.config = config;
    }

    public LiftingConfig<R, S> getConfig() {
        return this.config;
    }

    /**
     * Find a prime of the extension lying over prime.
     * @param extension  Integral extension whose target is a domain.
     * @param prime      Prime of the base, with generators, containing the kernel.
     */
    public PrimeOver<R, S> lift(IntegralExtension<R, S> extension, PrimeIdeal<R> prime) {
        Preconditions.checkArgument(extension.target().isDomain(), "%s is not a domain", extension.target());
        Preconditions.checkArgument(prime.ring().equals(extension.source()),
                "%s is not an ideal of %s", prime, extension.source());
        Preconditions.checkArgument(prime.hasGenerators(), "%s needs generators", prime);
        Preconditions.checkArgument(extension.kernel().isLe(prime),
                "Kernel %s is not contained in %s", extension.kernel(), prime);

        IntegralExtension<R, S> working = extension;
        PrimeIdeal<R> workingPrime = prime;
        if (!extension.source().isDomain()) {
            QuotientRing<R> reduced = QuotientRing.of(extension.primeKernel());
            working = extension.reduceSource(reduced);
            workingPrime = reduced.image(prime);
            if (LOG.isLoggable(Level.FINE))
                LOG.fine("Reduced " + extension.source() + " to " + reduced);
        }

        Localization.AtPrime<R> rp = Localization.atPrime(workingPrime);
        Localization<R, S> sp = new Localization<R, S>(working.structureMap(), workingPrime);
        IntegralExtension<Fraction<R, R>, Fraction<R, S>> localized = working.localize(rp, sp);
        if (LOG.isLoggable(Level.FINE))
            LOG.fine("Localized " + working + " at " + workingPrime);

        Ideal<Fraction<R, S>> selected = this.config.getSelector().select(sp, working);
        if (!selected.ring().equals(sp))
            throw new LiftingException("Selected ideal " + selected + " is not an ideal of " + sp);
        if (!selected.isProper())
            throw new LiftingException("Selected ideal " + selected + " is not proper");
        if (!selected.hasGenerators())
            throw new LiftingException("Selected ideal " + selected + " has no generators");
        MaximalIdeal<Fraction<R, S>> qp = MaximalIdeal.selected(selected);

        MaximalIdeal<Fraction<R, R>> contracted = localized.contract(qp);
        MaximalIdeal<Fraction<R, R>> local = rp.maximalIdeal();
        if (!contracted.isProper() || !local.isLe(contracted))
            throw new LiftingException("Contraction of " + qp + " is not " + local);

        if (this.config.getSafetyChecks() && qp.hasGenerators()) {
            for (Fraction<R, S> g: qp.generators()) {
                if (sp.isZero(g))
                    continue;
                Fraction<R, R> c = IdealOrder.comapNonZeroOfIntegral(localized, qp, g);
                if (!local.contains(c))
                    throw new LiftingException(qp + " contracts to " + c + ", outside " + local);
            }
        }

        PrimeIdeal<S> lifted = sp.contract(qp);
        if (!CandidateSelector.liesOver(lifted, workingPrime, working))
            throw new LiftingException(lifted + " does not lie over " + workingPrime);
        if (LOG.isLoggable(Level.FINE))
            LOG.fine("Lifted " + prime + " to " + lifted);
        return new PrimeOver<R, S>(prime, lifted);
    }

    /**
     * A prime lying over a maximal ideal is maximal.
     */
    public MaximalIdeal<S> liftMaximal(IntegralExtension<R, S> extension, MaximalIdeal<R> maximal) {
        PrimeOver<R, S> over = this.lift(extension, maximal);
        return extension.maximalOver(over.lifted(), maximal);
    }

    /**
     * Lift each prime of a list independently.
     */
    public ImmutableList<PrimeOver<R, S>> liftAll(IntegralExtension<R, S> extension, List<PrimeIdeal<R>> primes) {
        ImmutableList.Builder<PrimeOver<R, S>> result = ImmutableList.builder();
        for (PrimeIdeal<R> prime: primes)
            result.add(this.lift(extension, prime));
        return result.build();
    }
}
