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
import org.lyingover.algebraic.IntegralExtension;
import org.lyingover.algebraic.PrimeIdeal;
import org.lyingover.algebraic.QuotientRing;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Going up: given an integral extension R to S, a prime I of S and a
 * prime P of R containing comap(I), find a prime Q of S containing I
 * and lying over P.  This is lying over applied to the extension
 * R/comap(I) to S/I.
 * @param <R>  Type of elements of the base ring.
 * @param <S>  Type of elements of the extension.
 */
public class GoingUp<R, S> {
    private static final Logger LOG = Logger.getLogger(GoingUp.class.getName());

    final LyingOver<R, S> lyingOver;

    public GoingUp(LiftingConfig<R, S> config) {
        this.lyingOver = new LyingOver<R, S>(config);
    }

    /**
     * @param extension  Integral extension.
     * @param prime      Prime P of the base, with generators.  It must contain comap(I);
     *                   this is not checked, since comap(I) has no known generators.
     * @param lower      Prime I of the extension, with generators.
     * @return           A prime Q containing I with comap(Q) = P.
     */
    public PrimeOver<R, S> goingUp(IntegralExtension<R, S> extension, PrimeIdeal<R> prime, PrimeIdeal<S> lower) {
        Preconditions.checkArgument(lower.ring().equals(extension.target()),
                "%s is not an ideal of %s", lower, extension.target());
        Preconditions.checkArgument(prime.ring().equals(extension.source()),
                "%s is not an ideal of %s", prime, extension.source());
        Preconditions.checkArgument(lower.hasGenerators(), "%s needs generators", lower);

        PrimeIdeal<R> contraction = lower.comap(extension.structureMap());
        QuotientRing<S> sbar = QuotientRing.of(lower);
        QuotientRing<R> rbar = QuotientRing.of(contraction);
        IntegralExtension<R, S> quotient = extension.quotient(rbar, sbar);
        PrimeIdeal<R> image = rbar.image(prime);
        if (LOG.isLoggable(Level.FINE))
            LOG.fine("Going up from " + lower + " over " + prime + " in " + quotient);

        PrimeOver<R, S> over = this.lyingOver.lift(quotient, image);
        PrimeIdeal<S> result = sbar.preimage(over.lifted());
        if (!lower.isLe(result))
            throw new LiftingException(result + " does not contain " + lower);
        return new PrimeOver<R, S>(prime, result);
    }
}
