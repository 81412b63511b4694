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
import org.lyingover.algebraic.NonZeroDivisor;
import org.lyingover.algebraic.PrimeIdeal;
import org.lyingover.algebraic.QuotientRing;
import org.lyingover.algebraic.Ring;
import org.lyingover.algebraic.RingHom;
import org.lyingover.polynomial.Polynomial;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Extracts from a polynomial relation satisfied by an element of an
 * ideal a nonzero coefficient that lies in the preimage of the ideal.
 *
 * <p>Let f: R to S, r in an ideal I of S, and p a nonzero polynomial over R
 * with p(r) = 0.  Write p = q X + c.  If c is nonzero then
 * f(c) = -r q(r) belongs to I.  Otherwise q(r) r = 0, and when r is a
 * non-zero-divisor q(r) = 0, so we continue with q, which has a
 * smaller degree.
 */
public final class WitnessFinder {
    private static final Logger LOG = Logger.getLogger(WitnessFinder.class.getName());

    /**
     * If true the invariants of the search are re-checked at each step.
     */
    public static boolean safetyChecks = true;

    private WitnessFinder() {}

    /**
     * Find the lowest index holding a nonzero coefficient of p; that
     * coefficient maps into I.
     * @param map        The homomorphism f: R to S.
     * @param ideal      Ideal I of S.
     * @param value      Element r of I.
     * @param p          Nonzero polynomial over R with p(r) = 0.
     * @param certificate  Certifies that r is a non-zero-divisor of S.
     * @return           The index and the coefficient c, nonzero, with f(c) in I.
     */
    public static <R, S> CoefficientWitness<R> findWitness(
            RingHom<R, S> map, Ideal<S> ideal, S value, Polynomial<R> p, NonZeroDivisor<S> certificate) {
        Ring<R> source = map.source();
        Ring<S> target = map.target();
        Preconditions.checkArgument(p.ring().equals(source), "%s is not a polynomial over %s", p, source);
        Preconditions.checkArgument(ideal.ring().equals(target), "%s is not an ideal of %s", ideal, target);
        Preconditions.checkArgument(!p.isZero(), "The polynomial is zero");
        Preconditions.checkArgument(certificate.ring().equals(target)
                && target.equal(certificate.element(), value),
                "Certificate %s is not about %s", certificate, value);
        Preconditions.checkArgument(ideal.contains(value), "%s is not in %s", value, ideal);
        Preconditions.checkArgument(target.isZero(p.evaluate(map, value)),
                "%s does not vanish at %s", p, value);

        Polynomial<R> current = p;
        int index = 0;
        while (true) {
            R c = current.constantTerm();
            if (!source.isZero(c)) {
                if (safetyChecks)
                    Preconditions.checkState(ideal.contains(map.apply(c)),
                            "Coefficient %s does not map into %s", c, ideal);
                if (LOG.isLoggable(Level.FINER))
                    LOG.finer("Witness for " + value + " in " + ideal + ": " + c + " at X^" + index);
                return new CoefficientWitness<R>(index, c);
            }
            current = current.divideByX();
            index++;
            if (safetyChecks)
                Preconditions.checkState(target.isZero(current.evaluate(map, value)),
                        "%s does not vanish at %s", current, value);
        }
    }

    /**
     * The witness finder over a domain, where every nonzero element is a
     * non-zero-divisor.
     */
    public static <R, S> CoefficientWitness<R> findWitnessInDomain(
            RingHom<R, S> map, Ideal<S> ideal, S value, Polynomial<R> p) {
        return findWitness(map, ideal, value, p, NonZeroDivisor.inDomain(map.target(), value));
    }

    /**
     * If r is in I and p(r) is in I, the constant coefficient of p maps into I.
     * No condition on zero divisors is needed, but the result may be zero.
     */
    public static <R, S> R constantTermInComap(RingHom<R, S> map, Ideal<S> ideal, S value, Polynomial<R> p) {
        Preconditions.checkArgument(p.ring().equals(map.source()), "%s is not a polynomial over %s", p, map.source());
        Preconditions.checkArgument(ideal.contains(value), "%s is not in %s", value, ideal);
        Preconditions.checkArgument(ideal.contains(p.evaluate(map, value)),
                "%s evaluated at %s is not in %s", p, value, ideal);
        R c = p.constantTerm();
        if (safetyChecks)
            Preconditions.checkState(ideal.contains(map.apply(c)), "Coefficient %s does not map into %s", c, ideal);
        return c;
    }

    /**
     * Find a coefficient separating the preimages of two nested ideals.
     * The search runs in S/I over R/comap(I), where r is nonzero and
     * therefore a non-zero-divisor.
     * @param map    The homomorphism f: R to S.
     * @param lower  Prime ideal I of S.
     * @param upper  Ideal J of S containing I.
     * @param value  Element r of J outside I.
     * @param p      Polynomial over R with p(r) in I, nonzero modulo comap(I).
     * @return       A coefficient c of p with c in comap(J) and not in comap(I).
     */
    public static <R, S> CoefficientWitness<R> findDifferenceWitness(
            RingHom<R, S> map, PrimeIdeal<S> lower, Ideal<S> upper, S value, Polynomial<R> p) {
        Ring<S> target = map.target();
        Preconditions.checkArgument(lower.ring().equals(target), "%s is not an ideal of %s", lower, target);
        Preconditions.checkArgument(upper.ring().equals(target), "%s is not an ideal of %s", upper, target);
        if (lower.hasGenerators())
            Preconditions.checkArgument(lower.isLe(upper), "%s is not contained in %s", lower, upper);
        Preconditions.checkArgument(upper.contains(value), "%s is not in %s", value, upper);
        Preconditions.checkArgument(!lower.contains(value), "%s is in %s", value, lower);
        Preconditions.checkArgument(lower.contains(p.evaluate(map, value)),
                "%s evaluated at %s is not in %s", p, value, lower);

        PrimeIdeal<R> lowerComap = lower.comap(map);
        QuotientRing<S> sbar = QuotientRing.of(lower);
        QuotientRing<R> rbar = QuotientRing.of(lowerComap);
        RingHom<R, S> mapBar = QuotientRing.induced(map, rbar, sbar);
        Polynomial<R> pbar = p.over(rbar);
        Preconditions.checkArgument(!pbar.isZero(), "%s vanishes modulo %s", p, lowerComap);
        Ideal<S> upperBar = sbar.image(upper);

        CoefficientWitness<R> witness = findWitness(mapBar, upperBar, value, pbar,
                NonZeroDivisor.inDomain(sbar, value));
        if (safetyChecks)
            Preconditions.checkState(!lower.contains(map.apply(witness.coefficient))
                    && upper.contains(map.apply(witness.coefficient)),
                    "Coefficient %s does not separate %s from %s", witness.coefficient, lower, upper);
        return witness;
    }
}
