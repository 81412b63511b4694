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
import com.google.common.collect.ImmutableList;
import org.lyingover.polynomial.Polynomial;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * A ring homomorphism f: R to S under which every element of S is
 * integral over R.  Integrality is supplied as a witness function
 * mapping each element of S to a monic polynomial over R that vanishes
 * at it; witnesses are checked every time they are requested.
 * The kernel of f is carried with its generators so that containment
 * in a prime can be decided.
 * @param <R>  Type of elements of the base ring.
 * @param <S>  Type of elements of the extension.
 */
public class IntegralExtension<R, S> {
    final RingHom<R, S> structureMap;
    final Function<S, Polynomial<R>> witnesses;
    final Ideal<R> kernel;

    /**
     * @param structureMap  The homomorphism f.
     * @param witnesses     For each element of S a monic polynomial over R vanishing at it.
     * @param kernel        The kernel of f, with generators.
     */
    public IntegralExtension(RingHom<R, S> structureMap, Function<S, Polynomial<R>> witnesses, Ideal<R> kernel) {
        Preconditions.checkArgument(kernel.ring().equals(structureMap.source()),
                "%s is not an ideal of %s", kernel, structureMap.source());
        Preconditions.checkArgument(kernel.hasGenerators(), "Kernel %s needs generators", kernel);
        for (R g: kernel.generators())
            Preconditions.checkArgument(structureMap.target().isZero(structureMap.apply(g)),
                    "Kernel generator %s does not map to zero", g);
        this.structureMap = structureMap;
        this.witnesses = witnesses;
        this.kernel = kernel;
    }

    /**
     * An extension given by an injective homomorphism.
     */
    public static <R, S> IntegralExtension<R, S> injective(
            RingHom<R, S> structureMap, Function<S, Polynomial<R>> witnesses) {
        return new IntegralExtension<R, S>(structureMap, witnesses, Ideal.zero(structureMap.source()));
    }

    /**
     * A surjective homomorphism is integral: s is a root of X - r
     * for any preimage r of s.
     * @param map      Surjective homomorphism.
     * @param section  Chooses a preimage for each element of the target.
     * @param kernel   Kernel of map, with generators.
     */
    public static <R, S> IntegralExtension<R, S> ofSurjection(
            RingHom<R, S> map, Function<S, R> section, Ideal<R> kernel) {
        Ring<R> source = map.source();
        return new IntegralExtension<R, S>(map,
                s -> Polynomial.of(source, source.negate(section.apply(s)), source.one()), kernel);
    }

    public RingHom<R, S> structureMap() {
        return this.structureMap;
    }

    public Ring<R> source() {
        return this.structureMap.source();
    }

    public Ring<S> target() {
        return this.structureMap.target();
    }

    public Ideal<R> kernel() {
        return this.kernel;
    }

    /**
     * A monic polynomial over the base vanishing at value.
     * @throws IllegalArgumentException if the supplied witness is not monic or
     *         does not vanish at value.
     */
    public Polynomial<R> witness(S value) {
        Polynomial<R> p = this.witnesses.apply(value);
        Preconditions.checkArgument(p.ring().equals(this.source()),
                "Witness %s for %s has coefficients in the wrong ring", p, value);
        Preconditions.checkArgument(p.isMonic(), "Witness %s for %s is not monic", p, value);
        Preconditions.checkArgument(this.target().isZero(p.evaluate(this.structureMap, value)),
                "%s is not integral: witness %s does not vanish", value, p);
        return p;
    }

    /**
     * The kernel of a homomorphism into a domain is prime.
     */
    public PrimeIdeal<R> primeKernel() {
        Preconditions.checkState(this.target().isDomain(), "%s is not a domain", this.target());
        return PrimeIdeal.derived(Ideal.generatedBy(this.source(),
                x -> this.target().isZero(this.structureMap.apply(x)),
                this.kernel.generators(), "ker(" + this.structureMap + ")"));
    }

    /**
     * Integrality survives localization: if s is a root of the monic
     * sum of c_i X^i of degree n then s/u is a root of the monic
     * sum of (c_i / u^(n-i)) X^i.
     * @param base      The base localized at the prime.
     * @param extension The extension localized at the image of the same multiplicative set.
     */
    public IntegralExtension<Fraction<R, R>, Fraction<R, S>> localize(
            Localization.AtPrime<R> base, Localization<R, S> extension) {
        Preconditions.checkArgument(extension.structureMap().equals(this.structureMap),
                "%s is not a localization along %s", extension, this.structureMap);
        RingHom<Fraction<R, R>, Fraction<R, S>> map = extension.induced(base);
        Function<Fraction<R, S>, Polynomial<Fraction<R, R>>> localWitnesses = x -> {
            Polynomial<R> p = this.witness(x.numerator());
            int degree = p.degree();
            List<Fraction<R, R>> coefficients = new ArrayList<Fraction<R, R>>(degree + 1);
            for (int i = 0; i <= degree; i++) {
                R denominator = this.source().power(x.denominator(), degree - i);
                coefficients.add(base.fraction(p.coefficient(i), denominator));
            }
            return Polynomial.of(base, coefficients);
        };
        ImmutableList.Builder<Fraction<R, R>> generators = ImmutableList.builder();
        for (R g: this.kernel.generators())
            generators.add(base.algebraMap().apply(g));
        Ideal<Fraction<R, R>> localKernel = Ideal.generatedBy(base,
                x -> this.kernel.contains(x.numerator()), generators.build(), this.kernel + "_" + base.prime());
        return new IntegralExtension<Fraction<R, R>, Fraction<R, S>>(map, localWitnesses, localKernel);
    }

    /**
     * Integrality descends to quotients: reduce the witness coefficients.
     * The modulus of base must be the preimage of the modulus of extension;
     * the induced map is then injective.
     */
    public IntegralExtension<R, S> quotient(QuotientRing<R> base, QuotientRing<S> extension) {
        RingHom<R, S> map = QuotientRing.induced(this.structureMap, base, extension);
        return IntegralExtension.injective(map, s -> this.witness(s).over(base));
    }

    /**
     * The same extension seen from the base reduced modulo the kernel.
     * @param base  Quotient of the base by the kernel of the structure map.
     */
    public IntegralExtension<R, S> reduceSource(QuotientRing<R> base) {
        Preconditions.checkArgument(base.base().equals(this.source()), "%s is not a quotient of %s", base, this.source());
        RingHom<R, S> map = RingHom.of(base, this.target(), this.structureMap::apply);
        return IntegralExtension.injective(map, s -> this.witness(s).over(base));
    }

    /**
     * Maximality transfers down integral extensions: the preimage of a
     * maximal ideal is maximal.
     */
    public MaximalIdeal<R> contract(MaximalIdeal<S> ideal) {
        Preconditions.checkArgument(ideal.ring().equals(this.target()), "%s is not an ideal of %s", ideal, this.target());
        return MaximalIdeal.derived(ideal.comap(this.structureMap));
    }

    /**
     * Maximality transfers up integral extensions: a proper prime whose
     * preimage contains a maximal ideal lies over it, and is maximal.
     * @throws IllegalArgumentException if ideal does not lie over maximal.
     */
    public MaximalIdeal<S> maximalOver(PrimeIdeal<S> ideal, MaximalIdeal<R> maximal) {
        Preconditions.checkArgument(ideal.isProper(), "%s is not proper", ideal);
        Preconditions.checkArgument(maximal.isLe(ideal.comap(this.structureMap)),
                "%s does not lie over %s", ideal, maximal);
        return MaximalIdeal.derived(ideal);
    }

    @Override
    public String toString() {
        return this.target() + " over " + this.source();
    }
}
