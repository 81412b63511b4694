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

/**
 * The localization of a ring S at the image of the complement of a prime
 * P of a ring R, under a homomorphism f from R to S.  Elements are
 * fractions s/u, with u in R outside P, standing for s / f(u).
 * The localized ring must be a domain, which makes equality of fractions
 * decidable: a/u = b/v iff a f(v) = b f(u).
 * Localizations are built on demand by the lifting algorithms and are
 * never mutated.
 * @param <R>  Type of elements of the ring holding the multiplicative set.
 * @param <S>  Type of elements of the localized ring.
 */
public class Localization<R, S> implements Ring<Fraction<R, S>> {
    final RingHom<R, S> structureMap;
    final PrimeIdeal<R> prime;
    final Ring<R> denominators;
    final Ring<S> base;

    /**
     * @param structureMap  Homomorphism carrying the multiplicative set into the base.
     *                      Its kernel must be contained in prime.
     * @param prime         Prime whose complement is inverted.
     */
    public Localization(RingHom<R, S> structureMap, PrimeIdeal<R> prime) {
        Preconditions.checkArgument(structureMap.source().equals(prime.ring()),
                "%s is not an ideal of the source of %s", prime, structureMap);
        Preconditions.checkArgument(structureMap.target().isDomain(),
                "Localized ring %s is not a domain", structureMap.target());
        this.structureMap = structureMap;
        this.prime = prime;
        this.denominators = prime.ring();
        this.base = structureMap.target();
    }

    /**
     * Localize a ring at one of its own primes.
     */
    public static <R> AtPrime<R> atPrime(PrimeIdeal<R> prime) {
        return new AtPrime<R>(prime);
    }

    public Ring<S> base() {
        return this.base;
    }

    public PrimeIdeal<R> prime() {
        return this.prime;
    }

    public RingHom<R, S> structureMap() {
        return this.structureMap;
    }

    /**
     * Build the fraction numerator / denominator.
     * @throws IllegalArgumentException if the denominator belongs to the prime.
     */
    public Fraction<R, S> fraction(S numerator, R denominator) {
        Preconditions.checkArgument(!this.prime.contains(denominator),
                "Denominator %s belongs to %s", denominator, this.prime);
        return new Fraction<R, S>(numerator, denominator);
    }

    S scale(S value, R denominator) {
        return this.base.times(value, this.structureMap.apply(denominator));
    }

    @Override
    public Fraction<R, S> add(Fraction<R, S> left, Fraction<R, S> right) {
        S numerator = this.base.add(
                this.scale(left.numerator, right.denominator),
                this.scale(right.numerator, left.denominator));
        return new Fraction<R, S>(numerator, this.denominators.times(left.denominator, right.denominator));
    }

    @Override
    public Fraction<R, S> zero() {
        return new Fraction<R, S>(this.base.zero(), this.denominators.one());
    }

    @Override
    public boolean isZero(Fraction<R, S> value) {
        return this.base.isZero(value.numerator);
    }

    @Override
    public Fraction<R, S> negate(Fraction<R, S> data) {
        return new Fraction<R, S>(this.base.negate(data.numerator), data.denominator);
    }

    @Override
    public boolean equal(Fraction<R, S> left, Fraction<R, S> right) {
        return this.base.equal(
                this.scale(left.numerator, right.denominator),
                this.scale(right.numerator, left.denominator));
    }

    @Override
    public Fraction<R, S> times(Fraction<R, S> left, Fraction<R, S> right) {
        return new Fraction<R, S>(
                this.base.times(left.numerator, right.numerator),
                this.denominators.times(left.denominator, right.denominator));
    }

    @Override
    public Fraction<R, S> one() {
        return new Fraction<R, S>(this.base.one(), this.denominators.one());
    }

    @Override
    public boolean isDomain() {
        return true;
    }

    /**
     * The map s to s/1.
     */
    public RingHom<S, Fraction<R, S>> algebraMap() {
        return RingHom.of(this.base, this, s -> new Fraction<R, S>(s, this.denominators.one()));
    }

    /**
     * The map from the localization of R at the same prime: a/u to f(a)/u.
     */
    public RingHom<Fraction<R, R>, Fraction<R, S>> induced(AtPrime<R> source) {
        Preconditions.checkArgument(source.prime.equals(this.prime),
                "%s is localized at %s, not at %s", source, source.prime, this.prime);
        return RingHom.of(source, this,
                x -> new Fraction<R, S>(this.structureMap.apply(x.numerator), x.denominator));
    }

    /**
     * The extension of a prime of the base ring.  The prime must not meet
     * the multiplicative set; then s/u belongs to the extension iff s
     * belongs to the prime, and the extension is prime.
     * @param ideal  Prime of the base ring disjoint from the multiplicative set.
     */
    public PrimeIdeal<Fraction<R, S>> extend(PrimeIdeal<S> ideal) {
        Preconditions.checkArgument(ideal.ring().equals(this.base), "%s is not an ideal of %s", ideal, this.base);
        String description = ideal + "_" + this.prime;
        RingHom<S, Fraction<R, S>> map = this.algebraMap();
        if (ideal.hasGenerators()) {
            ImmutableList.Builder<Fraction<R, S>> generators = ImmutableList.builder();
            for (S g: ideal.generators())
                generators.add(map.apply(g));
            return PrimeIdeal.derived(Ideal.generatedBy(
                    this, x -> ideal.contains(x.numerator), generators.build(), description));
        }
        return PrimeIdeal.derived(Ideal.of(this, x -> ideal.contains(x.numerator), description));
    }

    /**
     * The preimage of a prime of this ring under s to s/1.  When the prime
     * has generators, their numerators are kept as generators of the
     * preimage.  They generate it when the ideal they span in the base is
     * prime, since such an ideal does not meet the multiplicative set;
     * callers check this with the primality test of the base.
     */
    public PrimeIdeal<S> contract(PrimeIdeal<Fraction<R, S>> ideal) {
        Preconditions.checkArgument(ideal.ring().equals(this), "%s is not an ideal of %s", ideal, this);
        PrimeIdeal<S> preimage = ideal.comap(this.algebraMap());
        if (!ideal.hasGenerators())
            return preimage;
        ImmutableList.Builder<S> numerators = ImmutableList.builder();
        for (Fraction<R, S> g: ideal.generators())
            numerators.add(g.numerator);
        return PrimeIdeal.derived(Ideal.generatedBy(
                this.base, preimage::contains, numerators.build(), preimage.toString()));
    }

    @Override
    public String toString() {
        return this.base + "_" + this.prime;
    }

    /**
     * A ring localized at one of its primes.  It is a local ring.
     * @param <R>  Type of elements in the ring.
     */
    public static class AtPrime<R> extends Localization<R, R> {
        AtPrime(PrimeIdeal<R> prime) {
            super(RingHom.identity(prime.ring()), prime);
        }

        /**
         * The unique maximal ideal, generated by the prime.  a/u belongs to
         * it iff a belongs to the prime.
         */
        public MaximalIdeal<Fraction<R, R>> maximalIdeal() {
            return MaximalIdeal.derived(this.extend(this.prime));
        }

        /**
         * Every fraction outside the maximal ideal is a unit.
         */
        public boolean isUnit(Fraction<R, R> value) {
            return !this.prime.contains(value.numerator);
        }
    }
}
