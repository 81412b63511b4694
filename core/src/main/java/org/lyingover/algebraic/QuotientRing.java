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

import java.util.ArrayList;
import java.util.List;

/**
 * The quotient of a ring by an ideal.  Elements are represented by
 * elements of the base ring; two representatives are equal when their
 * difference belongs to the modulus.  Each quotient carries the ideal it
 * is taken by, so ideals and homomorphisms can check they are used with
 * the right quotient.
 * @param <T>  Type of elements in the base ring.
 */
public class QuotientRing<T> implements Ring<T> {
    final Ring<T> base;
    final Ideal<T> modulus;

    QuotientRing(Ring<T> base, Ideal<T> modulus) {
        this.base = base;
        this.modulus = modulus;
    }

    /**
     * @param modulus  Ideal to quotient by.
     * @return         The quotient ring; a domain iff the modulus is certified prime.
     */
    public static <T> QuotientRing<T> of(Ideal<T> modulus) {
        return new QuotientRing<T>(modulus.ring(), modulus);
    }

    public Ring<T> base() {
        return this.base;
    }

    public Ideal<T> modulus() {
        return this.modulus;
    }

    @Override
    public T add(T left, T right) {
        return this.base.add(left, right);
    }

    @Override
    public T zero() {
        return this.base.zero();
    }

    @Override
    public boolean isZero(T value) {
        return this.modulus.contains(value);
    }

    @Override
    public T negate(T data) {
        return this.base.negate(data);
    }

    @Override
    public boolean equal(T left, T right) {
        return this.modulus.contains(this.base.subtract(left, right));
    }

    @Override
    public T times(T left, T right) {
        return this.base.times(left, right);
    }

    @Override
    public T one() {
        return this.base.one();
    }

    @Override
    public boolean isDomain() {
        return this.modulus instanceof PrimeIdeal;
    }

    /**
     * An ideal of the quotient is prime iff its preimage in the base is prime.
     */
    @Override
    public boolean isPrime(Ideal<T> ideal) {
        return this.base.isPrime(this.preimage(ideal));
    }

    @Override
    public boolean isMaximal(Ideal<T> ideal) {
        return this.base.isMaximal(this.preimage(ideal));
    }

    /**
     * The ideal of the base ring made of the representatives of ideal.
     * It contains the modulus; its generators are those of ideal
     * together with those of the modulus, when both are known.
     */
    Ideal<T> preimage(Ideal<T> ideal) {
        Preconditions.checkArgument(ideal.ring().equals(this), "%s is not an ideal of %s", ideal, this);
        if (ideal.hasGenerators() && this.modulus.hasGenerators()) {
            List<T> generators = new ArrayList<T>(ideal.generators());
            generators.addAll(this.modulus.generators());
            return Ideal.generatedBy(this.base, ideal::contains, generators, ideal.toString());
        }
        return Ideal.of(this.base, ideal::contains, ideal.toString());
    }

    /**
     * The preimage of a prime of the quotient; it is prime and contains
     * the modulus.
     */
    public PrimeIdeal<T> preimage(PrimeIdeal<T> ideal) {
        return PrimeIdeal.derived(this.preimage((Ideal<T>)ideal));
    }

    /**
     * The canonical surjection from the base ring.
     */
    public RingHom<T, T> projection() {
        return RingHom.of(this.base, this, x -> x);
    }

    /**
     * The image of an ideal of the base ring containing the modulus.
     * Membership of a representative is membership in the original ideal.
     * @param ideal  Ideal of the base ring.
     */
    public Ideal<T> image(Ideal<T> ideal) {
        Preconditions.checkArgument(ideal.ring().equals(this.base), "%s is not an ideal of %s", ideal, this.base);
        if (this.modulus.hasGenerators())
            Preconditions.checkArgument(this.modulus.isLe(ideal), "%s does not contain %s", ideal, this.modulus);
        String description = ideal + "/" + this.modulus;
        if (ideal.hasGenerators())
            return Ideal.generatedBy(this, ideal::contains, ideal.generators(), description);
        return Ideal.of(this, ideal::contains, description);
    }

    /**
     * A prime containing the modulus stays prime in the quotient.
     */
    public PrimeIdeal<T> image(PrimeIdeal<T> ideal) {
        return PrimeIdeal.derived(this.image((Ideal<T>)ideal));
    }

    /**
     * The homomorphism induced between quotients.  The modulus of source
     * must be the preimage of the modulus of target, which makes the map
     * well defined and injective.
     * @param map     Homomorphism between the base rings.
     * @param source  Quotient of the source of map.
     * @param target  Quotient of the target of map.
     */
    public static <R, S> RingHom<R, S> induced(RingHom<R, S> map, QuotientRing<R> source, QuotientRing<S> target) {
        Preconditions.checkArgument(map.source().equals(source.base), "%s is not a quotient of the source of %s", source, map);
        Preconditions.checkArgument(map.target().equals(target.base), "%s is not a quotient of the target of %s", target, map);
        return RingHom.of(source, target, map::apply);
    }

    @Override
    public String toString() {
        return this.base + "/" + this.modulus;
    }
}
