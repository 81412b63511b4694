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

import javax.annotation.Nullable;
import java.util.List;
import java.util.function.Predicate;

/**
 * An ideal of a ring: a subset closed under addition and under
 * multiplication by arbitrary ring elements.  An ideal is represented by
 * its membership predicate; when a finite list of generators is known it
 * is kept as well, which makes inclusion in another ideal decidable.
 * Ideals are immutable; all operations return fresh ideals.
 * @param <T>  Type of elements in the ring.
 */
public class Ideal<T> {
    final Ring<T> ring;
    final Predicate<T> membership;
    @Nullable
    final ImmutableList<T> generators;
    final String description;

    protected Ideal(Ring<T> ring, Predicate<T> membership,
                    @Nullable ImmutableList<T> generators, String description) {
        this.ring = ring;
        this.membership = membership;
        this.generators = generators;
        this.description = description;
    }

    /**
     * Copy constructor used by the certificate subclasses.
     */
    protected Ideal(Ideal<T> ideal) {
        this(ideal.ring, ideal.membership, ideal.generators, ideal.description);
    }

    /**
     * Create an ideal with known generators.  The membership predicate must
     * describe exactly the ideal generated by the generators.
     * @param ring         Ring the ideal belongs to.
     * @param membership   Decides membership.
     * @param generators   Finite list of generators.
     * @param description  Printable description.
     */
    public static <T> Ideal<T> generatedBy(Ring<T> ring, Predicate<T> membership,
                                           List<T> generators, String description) {
        for (T g: generators)
            Preconditions.checkArgument(membership.test(g),
                    "Generator %s is not a member of %s", g, description);
        return new Ideal<T>(ring, membership, ImmutableList.copyOf(generators), description);
    }

    /**
     * Create an ideal known only through its membership predicate.
     */
    public static <T> Ideal<T> of(Ring<T> ring, Predicate<T> membership, String description) {
        return new Ideal<T>(ring, membership, null, description);
    }

    /**
     * The zero ideal, with an empty list of generators.
     */
    public static <T> Ideal<T> zero(Ring<T> ring) {
        return new Ideal<T>(ring, ring::isZero, ImmutableList.of(), "(0)");
    }

    /**
     * The ideal containing the whole ring.
     */
    public static <T> Ideal<T> unit(Ring<T> ring) {
        return new Ideal<T>(ring, x -> true, ImmutableList.of(ring.one()), "(1)");
    }

    public Ring<T> ring() {
        return this.ring;
    }

    public boolean contains(T value) {
        return this.membership.test(value);
    }

    /**
     * @return The generators, or null if they are not known.
     */
    @Nullable
    public ImmutableList<T> generators() {
        return this.generators;
    }

    public boolean hasGenerators() {
        return this.generators != null;
    }

    /**
     * An ideal is proper if it does not contain one.
     */
    public boolean isProper() {
        return !this.contains(this.ring.one());
    }

    /**
     * Decide inclusion of this ideal into other.  This requires the
     * generators of this ideal.
     * @param other  Ideal of the same ring.
     * @return       True if every element of this is in other.
     */
    public boolean isLe(Ideal<T> other) {
        Preconditions.checkArgument(this.ring.equals(other.ring),
                "Ideals %s and %s belong to different rings", this, other);
        if (this.generators == null)
            throw new UnsupportedOperationException("Inclusion of " + this + " needs its generators");
        for (T g: this.generators) {
            if (!other.contains(g))
                return false;
        }
        return true;
    }

    /**
     * The preimage of this ideal under a homomorphism.
     * @param map  Homomorphism whose target is the ring of this ideal.
     * @param <S>  Type of elements in the source ring.
     * @return     An ideal of the source ring.
     */
    public <S> Ideal<S> comap(RingHom<S, T> map) {
        Preconditions.checkArgument(map.target().equals(this.ring),
                "Homomorphism %s does not map into the ring of %s", map, this);
        return Ideal.of(map.source(), x -> this.contains(map.apply(x)), "comap(" + this.description + ")");
    }

    @Override
    public String toString() {
        return this.description;
    }
}
