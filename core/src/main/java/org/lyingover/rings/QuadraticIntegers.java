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

package org.lyingover.rings;

import com.google.common.base.Preconditions;
import org.lyingover.algebraic.Ideal;
import org.lyingover.algebraic.IntegralExtension;
import org.lyingover.algebraic.PrimeIdeal;
import org.lyingover.algebraic.Ring;
import org.lyingover.algebraic.RingHom;
import org.lyingover.polynomial.Polynomial;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * The ring Z[sqrt(d)] for an integer d that is not a square.
 * It is a domain, integral over the integers: a + b sqrt(d) is a root of
 * X^2 - 2a X + (a^2 - d b^2).
 * Ideals are kept as lattices of rank 2 (or 0), which makes membership,
 * primality and maximality decidable.
 */
public class QuadraticIntegers implements Ring<QuadraticInteger> {
    final long d;
    final BigInteger bigD;

    public QuadraticIntegers(long d) {
        if (d >= 0) {
            BigInteger root = BigInteger.valueOf(d).sqrt();
            Preconditions.checkArgument(!root.multiply(root).equals(BigInteger.valueOf(d)),
                    "%s is a square", d);
        }
        this.d = d;
        this.bigD = BigInteger.valueOf(d);
    }

    public long discriminant() {
        return this.d;
    }

    public QuadraticInteger element(BigInteger a, BigInteger b) {
        return new QuadraticInteger(a, b, this.d);
    }

    public QuadraticInteger element(long a, long b) {
        return this.element(BigInteger.valueOf(a), BigInteger.valueOf(b));
    }

    /**
     * The element sqrt(d).
     */
    public QuadraticInteger sqrt() {
        return this.element(0, 1);
    }

    QuadraticInteger check(QuadraticInteger value) {
        if (value.d != this.d)
            throw new IllegalArgumentException(value + " does not belong to " + this);
        return value;
    }

    @Override
    public QuadraticInteger add(QuadraticInteger left, QuadraticInteger right) {
        this.check(left);
        this.check(right);
        return this.element(left.a.add(right.a), left.b.add(right.b));
    }

    @Override
    public QuadraticInteger zero() {
        return this.element(0, 0);
    }

    @Override
    public QuadraticInteger negate(QuadraticInteger data) {
        this.check(data);
        return this.element(data.a.negate(), data.b.negate());
    }

    @Override
    public QuadraticInteger times(QuadraticInteger left, QuadraticInteger right) {
        this.check(left);
        this.check(right);
        BigInteger a = left.a.multiply(right.a).add(this.bigD.multiply(left.b).multiply(right.b));
        BigInteger b = left.a.multiply(right.b).add(left.b.multiply(right.a));
        return this.element(a, b);
    }

    @Override
    public QuadraticInteger one() {
        return this.element(1, 0);
    }

    @Override
    public boolean isDomain() {
        return true;
    }

    /**
     * The inclusion of the integers.
     */
    public RingHom<BigInteger, QuadraticInteger> embedding() {
        return RingHom.of(Integers.instance, this, n -> this.element(n, BigInteger.ZERO));
    }

    /**
     * The monic polynomial X^2 - trace X + norm, which vanishes at value.
     */
    public Polynomial<BigInteger> minimalPolynomial(QuadraticInteger value) {
        this.check(value);
        return Polynomial.of(Integers.instance, value.norm(), value.trace().negate(), BigInteger.ONE);
    }

    /**
     * This ring as an integral extension of the integers.
     */
    public IntegralExtension<BigInteger, QuadraticInteger> overIntegers() {
        return IntegralExtension.injective(this.embedding(), this::minimalPolynomial);
    }

    QuadraticLattice lattice(List<QuadraticInteger> generators) {
        List<BigInteger[]> vectors = new ArrayList<BigInteger[]>();
        for (QuadraticInteger g: generators) {
            this.check(g);
            vectors.add(new BigInteger[] { g.a, g.b });
            // g * sqrt(d)
            vectors.add(new BigInteger[] { g.b.multiply(this.bigD), g.a });
        }
        return QuadraticLattice.spannedBy(vectors);
    }

    QuadraticLattice lattice(Ideal<QuadraticInteger> ideal) {
        if (!ideal.hasGenerators())
            throw new UnsupportedOperationException("Ideal " + ideal + " has no generators");
        return this.lattice(ideal.generators());
    }

    /**
     * The ideal generated by the given elements.
     */
    public Ideal<QuadraticInteger> ideal(QuadraticInteger... generators) {
        List<QuadraticInteger> list = Arrays.asList(generators);
        QuadraticLattice lattice = this.lattice(list);
        StringBuilder description = new StringBuilder("(");
        for (int i = 0; i < generators.length; i++) {
            if (i > 0)
                description.append(", ");
            description.append(generators[i]);
        }
        description.append(")");
        return Ideal.generatedBy(this, x -> lattice.contains(x.a, x.b), list, description.toString());
    }

    /**
     * The ideal generated by a rational integer.
     */
    public Ideal<QuadraticInteger> ideal(long generator) {
        return this.ideal(this.element(generator, 0));
    }

    /**
     * A nonzero ideal Q is prime iff Z[sqrt(d)]/Q is a field.  The quotient
     * has alpha * gamma elements; a field of that size is either Z/p, or,
     * when Q = (p), the field F_p[X]/(X^2 - d), which requires X^2 - d to
     * have no root mod p.
     */
    @Override
    public boolean isPrime(Ideal<QuadraticInteger> ideal) {
        QuadraticLattice lattice = this.lattice(ideal);
        if (lattice.isZero())
            return true;
        BigInteger index = lattice.index();
        if (index.signum() == 0 || index.equals(BigInteger.ONE))
            return false;
        if (index.isProbablePrime(Integers.certainty))
            return true;
        BigInteger root = index.sqrt();
        return root.multiply(root).equals(index)
                && root.isProbablePrime(Integers.certainty)
                && lattice.isScalar(root)
                && this.squareRootsOfD(root).isEmpty();
    }

    /**
     * Nonzero primes are maximal: the ring has dimension one.
     */
    @Override
    public boolean isMaximal(Ideal<QuadraticInteger> ideal) {
        return this.isPrime(ideal) && !this.lattice(ideal).isZero();
    }

    /**
     * The residues a in [0, p) with a^2 = d mod p, found by enumeration.
     */
    List<BigInteger> squareRootsOfD(BigInteger p) {
        List<BigInteger> result = new ArrayList<BigInteger>();
        BigInteger target = this.bigD.mod(p);
        for (BigInteger a = BigInteger.ZERO; a.compareTo(p) < 0; a = a.add(BigInteger.ONE)) {
            if (a.multiply(a).mod(p).equals(target))
                result.add(a);
        }
        return result;
    }

    /**
     * The prime ideals lying over the prime (p) of the integers.  For p = 0
     * this is the zero ideal; otherwise (p) if X^2 - d has no root mod p,
     * and (p, sqrt(d) - a) for each root a otherwise.
     * @param p  Zero or a prime number.
     */
    public List<PrimeIdeal<QuadraticInteger>> primesOver(long p) {
        List<PrimeIdeal<QuadraticInteger>> result = new ArrayList<PrimeIdeal<QuadraticInteger>>();
        if (p == 0) {
            result.add(PrimeIdeal.of(this.ideal(0)));
            return result;
        }
        BigInteger prime = BigInteger.valueOf(p);
        Preconditions.checkArgument(prime.isProbablePrime(Integers.certainty), "%s is not prime", p);
        List<BigInteger> roots = this.squareRootsOfD(prime);
        if (roots.isEmpty()) {
            result.add(PrimeIdeal.of(this.ideal(p)));
            return result;
        }
        for (BigInteger a: roots) {
            QuadraticInteger shifted = this.element(a.negate(), BigInteger.ONE);
            result.add(PrimeIdeal.of(this.ideal(this.element(prime, BigInteger.ZERO), shifted)));
        }
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        QuadraticIntegers that = (QuadraticIntegers) o;
        return this.d == that.d;
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.d);
    }

    @Override
    public String toString() {
        return "Z[sqrt(" + this.d + ")]";
    }
}
