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
import org.lyingover.algebraic.FiniteRing;
import org.lyingover.algebraic.Ideal;
import org.lyingover.algebraic.IntegralExtension;
import org.lyingover.algebraic.RingHom;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * The ring of integers modulo n.  Values are BigIntegers; any integer is
 * accepted as a representative, results are reduced to [0, n).
 */
public class IntegersModN implements FiniteRing<BigInteger> {
    final BigInteger modulus;

    public IntegersModN(long modulus) {
        Preconditions.checkArgument(modulus > 0, "Modulus %s is not positive", modulus);
        this.modulus = BigInteger.valueOf(modulus);
    }

    public BigInteger modulus() {
        return this.modulus;
    }

    public BigInteger reduce(BigInteger value) {
        return value.mod(this.modulus);
    }

    @Override
    public BigInteger add(BigInteger left, BigInteger right) {
        return this.reduce(left.add(right));
    }

    @Override
    public BigInteger zero() {
        return BigInteger.ZERO;
    }

    @Override
    public boolean isZero(BigInteger value) {
        return this.reduce(value).signum() == 0;
    }

    @Override
    public BigInteger negate(BigInteger data) {
        return this.reduce(data.negate());
    }

    @Override
    public boolean equal(BigInteger left, BigInteger right) {
        return this.isZero(left.subtract(right));
    }

    @Override
    public BigInteger times(BigInteger left, BigInteger right) {
        return this.reduce(left.multiply(right));
    }

    @Override
    public BigInteger one() {
        return this.reduce(BigInteger.ONE);
    }

    @Override
    public Iterable<BigInteger> elements() {
        List<BigInteger> result = new ArrayList<BigInteger>();
        for (BigInteger i = BigInteger.ZERO; i.compareTo(this.modulus) < 0; i = i.add(BigInteger.ONE))
            result.add(i);
        return result;
    }

    @Override
    public boolean isDomain() {
        return this.modulus.isProbablePrime(Integers.certainty);
    }

    /**
     * x is a non-zero-divisor iff it is coprime with the modulus.
     */
    @Override
    public boolean isNonZeroDivisor(BigInteger value) {
        return value.gcd(this.modulus).equals(BigInteger.ONE);
    }

    /**
     * The ideal generated by g: the multiples of gcd(g, n).
     */
    public Ideal<BigInteger> ideal(long generator) {
        BigInteger g = BigInteger.valueOf(generator);
        BigInteger d = g.gcd(this.modulus);
        List<BigInteger> generators = new ArrayList<BigInteger>();
        generators.add(this.reduce(g));
        return Ideal.generatedBy(this, x -> this.reduce(x).mod(d).signum() == 0, generators, "(" + d + ")");
    }

    /**
     * The reduction map from the integers.
     */
    public RingHom<BigInteger, BigInteger> fromIntegers() {
        return RingHom.of(Integers.instance, this, this::reduce);
    }

    /**
     * The reduction map from Z/m, where n divides m.
     */
    public RingHom<BigInteger, BigInteger> reductionFrom(IntegersModN larger) {
        Preconditions.checkArgument(larger.modulus.mod(this.modulus).signum() == 0,
                "%s does not divide %s", this.modulus, larger.modulus);
        return RingHom.of(larger, this, this::reduce);
    }

    /**
     * Z/n over Z/m for n dividing m; the map is onto, hence integral.
     */
    public IntegralExtension<BigInteger, BigInteger> extensionOver(IntegersModN larger) {
        return IntegralExtension.ofSurjection(this.reductionFrom(larger), x -> this.reduce(x),
                larger.ideal(this.modulus.longValueExact()));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        IntegersModN that = (IntegersModN) o;
        return this.modulus.equals(that.modulus);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.modulus);
    }

    @Override
    public String toString() {
        return "Z/" + this.modulus;
    }
}
