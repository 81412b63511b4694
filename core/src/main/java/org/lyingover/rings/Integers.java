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

import org.lyingover.algebraic.Ideal;
import org.lyingover.algebraic.PrimeIdeal;
import org.lyingover.algebraic.Ring;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * The ring of infinite-precision integers.
 * This implementation uses BigInteger Java integers.
 * Every ideal is principal, generated by the gcd of its generators.
 */
public class Integers implements Ring<BigInteger> {
    static final int certainty = 64;

    private Integers() {}

    public static final Integers instance = new Integers();

    @Override
    public BigInteger negate(BigInteger data) {
        return data.negate();
    }

    @Override
    public BigInteger add(BigInteger left, BigInteger right) {
        return left.add(right);
    }

    @Override
    public BigInteger zero() {
        return BigInteger.ZERO;
    }

    @Override
    public BigInteger times(BigInteger left, BigInteger right) {
        return left.multiply(right);
    }

    @Override
    public BigInteger one() {
        return BigInteger.ONE;
    }

    @Override
    public boolean equal(BigInteger w0, BigInteger w1) {
        return w0.equals(w1);
    }

    @Override
    public boolean isDomain() {
        return true;
    }

    /**
     * The ideal generated by the given integers.
     */
    public Ideal<BigInteger> ideal(BigInteger... generators) {
        BigInteger gcd = BigInteger.ZERO;
        for (BigInteger g: generators)
            gcd = gcd.gcd(g);
        BigInteger modulus = gcd;
        List<BigInteger> list = new ArrayList<BigInteger>(Arrays.asList(generators));
        return Ideal.generatedBy(this, x -> isMultiple(x, modulus), list, "(" + modulus + ")");
    }

    public Ideal<BigInteger> ideal(long generator) {
        return this.ideal(BigInteger.valueOf(generator));
    }

    /**
     * The prime ideal (p); p must be zero or a prime number.
     */
    public PrimeIdeal<BigInteger> primeIdeal(long p) {
        return PrimeIdeal.of(this.ideal(p));
    }

    static boolean isMultiple(BigInteger value, BigInteger modulus) {
        if (modulus.signum() == 0)
            return value.signum() == 0;
        return value.mod(modulus.abs()).signum() == 0;
    }

    /**
     * The non-negative generator of an ideal given with generators.
     */
    static BigInteger gcdOf(Ideal<BigInteger> ideal) {
        if (!ideal.hasGenerators())
            throw new UnsupportedOperationException("Ideal " + ideal + " has no generators");
        BigInteger gcd = BigInteger.ZERO;
        for (BigInteger g: ideal.generators())
            gcd = gcd.gcd(g);
        return gcd;
    }

    @Override
    public boolean isPrime(Ideal<BigInteger> ideal) {
        BigInteger g = gcdOf(ideal);
        return g.signum() == 0 || g.isProbablePrime(certainty);
    }

    @Override
    public boolean isMaximal(Ideal<BigInteger> ideal) {
        BigInteger g = gcdOf(ideal);
        return g.signum() != 0 && g.isProbablePrime(certainty);
    }

    @Override
    public String toString() {
        return "Z";
    }
}
