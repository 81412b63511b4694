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

import org.junit.Assert;
import org.junit.Test;
import org.lyingover.algebraic.Ideal;
import org.lyingover.algebraic.IntegralExtension;
import org.lyingover.algebraic.NonZeroDivisor;
import org.lyingover.algebraic.PrimeIdeal;
import org.lyingover.polynomial.Polynomial;
import org.lyingover.rings.Integers;
import org.lyingover.rings.IntegersModN;
import org.lyingover.rings.QuadraticInteger;
import org.lyingover.rings.QuadraticIntegers;

import java.math.BigInteger;

import static org.lyingover.TestUtil.big;

public class IdealOrderTest {
    static final Integers Z = Integers.instance;
    static final QuadraticIntegers Z2 = new QuadraticIntegers(2);
    static final QuadraticIntegers ZI = new QuadraticIntegers(-1);

    @Test
    public void comapNonZeroTest() {
        IntegersModN z6 = new IntegersModN(6);
        Polynomial<BigInteger> p = Polynomial.of(Z, big(0), big(-5), big(1));
        BigInteger c = IdealOrder.comapNonZero(z6.fromIntegers(), z6.ideal(5), big(5), p, NonZeroDivisor.of(z6, big(5)));
        Assert.assertNotEquals(big(0), c);
    }

    @Test
    public void comapNonZeroOfIntegralTest() {
        IntegralExtension<BigInteger, QuadraticInteger> extension = Z2.overIntegers();
        QuadraticInteger r = Z2.element(-3, 1);
        Ideal<QuadraticInteger> ideal = Z2.ideal(Z2.element(7, 0), r);
        Assert.assertEquals(big(7), IdealOrder.comapNonZeroOfIntegral(extension, ideal, r));

        BigInteger c = IdealOrder.comapNonZeroOfIntegral(extension, Z2.ideal(5), Z2.element(5, 5));
        Assert.assertEquals(big(-25), c);
        Assert.assertTrue(Z.ideal(5).contains(c));

        Assert.assertThrows(IllegalArgumentException.class,
                () -> IdealOrder.comapNonZeroOfIntegral(extension, Z2.ideal(5), Z2.zero()));
    }

    @Test
    public void comapStrictMonoTest() {
        PrimeIdeal<QuadraticInteger> zero = PrimeIdeal.of(Z2.ideal(0));
        QuadraticInteger r = Z2.element(-3, 1);
        Ideal<QuadraticInteger> upper = Z2.ideal(Z2.element(7, 0), r);
        StrictInclusion<BigInteger> inclusion = IdealOrder.comapStrictMono(
                Z2.embedding(), zero, upper, r, Z2.minimalPolynomial(r));
        Assert.assertEquals(big(7), inclusion.separatingElement());
        Assert.assertTrue(inclusion.upper().contains(big(7)));
        Assert.assertTrue(inclusion.upper().contains(big(14)));
        Assert.assertFalse(inclusion.upper().contains(big(1)));
        Assert.assertFalse(inclusion.lower().contains(big(7)));
        Assert.assertTrue(inclusion.lower().contains(big(0)));
    }

    @Test
    public void comapStrictMonoOfIntegralTest() {
        IntegralExtension<BigInteger, QuadraticInteger> extension = Z2.overIntegers();
        PrimeIdeal<QuadraticInteger> lower = PrimeIdeal.of(Z2.ideal(Z2.sqrt()));
        Ideal<QuadraticInteger> upper = Z2.ideal(Z2.sqrt(), Z2.element(3, 0));
        StrictInclusion<BigInteger> inclusion =
                IdealOrder.comapStrictMonoOfIntegral(extension, lower, upper, Z2.element(3, 0));
        BigInteger c = inclusion.separatingElement();
        Assert.assertTrue(inclusion.upper().contains(c));
        Assert.assertFalse(inclusion.lower().contains(c));
        Assert.assertTrue(inclusion.lower().contains(big(2)));
    }

    @Test
    public void gaussianStrictMonoTest() {
        IntegralExtension<BigInteger, QuadraticInteger> extension = ZI.overIntegers();
        PrimeIdeal<QuadraticInteger> zero = PrimeIdeal.of(ZI.ideal(0));
        for (PrimeIdeal<QuadraticInteger> prime: ZI.primesOver(5)) {
            QuadraticInteger r = prime.generators().get(1);
            StrictInclusion<BigInteger> inclusion = IdealOrder.comapStrictMonoOfIntegral(extension, zero, prime, r);
            Assert.assertEquals(big(0), inclusion.separatingElement().mod(big(5)));
            Assert.assertNotEquals(big(0), inclusion.separatingElement());
        }
    }
}
