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

import org.junit.Assert;
import org.junit.Test;
import org.lyingover.algebraic.Ideal;
import org.lyingover.algebraic.IntegralExtension;
import org.lyingover.algebraic.PrimeIdeal;
import org.lyingover.polynomial.Polynomial;

import java.math.BigInteger;
import java.util.List;

import static org.lyingover.TestUtil.big;

public class QuadraticIntegersTest {
    static final QuadraticIntegers Z2 = new QuadraticIntegers(2);
    static final QuadraticIntegers ZI = new QuadraticIntegers(-1);

    @Test
    public void arithmeticTest() {
        QuadraticInteger x = Z2.element(1, 1);
        QuadraticInteger y = Z2.element(3, -2);
        // (1 + sqrt2)(3 - 2 sqrt2) = 3 - 4 + (3 - 2) sqrt2
        Assert.assertEquals(Z2.element(-1, 1), Z2.times(x, y));
        Assert.assertEquals(Z2.element(4, -1), Z2.add(x, y));
        Assert.assertEquals(Z2.element(2, 0), Z2.times(Z2.sqrt(), Z2.sqrt()));
        Assert.assertEquals(ZI.element(-1, 0), ZI.times(ZI.sqrt(), ZI.sqrt()));
        Assert.assertEquals(big(3), y.rational());
        Assert.assertEquals(big(-2), y.irrational());
        Assert.assertEquals(2, Z2.discriminant());
        Assert.assertEquals(-1, ZI.discriminant());
        Assert.assertEquals(big(-1), x.norm());
        Assert.assertEquals(big(2), x.trace());
        Assert.assertEquals("1+1*sqrt(2)", x.toString());
        Assert.assertEquals("3-2*sqrt(2)", y.toString());
        Assert.assertThrows(IllegalArgumentException.class, () -> Z2.add(x, ZI.one()));
    }

    @Test
    public void squareDiscriminantTest() {
        Assert.assertThrows(IllegalArgumentException.class, () -> new QuadraticIntegers(4));
        Assert.assertThrows(IllegalArgumentException.class, () -> new QuadraticIntegers(1));
        Assert.assertThrows(IllegalArgumentException.class, () -> new QuadraticIntegers(0));
    }

    @Test
    public void minimalPolynomialTest() {
        QuadraticInteger x = Z2.element(3, 1);
        Polynomial<BigInteger> p = Z2.minimalPolynomial(x);
        Assert.assertEquals(2, p.degree());
        Assert.assertTrue(p.isMonic());
        Assert.assertEquals(big(7), p.constantTerm());
        Assert.assertEquals(big(-6), p.coefficient(1));
        Assert.assertTrue(Z2.isZero(p.evaluate(Z2.embedding(), x)));

        IntegralExtension<BigInteger, QuadraticInteger> extension = Z2.overIntegers();
        Assert.assertTrue(extension.witness(Z2.element(-5, 4)).isMonic());
    }

    @Test
    public void latticeMembershipTest() {
        // (7, sqrt2 - 3) contains x + y sqrt2 iff x + 3y = 0 mod 7
        Ideal<QuadraticInteger> ideal = Z2.ideal(Z2.element(7, 0), Z2.element(-3, 1));
        for (int a = -10; a <= 10; a++)
            for (int b = -10; b <= 10; b++)
                Assert.assertEquals(Math.floorMod(a + 3 * b, 7) == 0, ideal.contains(Z2.element(a, b)));

        Ideal<QuadraticInteger> principal = Z2.ideal(Z2.element(1, 1));
        Assert.assertFalse(principal.isProper());

        Ideal<QuadraticInteger> zero = Z2.ideal(0);
        Assert.assertTrue(zero.contains(Z2.zero()));
        Assert.assertFalse(zero.contains(Z2.one()));

        Ideal<QuadraticInteger> three = Z2.ideal(3);
        Assert.assertTrue(three.contains(Z2.element(6, -9)));
        Assert.assertFalse(three.contains(Z2.element(6, 1)));
    }

    @Test
    public void primalityTest() {
        Assert.assertTrue(Z2.isPrime(Z2.ideal(0)));
        Assert.assertFalse(Z2.isMaximal(Z2.ideal(0)));
        // 3 and 5 are inert in Z[sqrt2], 7 splits
        Assert.assertTrue(Z2.isMaximal(Z2.ideal(3)));
        Assert.assertTrue(Z2.isMaximal(Z2.ideal(5)));
        Assert.assertFalse(Z2.isPrime(Z2.ideal(7)));
        Assert.assertFalse(Z2.isPrime(Z2.ideal(2)));
        Assert.assertTrue(Z2.isPrime(Z2.ideal(Z2.sqrt())));
        Assert.assertFalse(Z2.isPrime(Z2.ideal(6)));
        Assert.assertFalse(Z2.isPrime(Z2.ideal(1)));
        // 3 is inert in Z[i], 5 splits
        Assert.assertTrue(ZI.isPrime(ZI.ideal(3)));
        Assert.assertFalse(ZI.isPrime(ZI.ideal(5)));
        Assert.assertTrue(ZI.isPrime(ZI.ideal(ZI.element(2, 1))));
    }

    void checkPrimesOver(QuadraticIntegers ring, long p, int expectedCount) {
        List<PrimeIdeal<QuadraticInteger>> primes = ring.primesOver(p);
        Assert.assertEquals(expectedCount, primes.size());
        for (PrimeIdeal<QuadraticInteger> q: primes) {
            Assert.assertTrue(q.contains(ring.element(p, 0)));
            Assert.assertTrue(q.isProper());
            Assert.assertTrue(ring.isMaximal(q));
        }
    }

    @Test
    public void primesOverTest() {
        this.checkPrimesOver(Z2, 2, 1);
        this.checkPrimesOver(Z2, 5, 1);
        this.checkPrimesOver(Z2, 7, 2);
        this.checkPrimesOver(ZI, 2, 1);
        this.checkPrimesOver(ZI, 3, 1);
        this.checkPrimesOver(ZI, 5, 2);

        List<PrimeIdeal<QuadraticInteger>> seven = Z2.primesOver(7);
        Assert.assertTrue(seven.get(0).contains(Z2.element(-3, 1)));
        Assert.assertFalse(seven.get(1).contains(Z2.element(-3, 1)));
        Assert.assertTrue(seven.get(1).contains(Z2.element(-4, 1)));

        List<PrimeIdeal<QuadraticInteger>> zero = Z2.primesOver(0);
        Assert.assertEquals(1, zero.size());
        Assert.assertFalse(zero.get(0).contains(Z2.one()));
        Assert.assertThrows(IllegalArgumentException.class, () -> Z2.primesOver(6));
    }
}
