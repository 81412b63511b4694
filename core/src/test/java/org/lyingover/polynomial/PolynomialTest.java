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

package org.lyingover.polynomial;

import org.junit.Assert;
import org.junit.Test;
import org.lyingover.rings.Integers;
import org.lyingover.rings.IntegersModN;

import java.math.BigInteger;

import static org.lyingover.TestUtil.big;

public class PolynomialTest {
    static final Integers Z = Integers.instance;

    @Test
    public void trimTest() {
        Polynomial<BigInteger> p = Polynomial.of(Z, big(1), big(2), big(0), big(0));
        Assert.assertEquals(1, p.degree());
        Assert.assertEquals(big(2), p.leadingCoefficient());
        Assert.assertFalse(p.isMonic());
        Assert.assertEquals(big(0), p.coefficient(5));
        Assert.assertTrue(Polynomial.of(Z, big(0)).isZero());
        Assert.assertEquals(-1, Polynomial.zero(Z).degree());
    }

    @Test
    public void evaluateTest() {
        // X^2 - 4
        Polynomial<BigInteger> p = Polynomial.of(Z, big(-4), big(0), big(1));
        Assert.assertTrue(p.isMonic());
        Assert.assertEquals(big(0), p.evaluate(big(2)));
        Assert.assertEquals(big(5), p.evaluate(big(3)));
        Assert.assertEquals("X^2 + -4", p.toString());

        IntegersModN z5 = new IntegersModN(5);
        Assert.assertEquals(big(0), p.evaluate(z5.fromIntegers(), big(3)));
    }

    @Test
    public void divideByXTest() {
        // X^3 - 4X = X (X^2 - 4)
        Polynomial<BigInteger> p = Polynomial.of(Z, big(0), big(-4), big(0), big(1));
        Polynomial<BigInteger> q = p.divideByX();
        Assert.assertEquals(2, q.degree());
        Assert.assertEquals(big(-4), q.constantTerm());
        Assert.assertTrue(Polynomial.of(Z, big(7)).divideByX().isZero());
    }

    @Test
    public void changeRingTest() {
        // 6X^2 + 3X + 2 over Z/3 is the constant 2
        Polynomial<BigInteger> p = Polynomial.of(Z, big(2), big(3), big(6));
        IntegersModN z3 = new IntegersModN(3);
        Assert.assertEquals(0, p.over(z3).degree());
        Assert.assertEquals(0, p.map(z3.fromIntegers()).degree());
        Polynomial<BigInteger> m = Polynomial.monomial(Z, big(3), 2);
        Assert.assertEquals(2, m.degree());
        Assert.assertTrue(m.over(z3).isZero());
    }
}
