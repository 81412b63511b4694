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
import org.lyingover.algebraic.PrimeIdeal;

import java.math.BigInteger;
import java.util.Arrays;

import static org.lyingover.TestUtil.big;

public class IntegersTest {
    static final Integers Z = Integers.instance;

    @Test
    public void idealMembershipTest() {
        Ideal<BigInteger> ideal = Z.ideal(big(4), big(6));
        Assert.assertEquals("(2)", ideal.toString());
        Assert.assertTrue(ideal.contains(big(2)));
        Assert.assertTrue(ideal.contains(big(-8)));
        Assert.assertTrue(ideal.contains(big(0)));
        Assert.assertFalse(ideal.contains(big(3)));
        Assert.assertTrue(ideal.isProper());
        Assert.assertFalse(Z.ideal(big(4), big(9)).isProper());
    }

    @Test
    public void primalityTest() {
        Assert.assertTrue(Z.isPrime(Z.ideal(0)));
        Assert.assertFalse(Z.isMaximal(Z.ideal(0)));
        Assert.assertTrue(Z.isPrime(Z.ideal(7)));
        Assert.assertTrue(Z.isMaximal(Z.ideal(-7)));
        Assert.assertFalse(Z.isPrime(Z.ideal(6)));
        Assert.assertFalse(Z.isPrime(Z.ideal(1)));
        Assert.assertFalse(Z.isMaximal(Z.ideal(1)));
    }

    @Test
    public void primeIdealTest() {
        PrimeIdeal<BigInteger> five = Z.primeIdeal(5);
        Assert.assertTrue(five.contains(big(25)));
        Assert.assertFalse(five.contains(big(26)));
        Assert.assertThrows(IllegalArgumentException.class, () -> Z.primeIdeal(6));
    }

    @Test
    public void undecidableWithoutGeneratorsTest() {
        Ideal<BigInteger> even = Ideal.of(Z, x -> !x.testBit(0), "evens");
        Assert.assertThrows(UnsupportedOperationException.class, () -> Z.isPrime(even));
    }

    @Test
    public void ringTest() {
        Assert.assertEquals(big(12), Z.times(big(3), big(4)));
        Assert.assertEquals(big(-1), Z.subtract(big(3), big(4)));
        Assert.assertEquals(big(81), Z.power(big(3), 4));
        Assert.assertTrue(Z.isDomain());
        Assert.assertTrue(Z.isNonZeroDivisor(big(3)));
        Assert.assertFalse(Z.isTrivial());
        Assert.assertEquals(big(6), Z.sum(Arrays.asList(big(1), big(2), big(3))));
        Assert.assertEquals(big(0), Z.sum(Arrays.<BigInteger>asList()));
    }
}
