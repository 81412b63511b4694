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
import org.lyingover.algebraic.NonZeroDivisor;
import org.lyingover.polynomial.Polynomial;

import java.math.BigInteger;

import static org.lyingover.TestUtil.big;

public class IntegersModNTest {
    @Test
    public void arithmeticTest() {
        IntegersModN z6 = new IntegersModN(6);
        Assert.assertEquals(big(2), z6.add(big(4), big(4)));
        Assert.assertEquals(big(0), z6.times(big(2), big(3)));
        Assert.assertEquals(big(1), z6.negate(big(5)));
        Assert.assertTrue(z6.equal(big(7), big(1)));
        Assert.assertTrue(z6.isZero(big(-6)));
        Assert.assertEquals("Z/6", z6.toString());
        Assert.assertEquals(big(3), z6.sum(z6.elements()));
    }

    @Test
    public void finiteRingDecisionsTest() {
        IntegersModN z6 = new IntegersModN(6);
        Assert.assertFalse(z6.isDomain());
        Assert.assertTrue(new IntegersModN(7).isDomain());
        Assert.assertTrue(z6.isPrime(z6.ideal(2)));
        Assert.assertTrue(z6.isPrime(z6.ideal(3)));
        Assert.assertTrue(z6.isMaximal(z6.ideal(3)));
        Assert.assertFalse(z6.isPrime(z6.ideal(0)));
        Assert.assertFalse(z6.isPrime(z6.ideal(5)));
        Assert.assertTrue(new IntegersModN(5).isPrime(new IntegersModN(5).ideal(0)));
    }

    @Test
    public void nonZeroDivisorTest() {
        IntegersModN z6 = new IntegersModN(6);
        Assert.assertEquals(big(5), NonZeroDivisor.of(z6, big(5)).element());
        Assert.assertThrows(IllegalArgumentException.class, () -> NonZeroDivisor.of(z6, big(2)));
        Assert.assertThrows(IllegalArgumentException.class, () -> NonZeroDivisor.inDomain(z6, big(5)));
    }

    @Test
    public void idealTest() {
        IntegersModN z6 = new IntegersModN(6);
        Ideal<BigInteger> ideal = z6.ideal(4);
        Assert.assertEquals("(2)", ideal.toString());
        Assert.assertTrue(ideal.contains(big(2)));
        Assert.assertFalse(ideal.contains(big(3)));
        Assert.assertFalse(z6.ideal(5).isProper());
    }

    @Test
    public void surjectionIsIntegralTest() {
        IntegersModN z6 = new IntegersModN(6);
        IntegersModN z3 = new IntegersModN(3);
        IntegralExtension<BigInteger, BigInteger> extension = z3.extensionOver(z6);
        Polynomial<BigInteger> witness = extension.witness(big(2));
        Assert.assertEquals(1, witness.degree());
        Assert.assertTrue(witness.isMonic());
        Assert.assertTrue(extension.kernel().contains(big(3)));
        Assert.assertFalse(extension.kernel().contains(big(2)));
        Assert.assertThrows(IllegalArgumentException.class, () -> z6.reductionFrom(new IntegersModN(4)));
    }
}
