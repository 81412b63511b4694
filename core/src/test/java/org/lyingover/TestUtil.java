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

package org.lyingover;

import org.junit.Assert;
import org.lyingover.algebraic.Ideal;
import org.lyingover.rings.QuadraticInteger;
import org.lyingover.rings.QuadraticIntegers;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

public class TestUtil {
    public static BigInteger big(long value) {
        return BigInteger.valueOf(value);
    }

    /**
     * The integers between -bound and bound.
     */
    public static List<BigInteger> window(int bound) {
        List<BigInteger> result = new ArrayList<BigInteger>();
        for (int i = -bound; i <= bound; i++)
            result.add(big(i));
        return result;
    }

    /**
     * The elements a + b sqrt(d) with |a|, |b| at most bound.
     */
    public static List<QuadraticInteger> window(QuadraticIntegers ring, int bound) {
        List<QuadraticInteger> result = new ArrayList<QuadraticInteger>();
        for (int a = -bound; a <= bound; a++)
            for (int b = -bound; b <= bound; b++)
                result.add(ring.element(a, b));
        return result;
    }

    /**
     * Check that two ideals agree on a set of elements.
     */
    public static <T> void assertSameMembers(Ideal<T> expected, Ideal<T> actual, Iterable<T> elements) {
        for (T x: elements)
            Assert.assertEquals("Membership of " + x + " in " + actual,
                    expected.contains(x), actual.contains(x));
    }
}
