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

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * A sublattice of Z^2, the coordinates standing for x + y sqrt(d).
 * Kept in Hermite normal form: basis vectors (alpha, 0) and (beta, gamma),
 * alpha and gamma non-negative and 0 <= beta < alpha when alpha is positive.
 */
final class QuadraticLattice {
    final BigInteger alpha;
    final BigInteger beta;
    final BigInteger gamma;

    private QuadraticLattice(BigInteger alpha, BigInteger beta, BigInteger gamma) {
        this.alpha = alpha;
        this.beta = beta;
        this.gamma = gamma;
    }

    /**
     * The lattice spanned by a list of vectors, each an array {x, y}.
     */
    static QuadraticLattice spannedBy(List<BigInteger[]> vectors) {
        List<BigInteger[]> rows = new ArrayList<BigInteger[]>();
        for (BigInteger[] v: vectors) {
            if (v[0].signum() != 0 || v[1].signum() != 0)
                rows.add(new BigInteger[] { v[0], v[1] });
        }

        // Euclid on the second coordinate until a single row has y != 0.
        BigInteger[] pivot = null;
        while (true) {
            int best = -1;
            for (int i = 0; i < rows.size(); i++) {
                BigInteger y = rows.get(i)[1];
                if (y.signum() == 0)
                    continue;
                if (best < 0 || y.abs().compareTo(rows.get(best)[1].abs()) < 0)
                    best = i;
            }
            if (best < 0)
                break;
            BigInteger[] candidate = rows.get(best);
            boolean done = true;
            for (int i = 0; i < rows.size(); i++) {
                BigInteger[] row = rows.get(i);
                if (i == best || row[1].signum() == 0)
                    continue;
                BigInteger q = row[1].divide(candidate[1]);
                BigInteger[] reduced = new BigInteger[] {
                        row[0].subtract(q.multiply(candidate[0])),
                        row[1].subtract(q.multiply(candidate[1])) };
                rows.set(i, reduced);
                if (reduced[1].signum() != 0)
                    done = false;
            }
            if (done) {
                pivot = candidate;
                rows.remove(best);
                break;
            }
        }

        BigInteger alpha = BigInteger.ZERO;
        for (BigInteger[] row: rows)
            alpha = alpha.gcd(row[0]);
        if (pivot == null)
            return new QuadraticLattice(alpha, BigInteger.ZERO, BigInteger.ZERO);
        if (pivot[1].signum() < 0)
            pivot = new BigInteger[] { pivot[0].negate(), pivot[1].negate() };
        BigInteger beta = alpha.signum() == 0 ? pivot[0] : pivot[0].mod(alpha);
        return new QuadraticLattice(alpha, beta, pivot[1]);
    }

    boolean contains(BigInteger x, BigInteger y) {
        if (this.gamma.signum() == 0) {
            if (y.signum() != 0)
                return false;
            return Integers.isMultiple(x, this.alpha);
        }
        if (y.mod(this.gamma).signum() != 0)
            return false;
        BigInteger k = y.divide(this.gamma);
        return Integers.isMultiple(x.subtract(k.multiply(this.beta)), this.alpha);
    }

    boolean isZero() {
        return this.alpha.signum() == 0 && this.gamma.signum() == 0;
    }

    /**
     * Index of the lattice in Z^2; zero when the lattice is not of full rank.
     */
    BigInteger index() {
        return this.alpha.multiply(this.gamma);
    }

    /**
     * True if this is the lattice n Z^2.
     */
    boolean isScalar(BigInteger n) {
        return this.alpha.equals(n) && this.beta.signum() == 0 && this.gamma.equals(n);
    }

    @Override
    public String toString() {
        return "<(" + this.alpha + ",0),(" + this.beta + "," + this.gamma + ")>";
    }
}
