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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import org.lyingover.algebraic.Ring;
import org.lyingover.algebraic.RingHom;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * A polynomial in one variable X with coefficients in a ring.
 * Coefficients are stored lowest degree first; trailing coefficients the
 * ring considers zero are dropped, so the last stored coefficient is the
 * leading one.
 * @param <R>  Type of coefficients.
 */
public final class Polynomial<R> {
    final Ring<R> ring;
    final ImmutableList<R> coefficients;

    private Polynomial(Ring<R> ring, ImmutableList<R> coefficients) {
        this.ring = ring;
        this.coefficients = coefficients;
    }

    /**
     * @param ring          Ring of coefficients.
     * @param coefficients  Coefficients, lowest degree first.
     */
    public static <R> Polynomial<R> of(Ring<R> ring, List<R> coefficients) {
        int size = coefficients.size();
        while (size > 0 && ring.isZero(coefficients.get(size - 1)))
            size--;
        return new Polynomial<R>(ring, ImmutableList.copyOf(coefficients.subList(0, size)));
    }

    @SafeVarargs
    public static <R> Polynomial<R> of(Ring<R> ring, R... coefficients) {
        return Polynomial.of(ring, Arrays.asList(coefficients));
    }

    public static <R> Polynomial<R> zero(Ring<R> ring) {
        return new Polynomial<R>(ring, ImmutableList.of());
    }

    /**
     * The polynomial coefficient * X^degree.
     */
    public static <R> Polynomial<R> monomial(Ring<R> ring, R coefficient, int degree) {
        Preconditions.checkArgument(degree >= 0, "Negative degree %s", degree);
        List<R> coefficients = new ArrayList<R>(degree + 1);
        for (int i = 0; i < degree; i++)
            coefficients.add(ring.zero());
        coefficients.add(coefficient);
        return Polynomial.of(ring, coefficients);
    }

    public Ring<R> ring() {
        return this.ring;
    }

    /**
     * @return The degree; -1 for the zero polynomial.
     */
    public int degree() {
        return this.coefficients.size() - 1;
    }

    public boolean isZero() {
        return this.coefficients.isEmpty();
    }

    /**
     * The coefficient of X^index; zero past the degree.
     */
    public R coefficient(int index) {
        Preconditions.checkArgument(index >= 0, "Negative index %s", index);
        if (index >= this.coefficients.size())
            return this.ring.zero();
        return this.coefficients.get(index);
    }

    public ImmutableList<R> coefficients() {
        return this.coefficients;
    }

    public R leadingCoefficient() {
        Preconditions.checkState(!this.isZero(), "Zero polynomial has no leading coefficient");
        return this.coefficients.get(this.degree());
    }

    public boolean isMonic() {
        return !this.isZero() && this.ring.isOne(this.leadingCoefficient());
    }

    public R constantTerm() {
        return this.coefficient(0);
    }

    /**
     * The quotient q in the decomposition p = q * X + c, where c is
     * the constant term.
     */
    public Polynomial<R> divideByX() {
        if (this.coefficients.size() <= 1)
            return Polynomial.zero(this.ring);
        return new Polynomial<R>(this.ring, this.coefficients.subList(1, this.coefficients.size()));
    }

    /**
     * Evaluate at value after mapping each coefficient through map,
     * using Horner's rule.
     * @param map    Homomorphism from the coefficient ring.
     * @param value  Point of the target ring.
     * @param <S>    Type of elements of the target ring.
     */
    public <S> S evaluate(RingHom<R, S> map, S value) {
        Preconditions.checkArgument(map.source().equals(this.ring),
                "%s does not map the coefficients of %s", map, this);
        Ring<S> target = map.target();
        S result = target.zero();
        for (int i = this.degree(); i >= 0; i--)
            result = target.add(target.times(result, value), map.apply(this.coefficients.get(i)));
        return result;
    }

    public R evaluate(R value) {
        return this.evaluate(RingHom.identity(this.ring), value);
    }

    /**
     * Read the same coefficients in another ring with the same
     * representation, for instance a quotient of this ring.
     */
    public Polynomial<R> over(Ring<R> other) {
        return Polynomial.of(other, this.coefficients);
    }

    /**
     * Apply a homomorphism to every coefficient.
     */
    public <U> Polynomial<U> map(RingHom<R, U> map) {
        List<U> mapped = new ArrayList<U>(this.coefficients.size());
        for (R c: this.coefficients)
            mapped.add(map.apply(c));
        return Polynomial.of(map.target(), mapped);
    }

    @Override
    public String toString() {
        if (this.isZero())
            return "0";
        StringBuilder builder = new StringBuilder();
        boolean first = true;
        for (int i = this.degree(); i >= 0; i--) {
            R c = this.coefficients.get(i);
            if (this.ring.isZero(c))
                continue;
            if (!first)
                builder.append(" + ");
            first = false;
            if (i == 0) {
                builder.append(c);
                continue;
            }
            if (!this.ring.isOne(c))
                builder.append(c).append("*");
            builder.append("X");
            if (i > 1)
                builder.append("^").append(i);
        }
        return builder.toString();
    }
}
