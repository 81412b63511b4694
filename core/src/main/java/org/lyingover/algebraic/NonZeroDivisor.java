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

package org.lyingover.algebraic;

import com.google.common.base.Preconditions;

/**
 * Certifies that an element can be cancelled from products:
 * x * y = 0 implies y = 0.
 * @param <T>  Type of elements in the ring.
 */
public final class NonZeroDivisor<T> {
    final Ring<T> ring;
    final T element;

    private NonZeroDivisor(Ring<T> ring, T element) {
        this.ring = ring;
        this.element = element;
    }

    /**
     * The ring decides whether value is a non-zero-divisor.
     */
    public static <T> NonZeroDivisor<T> of(Ring<T> ring, T value) {
        Preconditions.checkArgument(ring.isNonZeroDivisor(value), "%s is a zero divisor in %s", value, ring);
        return new NonZeroDivisor<T>(ring, value);
    }

    /**
     * In a domain every nonzero element is a non-zero-divisor.
     */
    public static <T> NonZeroDivisor<T> inDomain(Ring<T> ring, T value) {
        Preconditions.checkArgument(ring.isDomain(), "%s is not a domain", ring);
        Preconditions.checkArgument(!ring.isZero(value), "Zero is a zero divisor");
        return new NonZeroDivisor<T>(ring, value);
    }

    public Ring<T> ring() {
        return this.ring;
    }

    public T element() {
        return this.element;
    }

    @Override
    public String toString() {
        return this.element + " (non-zero-divisor)";
    }
}
