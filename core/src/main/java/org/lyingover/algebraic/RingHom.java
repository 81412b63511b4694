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

import java.util.function.Function;

/**
 * A homomorphism of rings with identity.
 * @param <R>  Type of elements in the source ring.
 * @param <S>  Type of elements in the target ring.
 */
public interface RingHom<R, S> {
    Ring<R> source();

    Ring<S> target();

    S apply(R value);

    /**
     * Compose this homomorphism with the next one.
     */
    default <U> RingHom<R, U> andThen(RingHom<S, U> next) {
        if (!this.target().equals(next.source()))
            throw new IllegalArgumentException("Cannot compose " + this + " with " + next);
        return RingHom.of(this.source(), next.target(), x -> next.apply(this.apply(x)));
    }

    /**
     * The kernel is the preimage of the zero ideal.
     */
    default Ideal<R> kernel() {
        return Ideal.zero(this.target()).comap(this);
    }

    /**
     * Build a homomorphism from a function.  The function is trusted to
     * respect the ring operations.
     */
    static <R, S> RingHom<R, S> of(Ring<R> source, Ring<S> target, Function<R, S> function) {
        return new RingHom<R, S>() {
            @Override
            public Ring<R> source() {
                return source;
            }

            @Override
            public Ring<S> target() {
                return target;
            }

            @Override
            public S apply(R value) {
                return function.apply(value);
            }

            @Override
            public String toString() {
                return source + " -> " + target;
            }
        };
    }

    static <R> RingHom<R, R> identity(Ring<R> ring) {
        return RingHom.of(ring, ring, x -> x);
    }
}
