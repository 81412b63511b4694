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

package org.lyingover.lifting;

import org.lyingover.algebraic.Fraction;
import org.lyingover.algebraic.Ideal;
import org.lyingover.algebraic.IntegralExtension;
import org.lyingover.algebraic.Localization;

/**
 * Chooses a maximal ideal of a localized extension S_P.  Such an ideal
 * exists whenever S_P is not the zero ring, but there is no canonical
 * choice; different selectors may legitimately return different ideals.
 * The lifting engine checks the result before using it.
 * @param <R>  Type of elements of the base ring.
 * @param <S>  Type of elements of the extension.
 */
public interface MaximalIdealSelector<R, S> {
    /**
     * @param localization  The extension localized at the complement of a prime of the base.
     * @param extension     The integral extension that was localized.
     * @return              A maximal ideal of localization.
     * @throws LiftingException if no maximal ideal can be produced.
     */
    Ideal<Fraction<R, S>> select(Localization<R, S> localization, IntegralExtension<R, S> extension);
}
