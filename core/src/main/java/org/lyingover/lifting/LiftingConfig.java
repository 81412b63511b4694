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

import com.google.common.base.Preconditions;

/**
 * Settings of the lifting engine.
 * @param <R>  Type of elements of the base ring.
 * @param <S>  Type of elements of the extension.
 */
public class LiftingConfig<R, S> {
    /**
     * Create a configuration with post-condition checks enabled.
     * @param selector  Chooses maximal ideals of localized extensions.
     */
    public LiftingConfig(MaximalIdealSelector<R, S> selector) {
        this(selector, true);
    }

    public LiftingConfig(MaximalIdealSelector<R, S> selector, boolean safetyChecks) {
        this.setSelector(selector);
        this.safetyChecks = safetyChecks;
    }

    public MaximalIdealSelector<R, S> getSelector() {
        return this.selector;
    }

    public void setSelector(MaximalIdealSelector<R, S> selector) {
        this.selector = Preconditions.checkNotNull(selector, "selector must be non-null");
    }

    public boolean getSafetyChecks() {
        return this.safetyChecks;
    }

    public void setSafetyChecks(boolean safetyChecks) {
        this.safetyChecks = safetyChecks;
    }

    private MaximalIdealSelector<R, S> selector;
    // Re-verify the lifted ideal with the witness finder.
    private boolean safetyChecks;
}
