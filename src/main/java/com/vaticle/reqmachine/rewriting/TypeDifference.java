/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.reqmachine.rewriting;

/**
 * Records that, in the context of {@code base}, the symbol {@code lhs} simplifies to {@code rhs} by rewriting its
 * substitutions.
 */
public class TypeDifference {

    private final int id;
    private final Term base;
    private final Symbol lhs;
    private final Symbol rhs;

    TypeDifference(int id, Term base, Symbol lhs, Symbol rhs) {
        this.id = id;
        this.base = base;
        this.lhs = lhs;
        this.rhs = rhs;
    }

    public int id() {
        return id;
    }

    public Term base() {
        return base;
    }

    public Symbol lhs() {
        return lhs;
    }

    public Symbol rhs() {
        return rhs;
    }

    @Override
    public String toString() {
        return base + ": " + lhs + " -> " + rhs;
    }
}
