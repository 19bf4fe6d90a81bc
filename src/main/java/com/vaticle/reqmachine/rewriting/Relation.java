/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.reqmachine.rewriting;

/**
 * An equivalence between two terms that is used as a proof step, without being a rewrite rule itself.
 */
public class Relation {

    private final int id;
    private final Term lhs;
    private final Term rhs;

    Relation(int id, Term lhs, Term rhs) {
        this.id = id;
        this.lhs = lhs;
        this.rhs = rhs;
    }

    public int id() {
        return id;
    }

    public Term lhs() {
        return lhs;
    }

    public Term rhs() {
        return rhs;
    }

    @Override
    public String toString() {
        return lhs + " =>> " + rhs;
    }
}
