/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.reqmachine.rewriting;

import javax.annotation.Nullable;
import java.util.Optional;

/**
 * A directed rewrite {@code lhs => rhs}. Rules are never removed; a rule that cannot be satisfied is marked
 * conflicting instead.
 */
public class Rule {

    private final int id;
    private final Term lhs;
    private final Term rhs;
    private final RewritePath path;
    private final boolean permanent;
    private final boolean explicit;
    private boolean conflicting;

    Rule(int id, Term lhs, Term rhs, @Nullable RewritePath path, boolean permanent, boolean explicit) {
        assert lhs.compareTo(rhs) > 0;
        this.id = id;
        this.lhs = lhs;
        this.rhs = rhs;
        this.path = path;
        this.permanent = permanent;
        this.explicit = explicit;
        this.conflicting = false;
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

    /**
     * The derivation of this rule, or empty for axioms: permanent rules, explicit requirements and rules added
     * without a proof.
     */
    public Optional<RewritePath> path() {
        return Optional.ofNullable(path);
    }

    public boolean isPermanent() {
        return permanent;
    }

    public boolean isExplicit() {
        return explicit;
    }

    public boolean isConflicting() {
        return conflicting;
    }

    public void markConflicting() {
        conflicting = true;
    }

    /**
     * If this rule has the form {@code T.[p] => T} for a property symbol {@code [p]}, returns {@code [p]}.
     */
    public Optional<Symbol> isPropertyRule() {
        if (lhs.size() != rhs.size() + 1) return Optional.empty();
        Symbol property = lhs.last();
        if (!property.isProperty()) return Optional.empty();
        for (int i = 0; i < rhs.size(); i++) {
            if (!lhs.get(i).equals(rhs.get(i))) return Optional.empty();
        }
        return Optional.of(property);
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        builder.append(lhs).append(" => ").append(rhs);
        if (permanent) builder.append(" [permanent]");
        if (explicit) builder.append(" [explicit]");
        if (conflicting) builder.append(" [conflicting]");
        return builder.toString();
    }
}
