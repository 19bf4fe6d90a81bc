/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.reqmachine.rewriting;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import static java.util.Collections.unmodifiableList;

/**
 * A derivation certificate: the sequence of steps that transforms a rule's left hand side into its right hand side.
 * Paths are only recorded, never evaluated, by the rewrite system.
 */
public class RewritePath {

    private final List<RewriteStep> steps;

    public RewritePath() {
        this.steps = new ArrayList<>();
    }

    public RewritePath add(RewriteStep step) {
        steps.add(step);
        return this;
    }

    public RewritePath append(RewritePath other) {
        steps.addAll(other.steps);
        return this;
    }

    /**
     * Turns a path from {@code A} to {@code B} into a path from {@code B} to {@code A}.
     */
    public void invert() {
        Collections.reverse(steps);
        steps.replaceAll(RewriteStep::inverted);
    }

    public boolean isEmpty() {
        return steps.isEmpty();
    }

    public int size() {
        return steps.size();
    }

    public List<RewriteStep> steps() {
        return unmodifiableList(steps);
    }

    @Override
    public String toString() {
        return steps.stream().map(RewriteStep::toString).collect(Collectors.joining(" ⊗ "));
    }
}
