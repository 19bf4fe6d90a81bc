/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.reqmachine.rewriting;

import java.util.Objects;

/**
 * One step of a {@link RewritePath}.
 * <ul>
 *     <li>{@link Kind#RULE}: apply rule {@code id} to the sub-term that starts {@code startOffset} symbols from the
 *     beginning and ends {@code endOffset} symbols from the end of the term;</li>
 *     <li>{@link Kind#RELATION}: apply recorded relation {@code id} at {@code startOffset};</li>
 *     <li>{@link Kind#PREFIX_SUBSTITUTIONS}: prepend the first {@code id} symbols of the term to the substitutions of
 *     the concrete symbol located {@code endOffset} symbols from the end.</li>
 * </ul>
 * An inverse step goes from the right hand side to the left hand side.
 */
public class RewriteStep {

    public enum Kind {RULE, RELATION, PREFIX_SUBSTITUTIONS}

    private final Kind kind;
    private final int startOffset;
    private final int endOffset;
    private final int id;
    private final boolean inverse;

    private RewriteStep(Kind kind, int startOffset, int endOffset, int id, boolean inverse) {
        this.kind = kind;
        this.startOffset = startOffset;
        this.endOffset = endOffset;
        this.id = id;
        this.inverse = inverse;
    }

    public static RewriteStep forRewriteRule(int startOffset, int endOffset, int ruleID, boolean inverse) {
        return new RewriteStep(Kind.RULE, startOffset, endOffset, ruleID, inverse);
    }

    public static RewriteStep forRelation(int startOffset, int relationID, boolean inverse) {
        return new RewriteStep(Kind.RELATION, startOffset, 0, relationID, inverse);
    }

    public static RewriteStep forPrefixSubstitutions(int length, int endOffset, boolean inverse) {
        return new RewriteStep(Kind.PREFIX_SUBSTITUTIONS, 0, endOffset, length, inverse);
    }

    public Kind kind() {
        return kind;
    }

    public int startOffset() {
        return startOffset;
    }

    public int endOffset() {
        return endOffset;
    }

    /**
     * The rule ID, relation ID or prefix length, depending on the kind of step.
     */
    public int id() {
        return id;
    }

    public boolean isInverse() {
        return inverse;
    }

    public RewriteStep inverted() {
        return new RewriteStep(kind, startOffset, endOffset, id, !inverse);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RewriteStep that = (RewriteStep) o;
        return kind == that.kind && startOffset == that.startOffset && endOffset == that.endOffset &&
                id == that.id && inverse == that.inverse;
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, startOffset, endOffset, id, inverse);
    }

    @Override
    public String toString() {
        String direction = inverse ? "^-1" : "";
        switch (kind) {
            case RULE:
                return "rule(" + startOffset + ":" + id + direction + ":" + endOffset + ")";
            case RELATION:
                return "relation(" + startOffset + ":" + id + direction + ")";
            case PREFIX_SUBSTITUTIONS:
                return "prefix-substitutions(" + id + direction + ":" + endOffset + ")";
            default:
                return kind.name();
        }
    }
}
