/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.reqmachine.common.exception;

import java.util.Objects;

public abstract class ErrorMessage {

    private final String codePrefix;
    private final int codeNumber;
    private final String messagePrefix;
    private final String messageBody;

    private ErrorMessage(String codePrefix, int codeNumber, String messagePrefix, String messageBody) {
        this.codePrefix = codePrefix;
        this.codeNumber = codeNumber;
        this.messagePrefix = messagePrefix;
        this.messageBody = messageBody;
    }

    public String code() {
        return String.format("[%s%02d]", codePrefix, codeNumber);
    }

    public String message(Object... parameters) {
        return String.format("%s %s: %s", code(), messagePrefix, String.format(messageBody, parameters));
    }

    @Override
    public String toString() {
        return code() + " " + messageBody;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ErrorMessage that = (ErrorMessage) o;
        return codeNumber == that.codeNumber && codePrefix.equals(that.codePrefix);
    }

    @Override
    public int hashCode() {
        return Objects.hash(codePrefix, codeNumber);
    }

    public static class Internal extends ErrorMessage {
        public static final Internal ILLEGAL_STATE =
                new Internal(1, "Illegal internal state!");
        public static final Internal ILLEGAL_CAST =
                new Internal(2, "Illegal casting operation from '%s' to '%s'.");
        public static final Internal ABSTRACT_CONFORMANCE =
                new Internal(3, "The concrete type '%s' has an abstract conformance to '%s'.");
        public static final Internal DUPLICATE_CONCRETE_CONFORMANCE =
                new Internal(4, "A concrete conformance was already recorded for the rule pair ('%s', '%s').");
        public static final Internal EMPTY_REWRITE_PATH =
                new Internal(5, "The rule '%s' => '%s' was derived without a rewrite path.");

        private static final String codePrefix = "INT";
        private static final String messagePrefix = "Invalid Internal State";

        Internal(int number, String message) {
            super(codePrefix, number, messagePrefix, message);
        }
    }

    public static class Rewriting extends ErrorMessage {
        public static final Rewriting UNKNOWN_RULE =
                new Rewriting(1, "There is no rule with ID '%s'.");
        public static final Rewriting UNKNOWN_RELATION =
                new Rewriting(2, "There is no relation with ID '%s'.");
        public static final Rewriting UNKNOWN_TYPE_DIFFERENCE =
                new Rewriting(3, "There is no type difference with ID '%s'.");
        public static final Rewriting SUBSTITUTION_OUT_OF_BOUNDS =
                new Rewriting(4, "The generic parameter '%s' has no substitution among '%s'.");
        public static final Rewriting NOT_A_TYPE_PARAMETER =
                new Rewriting(5, "The type '%s' is not a type parameter.");
        public static final Rewriting NOT_A_PROPERTY_SYMBOL =
                new Rewriting(6, "The symbol '%s' is not a property symbol.");
        public static final Rewriting UNEXPECTED_SYMBOL_KIND =
                new Rewriting(7, "Unexpected symbol kind '%s' in '%s'.");

        private static final String codePrefix = "RWS";
        private static final String messagePrefix = "Invalid Rewrite System Operation";

        Rewriting(int number, String message) {
            super(codePrefix, number, messagePrefix, message);
        }
    }

    public static class Requirement extends ErrorMessage {
        public static final Requirement CONFLICTING_CONFORMANCE =
                new Requirement(1, "The type '%s' does not conform to '%s'.");
        public static final Requirement CONFLICTING_SUPERCLASS =
                new Requirement(2, "The type '%s' is not a subclass of '%s'.");
        public static final Requirement CONFLICTING_LAYOUT =
                new Requirement(3, "The type '%s' does not satisfy the layout '%s'.");
        public static final Requirement CONFLICTING_SAME_TYPE =
                new Requirement(4, "The types '%s' and '%s' cannot be equal.");

        private static final String codePrefix = "REQ";
        private static final String messagePrefix = "Invalid Requirement";

        Requirement(int number, String message) {
            super(codePrefix, number, messagePrefix, message);
        }
    }
}
