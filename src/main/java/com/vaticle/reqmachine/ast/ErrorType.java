/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.reqmachine.ast;

import javax.annotation.Nullable;
import java.util.Objects;
import java.util.function.Function;

/**
 * Placeholder for a type that could not be computed. Keeps the type it was derived from, if any.
 */
public class ErrorType extends Type {

    private final Type original;

    private ErrorType(@Nullable Type original) {
        this.original = original;
    }

    public static ErrorType of(@Nullable Type original) {
        return new ErrorType(original);
    }

    @Override
    public boolean hasTypeParameter() {
        return false;
    }

    @Override
    public Type transformTypeParameters(Function<Type, Type> function) {
        return this;
    }

    @Override
    public Type subst(Substitution substitution) {
        return this;
    }

    @Override
    public boolean isError() {
        return true;
    }

    @Override
    int kindOrder() {
        return 3;
    }

    @Override
    int compareSameKind(Type other) {
        Type thatOriginal = ((ErrorType) other).original;
        if (original == null || thatOriginal == null) {
            return Boolean.compare(original != null, thatOriginal != null);
        }
        return original.compareTo(thatOriginal);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Objects.equals(original, ((ErrorType) o).original);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ErrorType.class, original);
    }

    @Override
    public String toString() {
        return "<<error type>>";
    }
}
