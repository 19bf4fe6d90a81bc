/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.reqmachine.ast;

import java.util.function.Function;

public class GenericParamType extends Type {

    private final int depth;
    private final int index;
    private final int hash;

    private GenericParamType(int depth, int index) {
        this.depth = depth;
        this.index = index;
        this.hash = 31 * depth + index;
    }

    public static GenericParamType of(int depth, int index) {
        return new GenericParamType(depth, index);
    }

    public int depth() {
        return depth;
    }

    public int index() {
        return index;
    }

    @Override
    public boolean isTypeParameter() {
        return true;
    }

    @Override
    public boolean hasTypeParameter() {
        return true;
    }

    @Override
    public Type transformTypeParameters(Function<Type, Type> function) {
        return function.apply(this);
    }

    @Override
    public Type subst(Substitution substitution) {
        return substitution.genericParam(this);
    }

    @Override
    public boolean isGenericParam() {
        return true;
    }

    @Override
    public GenericParamType asGenericParam() {
        return this;
    }

    @Override
    int kindOrder() {
        return 1;
    }

    @Override
    int compareSameKind(Type other) {
        GenericParamType that = (GenericParamType) other;
        int result = Integer.compare(depth, that.depth);
        if (result != 0) return result;
        return Integer.compare(index, that.index);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        GenericParamType that = (GenericParamType) o;
        return depth == that.depth && index == that.index;
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return "τ_" + depth + "_" + index;
    }
}
