/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.reqmachine.ast;

import java.util.Objects;
import java.util.function.Function;

/**
 * The member type {@code T.A}, where {@code T} is a type parameter and {@code A} an associated type.
 */
public class DependentMemberType extends Type {

    private final Type base;
    private final AssociatedTypeDecl associatedType;
    private final int hash;

    private DependentMemberType(Type base, AssociatedTypeDecl associatedType) {
        this.base = base;
        this.associatedType = associatedType;
        this.hash = Objects.hash(base, associatedType);
    }

    public static DependentMemberType of(Type base, AssociatedTypeDecl associatedType) {
        return new DependentMemberType(base, associatedType);
    }

    public Type base() {
        return base;
    }

    public AssociatedTypeDecl associatedType() {
        return associatedType;
    }

    @Override
    public boolean isTypeParameter() {
        return base.isTypeParameter();
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
        Type newBase = base.subst(substitution);
        if (newBase.isTypeParameter()) return of(newBase, associatedType);
        else return substitution.member(newBase, associatedType);
    }

    @Override
    public boolean isDependentMember() {
        return true;
    }

    @Override
    public DependentMemberType asDependentMember() {
        return this;
    }

    @Override
    int kindOrder() {
        return 2;
    }

    @Override
    int compareSameKind(Type other) {
        DependentMemberType that = (DependentMemberType) other;
        int result = base.compareTo(that.base);
        if (result != 0) return result;
        result = associatedType.protocol().name().compareTo(that.associatedType.protocol().name());
        if (result != 0) return result;
        return associatedType.name().compareTo(that.associatedType.name());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DependentMemberType that = (DependentMemberType) o;
        return base.equals(that.base) && associatedType.equals(that.associatedType);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return base + "." + associatedType.name();
    }
}
