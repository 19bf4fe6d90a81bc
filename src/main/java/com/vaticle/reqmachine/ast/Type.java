/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.reqmachine.ast;

import com.vaticle.reqmachine.common.exception.ReqMachineException;

import java.util.function.Function;

import static com.vaticle.reqmachine.common.exception.ErrorMessage.Internal.ILLEGAL_CAST;

/**
 * A canonical type: a nominal type applied to arguments, a generic parameter {@code τ_d_i}, a member type
 * {@code T.A} projected out of a type parameter, or the error type.
 * <p>
 * Types are immutable and compared structurally. The natural order agrees with {@code equals}: types of different
 * kinds order by kind, and types of the same kind compare component by component.
 */
public abstract class Type implements Comparable<Type> {

    Type() {}

    abstract int kindOrder();

    /**
     * Compares with a type of the same kind.
     */
    abstract int compareSameKind(Type other);

    @Override
    public int compareTo(Type other) {
        int result = Integer.compare(kindOrder(), other.kindOrder());
        if (result != 0) return result;
        return compareSameKind(other);
    }

    /**
     * A type parameter is a generic parameter, or a chain of member projections rooted in one.
     */
    public boolean isTypeParameter() {
        return false;
    }

    /**
     * Whether any type parameter appears anywhere inside this type.
     */
    public abstract boolean hasTypeParameter();

    /**
     * Rebuilds this type with every maximal type parameter sub-term replaced by {@code function}'s result.
     */
    public abstract Type transformTypeParameters(Function<Type, Type> function);

    public abstract Type subst(Substitution substitution);

    public boolean isNominal() {
        return false;
    }

    public boolean isGenericParam() {
        return false;
    }

    public boolean isDependentMember() {
        return false;
    }

    public boolean isError() {
        return false;
    }

    public NominalType asNominal() {
        throw ReqMachineException.of(ILLEGAL_CAST, getClass().getSimpleName(), NominalType.class.getSimpleName());
    }

    public GenericParamType asGenericParam() {
        throw ReqMachineException.of(ILLEGAL_CAST, getClass().getSimpleName(), GenericParamType.class.getSimpleName());
    }

    public DependentMemberType asDependentMember() {
        throw ReqMachineException.of(ILLEGAL_CAST, getClass().getSimpleName(), DependentMemberType.class.getSimpleName());
    }

    /**
     * Replacement of generic parameters, together with the resolution of member types whose base became concrete.
     */
    public interface Substitution {

        Type genericParam(GenericParamType param);

        default Type member(Type concreteBase, AssociatedTypeDecl associatedType) {
            return ErrorType.of(concreteBase);
        }
    }
}
