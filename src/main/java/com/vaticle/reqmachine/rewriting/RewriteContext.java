/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.reqmachine.rewriting;

import com.vaticle.reqmachine.ast.DependentMemberType;
import com.vaticle.reqmachine.ast.GenericParamType;
import com.vaticle.reqmachine.ast.ProtocolDecl;
import com.vaticle.reqmachine.ast.Type;
import com.vaticle.reqmachine.common.exception.ReqMachineException;
import com.vaticle.reqmachine.conformance.ConformanceLookup;

import javax.annotation.Nullable;
import java.util.List;

import static com.vaticle.reqmachine.common.exception.ErrorMessage.Rewriting.NOT_A_TYPE_PARAMETER;
import static com.vaticle.reqmachine.common.exception.ErrorMessage.Rewriting.SUBSTITUTION_OUT_OF_BOUNDS;

/**
 * Conversions between types and terms.
 */
public class RewriteContext {

    private final ConformanceLookup conformances;

    public RewriteContext(ConformanceLookup conformances) {
        this.conformances = conformances;
    }

    public ConformanceLookup conformances() {
        return conformances;
    }

    /**
     * The term for a type parameter. Inside the requirement signature of {@code protocol}, {@code Self} is the
     * protocol symbol {@code [P]} and {@code Self.A} is the associated type symbol {@code [P:A]}.
     */
    public MutableTerm getTermForType(Type type, @Nullable ProtocolDecl protocol) {
        if (type.isGenericParam()) {
            GenericParamType param = type.asGenericParam();
            if (protocol != null) {
                assert param.equals(ProtocolDecl.selfType());
                return new MutableTerm().add(Symbol.forProtocol(protocol));
            }
            return new MutableTerm().add(Symbol.forGenericParam(param));
        } else if (type.isDependentMember()) {
            DependentMemberType member = type.asDependentMember();
            MutableTerm term = getTermForType(member.base(), protocol);
            Symbol assocSymbol = Symbol.forAssociatedType(member.associatedType());
            if (term.size() == 1 && term.get(0).kind() == Symbol.Kind.PROTOCOL) return new MutableTerm().add(assocSymbol);
            else return term.add(assocSymbol);
        } else {
            throw ReqMachineException.of(NOT_A_TYPE_PARAMETER, type);
        }
    }

    /**
     * The term for a type parameter {@code τ_0_n.X.Y} appearing in a type schema, where {@code τ_0_n} stands for
     * the {@code n}th substitution.
     */
    public MutableTerm getRelativeTermForType(Type type, List<Term> substitutions) {
        if (type.isGenericParam()) {
            GenericParamType param = type.asGenericParam();
            if (param.depth() != 0 || param.index() >= substitutions.size()) {
                throw ReqMachineException.of(SUBSTITUTION_OUT_OF_BOUNDS, param, substitutions);
            }
            return new MutableTerm(substitutions.get(param.index()));
        } else if (type.isDependentMember()) {
            DependentMemberType member = type.asDependentMember();
            return getRelativeTermForType(member.base(), substitutions)
                    .add(Symbol.forAssociatedType(member.associatedType()));
        } else {
            throw ReqMachineException.of(NOT_A_TYPE_PARAMETER, type);
        }
    }

    /**
     * Replaces each type parameter of a concrete type by {@code τ_0_i}, appending the term it stands for, relative
     * to {@code substitutions}, to {@code result}.
     */
    public Type getRelativeSubstitutionSchemaFromType(Type type, List<Term> substitutions, List<Term> result) {
        return type.transformTypeParameters(param -> {
            int index = result.size();
            result.add(getRelativeTermForType(param, substitutions).toTerm());
            return GenericParamType.of(0, index);
        });
    }

    public Type getSubstitutionSchemaFromType(Type type, @Nullable ProtocolDecl protocol, List<Term> result) {
        return type.transformTypeParameters(param -> {
            int index = result.size();
            result.add(getTermForType(param, protocol).toTerm());
            return GenericParamType.of(0, index);
        });
    }
}
