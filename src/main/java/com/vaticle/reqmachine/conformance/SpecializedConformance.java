/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.reqmachine.conformance;

import com.vaticle.reqmachine.ast.AssociatedTypeDecl;
import com.vaticle.reqmachine.ast.ErrorType;
import com.vaticle.reqmachine.ast.GenericParamType;
import com.vaticle.reqmachine.ast.NominalType;
import com.vaticle.reqmachine.ast.ProtocolDecl;
import com.vaticle.reqmachine.ast.Requirement;
import com.vaticle.reqmachine.ast.Type;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;

/**
 * A declared conformance applied to specific generic arguments, e.g. {@code Foo<Int, τ_0_0> : P} from
 * {@code Foo<A, B> : P}.
 */
public class SpecializedConformance implements ProtocolConformance {

    private final NominalType type;
    private final NormalConformance generic;
    private final Type.Substitution substitution;

    SpecializedConformance(NominalType type, NormalConformance generic, ConformanceLookup lookup) {
        assert type.decl().equals(generic.decl());
        this.type = type;
        this.generic = generic;
        this.substitution = new Type.Substitution() {
            @Override
            public Type genericParam(GenericParamType param) {
                return type.argumentFor(param);
            }

            @Override
            public Type member(Type concreteBase, AssociatedTypeDecl associatedType) {
                ProtocolConformanceRef ref = lookup.lookupConformance(concreteBase, associatedType.protocol());
                if (!ref.isConcrete()) return ErrorType.of(concreteBase);
                Type witness = ref.getConcrete().getTypeWitness(associatedType);
                return witness != null ? witness : ErrorType.of(concreteBase);
            }
        };
    }

    @Override
    public Type getType() {
        return type;
    }

    @Override
    public ProtocolDecl getProtocol() {
        return generic.getProtocol();
    }

    @Nullable
    @Override
    public Type getTypeWitness(AssociatedTypeDecl associatedType) {
        Type witness = generic.getTypeWitness(associatedType);
        if (witness == null) return null;
        return witness.subst(substitution);
    }

    @Override
    public List<Requirement> getConditionalRequirements() {
        List<Requirement> requirements = new ArrayList<>();
        for (Requirement req : generic.getConditionalRequirements()) requirements.add(req.subst(substitution));
        return requirements;
    }

    @Override
    public String toString() {
        return type + " : " + getProtocol().name();
    }
}
