/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.reqmachine.conformance;

import com.vaticle.reqmachine.ast.AssociatedTypeDecl;
import com.vaticle.reqmachine.ast.NominalDecl;
import com.vaticle.reqmachine.ast.ProtocolDecl;
import com.vaticle.reqmachine.ast.Requirement;
import com.vaticle.reqmachine.ast.Type;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static java.util.Collections.unmodifiableList;

/**
 * A declared conformance of a nominal declaration to a protocol. Type witnesses and conditional requirements are
 * written in terms of the declaration's generic parameters.
 */
public class NormalConformance implements ProtocolConformance {

    private final NominalDecl decl;
    private final ProtocolDecl protocol;
    private final Map<AssociatedTypeDecl, Type> typeWitnesses;
    private final List<Requirement> conditionalRequirements;

    NormalConformance(NominalDecl decl, ProtocolDecl protocol) {
        this.decl = decl;
        this.protocol = protocol;
        this.typeWitnesses = new HashMap<>();
        this.conditionalRequirements = new ArrayList<>();
    }

    public NominalDecl decl() {
        return decl;
    }

    public NormalConformance typeWitness(AssociatedTypeDecl associatedType, Type witness) {
        assert associatedType.protocol().equals(protocol);
        typeWitnesses.put(associatedType, witness);
        return this;
    }

    public NormalConformance conditionalRequirement(Requirement requirement) {
        conditionalRequirements.add(requirement);
        return this;
    }

    @Override
    public Type getType() {
        return decl.declaredType();
    }

    @Override
    public ProtocolDecl getProtocol() {
        return protocol;
    }

    @Nullable
    @Override
    public Type getTypeWitness(AssociatedTypeDecl associatedType) {
        return typeWitnesses.get(associatedType);
    }

    @Override
    public List<Requirement> getConditionalRequirements() {
        return unmodifiableList(conditionalRequirements);
    }

    @Override
    public String toString() {
        return decl.name() + " : " + protocol.name();
    }
}
