/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.reqmachine.conformance;

import com.vaticle.reqmachine.ast.AssociatedTypeDecl;
import com.vaticle.reqmachine.ast.ProtocolDecl;
import com.vaticle.reqmachine.ast.Requirement;
import com.vaticle.reqmachine.ast.Type;

import javax.annotation.Nullable;
import java.util.List;

/**
 * A subclass' conformance, inherited from the conformance of one of its superclasses.
 */
public class InheritedConformance implements ProtocolConformance {

    private final Type subclass;
    private final ProtocolConformance inherited;

    InheritedConformance(Type subclass, ProtocolConformance inherited) {
        this.subclass = subclass;
        this.inherited = inherited;
    }

    @Override
    public Type getType() {
        return subclass;
    }

    @Override
    public ProtocolDecl getProtocol() {
        return inherited.getProtocol();
    }

    @Nullable
    @Override
    public Type getTypeWitness(AssociatedTypeDecl associatedType) {
        return inherited.getTypeWitness(associatedType);
    }

    @Override
    public List<Requirement> getConditionalRequirements() {
        return inherited.getConditionalRequirements();
    }

    @Override
    public String toString() {
        return subclass + " : " + getProtocol().name() + " (inherited from " + inherited.getType() + ")";
    }
}
