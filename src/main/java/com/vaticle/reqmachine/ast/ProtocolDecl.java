/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.reqmachine.ast;

import java.util.ArrayList;
import java.util.List;

import static java.util.Collections.unmodifiableList;

/**
 * A protocol with its associated types and its requirement signature. Requirements of the signature are written
 * in terms of {@code Self}, the generic parameter {@code τ_0_0}.
 * <p>
 * Protocols are identified by name. Associated types and requirements are added after construction so that
 * mutually recursive protocols can be declared.
 */
public class ProtocolDecl {

    private static final GenericParamType SELF = GenericParamType.of(0, 0);

    private final String name;
    private final List<AssociatedTypeDecl> associatedTypes;
    private final List<Requirement> requirements;

    private ProtocolDecl(String name) {
        this.name = name;
        this.associatedTypes = new ArrayList<>();
        this.requirements = new ArrayList<>();
    }

    public static ProtocolDecl of(String name) {
        return new ProtocolDecl(name);
    }

    public static GenericParamType selfType() {
        return SELF;
    }

    public String name() {
        return name;
    }

    public AssociatedTypeDecl addAssociatedType(String name) {
        AssociatedTypeDecl associatedType = new AssociatedTypeDecl(this, name);
        associatedTypes.add(associatedType);
        return associatedType;
    }

    public ProtocolDecl addInherited(ProtocolDecl inherited) {
        requirements.add(Requirement.conformance(SELF, inherited));
        return this;
    }

    public ProtocolDecl addRequirement(Requirement requirement) {
        requirements.add(requirement);
        return this;
    }

    public List<AssociatedTypeDecl> associatedTypes() {
        return unmodifiableList(associatedTypes);
    }

    public List<Requirement> requirementSignature() {
        return unmodifiableList(requirements);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return name.equals(((ProtocolDecl) o).name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return name;
    }
}
