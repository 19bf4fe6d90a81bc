/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.reqmachine.ast;

import java.util.Objects;

public class AssociatedTypeDecl {

    private final ProtocolDecl protocol;
    private final String name;
    private final int hash;

    AssociatedTypeDecl(ProtocolDecl protocol, String name) {
        this.protocol = protocol;
        this.name = name;
        this.hash = Objects.hash(protocol.name(), name);
    }

    public ProtocolDecl protocol() {
        return protocol;
    }

    public String name() {
        return name;
    }

    /**
     * The type {@code Self.A} inside the protocol's requirement signature.
     */
    public DependentMemberType selfMemberType() {
        return DependentMemberType.of(ProtocolDecl.selfType(), this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AssociatedTypeDecl that = (AssociatedTypeDecl) o;
        return protocol.equals(that.protocol) && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return protocol.name() + ":" + name;
    }
}
