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
 * Witness that a concrete type conforms to a protocol.
 */
public interface ProtocolConformance {

    Type getType();

    ProtocolDecl getProtocol();

    /**
     * The type standing in for {@code associatedType} in this conformance, or null if it could not be determined.
     */
    @Nullable
    Type getTypeWitness(AssociatedTypeDecl associatedType);

    /**
     * Requirements that only hold because of the specific arguments of the conforming type, written in terms of
     * the conforming type's generic parameters.
     */
    List<Requirement> getConditionalRequirements();
}
