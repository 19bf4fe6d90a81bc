/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.reqmachine.conformance;

import com.vaticle.reqmachine.ast.ProtocolDecl;
import com.vaticle.reqmachine.ast.Type;
import com.vaticle.reqmachine.common.exception.ReqMachineException;

import javax.annotation.Nullable;

import static com.vaticle.reqmachine.common.exception.ErrorMessage.Internal.ILLEGAL_STATE;

/**
 * The result of a conformance lookup: no conformance, an abstract conformance of a type parameter, or a concrete
 * conformance witness.
 */
public class ProtocolConformanceRef {

    private static final ProtocolConformanceRef INVALID = new ProtocolConformanceRef(null, null, null);

    private final Type abstractType;
    private final ProtocolDecl abstractProtocol;
    private final ProtocolConformance concrete;

    private ProtocolConformanceRef(@Nullable Type abstractType, @Nullable ProtocolDecl abstractProtocol,
                                   @Nullable ProtocolConformance concrete) {
        this.abstractType = abstractType;
        this.abstractProtocol = abstractProtocol;
        this.concrete = concrete;
    }

    public static ProtocolConformanceRef invalid() {
        return INVALID;
    }

    public static ProtocolConformanceRef forAbstract(Type type, ProtocolDecl protocol) {
        return new ProtocolConformanceRef(type, protocol, null);
    }

    public static ProtocolConformanceRef forConcrete(ProtocolConformance concrete) {
        return new ProtocolConformanceRef(null, null, concrete);
    }

    public boolean isInvalid() {
        return this == INVALID;
    }

    public boolean isAbstract() {
        return abstractType != null;
    }

    public boolean isConcrete() {
        return concrete != null;
    }

    public ProtocolConformance getConcrete() {
        if (concrete == null) throw ReqMachineException.of(ILLEGAL_STATE);
        return concrete;
    }

    @Override
    public String toString() {
        if (isInvalid()) return "<invalid>";
        else if (isAbstract()) return "abstract(" + abstractType + " : " + abstractProtocol + ")";
        else return concrete.toString();
    }
}
