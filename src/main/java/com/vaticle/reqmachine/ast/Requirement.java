/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.reqmachine.ast;

import com.vaticle.reqmachine.common.exception.ReqMachineException;

import javax.annotation.Nullable;
import java.util.Objects;

import static com.vaticle.reqmachine.common.exception.ErrorMessage.Internal.ILLEGAL_STATE;

/**
 * A generic requirement. The constraint is a protocol for {@link RequirementKind#CONFORMANCE}, a type for
 * {@link RequirementKind#SUPERCLASS} and {@link RequirementKind#SAME_TYPE}, and a layout for
 * {@link RequirementKind#LAYOUT}.
 */
public class Requirement {

    private final RequirementKind kind;
    private final Type subject;
    private final Type constraintType;
    private final ProtocolDecl protocol;
    private final LayoutConstraint layout;
    private final int hash;

    private Requirement(RequirementKind kind, Type subject, @Nullable Type constraintType,
                        @Nullable ProtocolDecl protocol, @Nullable LayoutConstraint layout) {
        this.kind = kind;
        this.subject = subject;
        this.constraintType = constraintType;
        this.protocol = protocol;
        this.layout = layout;
        this.hash = Objects.hash(kind, subject, constraintType, protocol, layout);
    }

    public static Requirement conformance(Type subject, ProtocolDecl protocol) {
        return new Requirement(RequirementKind.CONFORMANCE, subject, null, protocol, null);
    }

    public static Requirement superclass(Type subject, Type superclass) {
        return new Requirement(RequirementKind.SUPERCLASS, subject, superclass, null, null);
    }

    public static Requirement sameType(Type subject, Type other) {
        return new Requirement(RequirementKind.SAME_TYPE, subject, other, null, null);
    }

    public static Requirement layout(Type subject, LayoutConstraint layout) {
        return new Requirement(RequirementKind.LAYOUT, subject, null, null, layout);
    }

    public RequirementKind kind() {
        return kind;
    }

    public Type subject() {
        return subject;
    }

    public Type constraintType() {
        assert constraintType != null;
        return constraintType;
    }

    public ProtocolDecl protocol() {
        assert protocol != null;
        return protocol;
    }

    public LayoutConstraint layout() {
        assert layout != null;
        return layout;
    }

    public Requirement subst(Type.Substitution substitution) {
        Type newSubject = subject.subst(substitution);
        switch (kind) {
            case CONFORMANCE:
                return conformance(newSubject, protocol);
            case SUPERCLASS:
                return superclass(newSubject, constraintType.subst(substitution));
            case SAME_TYPE:
                return sameType(newSubject, constraintType.subst(substitution));
            case LAYOUT:
                return layout(newSubject, layout);
            default:
                throw ReqMachineException.of(ILLEGAL_STATE);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Requirement that = (Requirement) o;
        return kind == that.kind && subject.equals(that.subject) && Objects.equals(constraintType, that.constraintType) &&
                Objects.equals(protocol, that.protocol) && layout == that.layout;
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        switch (kind) {
            case CONFORMANCE:
                return subject + " : " + protocol;
            case SUPERCLASS:
                return subject + " : " + constraintType;
            case SAME_TYPE:
                return subject + " == " + constraintType;
            case LAYOUT:
                return subject + " : " + layout;
            default:
                throw ReqMachineException.of(ILLEGAL_STATE);
        }
    }
}
