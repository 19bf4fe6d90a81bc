/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.reqmachine.rewriting;

import com.vaticle.reqmachine.ast.AssociatedTypeDecl;
import com.vaticle.reqmachine.ast.GenericParamType;
import com.vaticle.reqmachine.ast.LayoutConstraint;
import com.vaticle.reqmachine.ast.ProtocolDecl;
import com.vaticle.reqmachine.ast.Type;
import com.vaticle.reqmachine.common.exception.ReqMachineException;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

import static com.vaticle.reqmachine.common.exception.ErrorMessage.Internal.ILLEGAL_STATE;
import static com.vaticle.reqmachine.common.exception.ErrorMessage.Rewriting.UNEXPECTED_SYMBOL_KIND;
import static java.util.Collections.unmodifiableList;

/**
 * One element of a {@link Term}. The set of kinds is closed; the declaration order of {@link Kind} is the order
 * used when comparing symbols of different kinds.
 * <p>
 * Concrete type, superclass and concrete conformance symbols carry a type schema, where each type parameter of
 * the original type has been replaced by a generic parameter {@code τ_0_i} that indexes into the symbol's list of
 * substitution terms.
 */
public class Symbol implements Comparable<Symbol> {

    public enum Kind {
        PROTOCOL,
        ASSOCIATED_TYPE,
        GENERIC_PARAM,
        LAYOUT,
        SUPERCLASS,
        CONCRETE_TYPE,
        CONCRETE_CONFORMANCE
    }

    private final Kind kind;
    private final ProtocolDecl protocol;
    private final String name;
    private final GenericParamType param;
    private final LayoutConstraint layout;
    private final Type concreteType;
    private final List<Term> substitutions;
    private final int hash;

    private Symbol(Kind kind, @Nullable ProtocolDecl protocol, @Nullable String name, @Nullable GenericParamType param,
                   @Nullable LayoutConstraint layout, @Nullable Type concreteType, List<Term> substitutions) {
        this.kind = kind;
        this.protocol = protocol;
        this.name = name;
        this.param = param;
        this.layout = layout;
        this.concreteType = concreteType;
        this.substitutions = unmodifiableList(new ArrayList<>(substitutions));
        this.hash = Objects.hash(kind, protocol, name, param, layout, concreteType, this.substitutions);
    }

    public static Symbol forProtocol(ProtocolDecl protocol) {
        return new Symbol(Kind.PROTOCOL, protocol, null, null, null, null, List.of());
    }

    public static Symbol forAssociatedType(ProtocolDecl protocol, String name) {
        return new Symbol(Kind.ASSOCIATED_TYPE, protocol, name, null, null, null, List.of());
    }

    public static Symbol forAssociatedType(AssociatedTypeDecl associatedType) {
        return forAssociatedType(associatedType.protocol(), associatedType.name());
    }

    public static Symbol forGenericParam(GenericParamType param) {
        return new Symbol(Kind.GENERIC_PARAM, null, null, param, null, null, List.of());
    }

    public static Symbol forLayout(LayoutConstraint layout) {
        return new Symbol(Kind.LAYOUT, null, null, null, layout, null, List.of());
    }

    public static Symbol forSuperclass(Type type, List<Term> substitutions) {
        return new Symbol(Kind.SUPERCLASS, null, null, null, null, type, substitutions);
    }

    public static Symbol forConcreteType(Type type, List<Term> substitutions) {
        return new Symbol(Kind.CONCRETE_TYPE, null, null, null, null, type, substitutions);
    }

    public static Symbol forConcreteConformance(Type type, List<Term> substitutions, ProtocolDecl protocol) {
        return new Symbol(Kind.CONCRETE_CONFORMANCE, protocol, null, null, null, type, substitutions);
    }

    public Kind kind() {
        return kind;
    }

    public ProtocolDecl protocol() {
        if (protocol == null) throw ReqMachineException.of(UNEXPECTED_SYMBOL_KIND, kind, this);
        return protocol;
    }

    public String name() {
        if (name == null) throw ReqMachineException.of(UNEXPECTED_SYMBOL_KIND, kind, this);
        return name;
    }

    public GenericParamType genericParam() {
        if (param == null) throw ReqMachineException.of(UNEXPECTED_SYMBOL_KIND, kind, this);
        return param;
    }

    public LayoutConstraint layout() {
        if (layout == null) throw ReqMachineException.of(UNEXPECTED_SYMBOL_KIND, kind, this);
        return layout;
    }

    public Type concreteType() {
        if (concreteType == null) throw ReqMachineException.of(UNEXPECTED_SYMBOL_KIND, kind, this);
        return concreteType;
    }

    public List<Term> substitutions() {
        return substitutions;
    }

    /**
     * Property symbols are the ones that can appear at the end of the left hand side of a property rule
     * {@code T.[p] => T}.
     */
    public boolean isProperty() {
        switch (kind) {
            case PROTOCOL:
            case LAYOUT:
            case SUPERCLASS:
            case CONCRETE_TYPE:
            case CONCRETE_CONFORMANCE:
                return true;
            case ASSOCIATED_TYPE:
            case GENERIC_PARAM:
                return false;
            default:
                throw ReqMachineException.of(ILLEGAL_STATE);
        }
    }

    public boolean hasSubstitutions() {
        switch (kind) {
            case SUPERCLASS:
            case CONCRETE_TYPE:
            case CONCRETE_CONFORMANCE:
                return true;
            case PROTOCOL:
            case ASSOCIATED_TYPE:
            case GENERIC_PARAM:
            case LAYOUT:
                return false;
            default:
                throw ReqMachineException.of(ILLEGAL_STATE);
        }
    }

    /**
     * Rebuilds a superclass, concrete type or concrete conformance symbol with a new schema and substitutions.
     */
    public Symbol withConcreteSubstitutions(Type schema, List<Term> newSubstitutions) {
        if (!hasSubstitutions()) throw ReqMachineException.of(UNEXPECTED_SYMBOL_KIND, kind, this);
        return new Symbol(kind, protocol, null, null, null, schema, newSubstitutions);
    }

    /**
     * Prepends {@code prefix} to every substitution term, so that the symbol means the same thing when it is moved
     * from a term {@code U} to a term {@code prefix.U}.
     */
    public Symbol prependPrefixToConcreteSubstitutions(Term prefix) {
        if (!hasSubstitutions()) throw ReqMachineException.of(UNEXPECTED_SYMBOL_KIND, kind, this);
        if (prefix.isEmpty()) return this;
        List<Term> prefixed = new ArrayList<>();
        for (Term substitution : substitutions) {
            MutableTerm term = new MutableTerm(prefix);
            term.append(substitution);
            prefixed.add(term.toTerm());
        }
        return withConcreteSubstitutions(concreteType, prefixed);
    }

    @Override
    public int compareTo(Symbol other) {
        int result = Integer.compare(kind.ordinal(), other.kind.ordinal());
        if (result != 0) return result;
        switch (kind) {
            case PROTOCOL:
                return protocol.name().compareTo(other.protocol.name());
            case ASSOCIATED_TYPE:
                result = name.compareTo(other.name);
                return result != 0 ? result : protocol.name().compareTo(other.protocol.name());
            case GENERIC_PARAM:
                result = Integer.compare(param.depth(), other.param.depth());
                return result != 0 ? result : Integer.compare(param.index(), other.param.index());
            case LAYOUT:
                return layout.compareTo(other.layout);
            case SUPERCLASS:
            case CONCRETE_TYPE:
                return compareConcrete(other);
            case CONCRETE_CONFORMANCE:
                result = compareConcrete(other);
                return result != 0 ? result : protocol.name().compareTo(other.protocol.name());
            default:
                throw ReqMachineException.of(ILLEGAL_STATE);
        }
    }

    private int compareConcrete(Symbol other) {
        int result = concreteType.toString().compareTo(other.concreteType.toString());
        if (result != 0) return result;
        // types that print the same, such as two error types
        result = concreteType.compareTo(other.concreteType);
        if (result != 0) return result;
        result = Integer.compare(substitutions.size(), other.substitutions.size());
        if (result != 0) return result;
        for (int i = 0; i < substitutions.size(); i++) {
            result = substitutions.get(i).compareTo(other.substitutions.get(i));
            if (result != 0) return result;
        }
        return 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Symbol that = (Symbol) o;
        return kind == that.kind && hash == that.hash && Objects.equals(protocol, that.protocol) &&
                Objects.equals(name, that.name) && Objects.equals(param, that.param) && layout == that.layout &&
                Objects.equals(concreteType, that.concreteType) && substitutions.equals(that.substitutions);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        switch (kind) {
            case PROTOCOL:
                return "[" + protocol.name() + "]";
            case ASSOCIATED_TYPE:
                return "[" + protocol.name() + ":" + name + "]";
            case GENERIC_PARAM:
                return param.toString();
            case LAYOUT:
                return "[layout: " + layout + "]";
            case SUPERCLASS:
                return "[superclass: " + concreteString() + "]";
            case CONCRETE_TYPE:
                return "[concrete: " + concreteString() + "]";
            case CONCRETE_CONFORMANCE:
                return "[concrete: " + concreteString() + " : " + protocol.name() + "]";
            default:
                throw ReqMachineException.of(ILLEGAL_STATE);
        }
    }

    private String concreteString() {
        if (substitutions.isEmpty()) return concreteType.toString();
        return concreteType + substitutions.stream().map(Term::toString).collect(Collectors.joining(", ", " with <", ">"));
    }
}
