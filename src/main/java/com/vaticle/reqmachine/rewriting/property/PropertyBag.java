/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.reqmachine.rewriting.property;

import com.vaticle.reqmachine.ast.LayoutConstraint;
import com.vaticle.reqmachine.ast.ProtocolDecl;
import com.vaticle.reqmachine.ast.Type;
import com.vaticle.reqmachine.common.exception.ReqMachineException;
import com.vaticle.reqmachine.conformance.ProtocolConformance;
import com.vaticle.reqmachine.rewriting.Symbol;
import com.vaticle.reqmachine.rewriting.Term;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.vaticle.reqmachine.common.exception.ErrorMessage.Internal.ILLEGAL_STATE;
import static java.util.Collections.unmodifiableList;

/**
 * Everything known about the type parameters whose reduced term ends with {@link #key()}: the protocols they
 * conform to, and their concrete type, superclass and layout, each with the ID of the rule that implies it.
 */
public class PropertyBag {

    private final Term key;
    private final List<ProtocolDecl> conformsTo;
    private final List<Integer> conformsToRules;
    private Symbol concreteType;
    private Integer concreteTypeRule;
    private Symbol superclass;
    private Integer superclassRule;
    private LayoutConstraint layout;
    private Integer layoutRule;
    private final List<ProtocolConformance> concreteConformances;
    private final List<ProtocolConformance> superclassConformances;

    PropertyBag(Term key) {
        this.key = key;
        this.conformsTo = new ArrayList<>();
        this.conformsToRules = new ArrayList<>();
        this.concreteConformances = new ArrayList<>();
        this.superclassConformances = new ArrayList<>();
    }

    public Term key() {
        return key;
    }

    /**
     * Parallel to {@link #conformsToRules()}. A protocol appears once for every rule that states it.
     */
    public List<ProtocolDecl> conformsTo() {
        return unmodifiableList(conformsTo);
    }

    public List<Integer> conformsToRules() {
        return unmodifiableList(conformsToRules);
    }

    public boolean isConcreteType() {
        return concreteType != null;
    }

    public Symbol concreteTypeSymbol() {
        if (concreteType == null) throw ReqMachineException.of(ILLEGAL_STATE);
        return concreteType;
    }

    public Type concreteType() {
        return concreteTypeSymbol().concreteType();
    }

    public int concreteTypeRule() {
        if (concreteTypeRule == null) throw ReqMachineException.of(ILLEGAL_STATE);
        return concreteTypeRule;
    }

    public boolean hasSuperclassBound() {
        return superclass != null;
    }

    public Symbol superclassSymbol() {
        if (superclass == null) throw ReqMachineException.of(ILLEGAL_STATE);
        return superclass;
    }

    public int superclassRule() {
        if (superclassRule == null) throw ReqMachineException.of(ILLEGAL_STATE);
        return superclassRule;
    }

    public Optional<LayoutConstraint> layout() {
        return Optional.ofNullable(layout);
    }

    public int layoutRule() {
        if (layoutRule == null) throw ReqMachineException.of(ILLEGAL_STATE);
        return layoutRule;
    }

    public List<ProtocolConformance> concreteConformances() {
        return unmodifiableList(concreteConformances);
    }

    public List<ProtocolConformance> superclassConformances() {
        return unmodifiableList(superclassConformances);
    }

    /**
     * The protocols this key conforms to, minus the ones whose conformance is already implied by the superclass.
     */
    public List<ProtocolDecl> getConformsToExcludingSuperclassConformances() {
        if (superclassConformances.isEmpty()) return conformsTo();
        List<ProtocolDecl> result = new ArrayList<>();
        for (ProtocolDecl protocol : conformsTo) {
            boolean implied = false;
            for (ProtocolConformance conformance : superclassConformances) {
                if (conformance.getProtocol().equals(protocol)) {
                    implied = true;
                    break;
                }
            }
            if (!implied) result.add(protocol);
        }
        return result;
    }

    /**
     * Records a conformance rule. A protocol inherited from a suffix bag is recorded again with the key's own rule,
     * so that each rule is paired with the key's concrete type on its own.
     */
    void addConformance(ProtocolDecl protocol, int ruleID) {
        if (conformsToRules.contains(ruleID)) return;
        conformsTo.add(protocol);
        conformsToRules.add(ruleID);
    }

    void setConcreteType(Symbol symbol, int ruleID) {
        concreteType = symbol;
        concreteTypeRule = ruleID;
    }

    void setSuperclass(Symbol symbol, int ruleID) {
        superclass = symbol;
        superclassRule = ruleID;
    }

    void setLayout(LayoutConstraint layout, int ruleID) {
        this.layout = layout;
        this.layoutRule = ruleID;
    }

    void recordConformance(ProtocolConformance conformance, boolean fromSuperclass) {
        List<ProtocolConformance> conformances = fromSuperclass ? superclassConformances : concreteConformances;
        if (!conformances.contains(conformance)) conformances.add(conformance);
    }

    /**
     * Copies the properties of the bag for a suffix of this key. Substitution terms are prefixed with the part of
     * this key that precedes the suffix.
     */
    void copyPropertiesFrom(PropertyBag suffixBag) {
        assert key.size() > suffixBag.key.size();
        Term prefix = key.prefix(key.size() - suffixBag.key.size());

        conformsTo.addAll(suffixBag.conformsTo);
        conformsToRules.addAll(suffixBag.conformsToRules);
        layout = suffixBag.layout;
        layoutRule = suffixBag.layoutRule;
        if (suffixBag.superclass != null) {
            superclass = suffixBag.superclass.prependPrefixToConcreteSubstitutions(prefix);
            superclassRule = suffixBag.superclassRule;
        }
        if (suffixBag.concreteType != null) {
            concreteType = suffixBag.concreteType.prependPrefixToConcreteSubstitutions(prefix);
            concreteTypeRule = suffixBag.concreteTypeRule;
        }
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        builder.append(key).append(" => {");
        if (!conformsTo.isEmpty()) builder.append(" conforms_to: ").append(conformsTo);
        if (layout != null) builder.append(" layout: ").append(layout);
        if (superclass != null) builder.append(" superclass: ").append(superclass);
        if (concreteType != null) builder.append(" concrete_type: ").append(concreteType);
        builder.append(" }");
        return builder.toString();
    }
}
