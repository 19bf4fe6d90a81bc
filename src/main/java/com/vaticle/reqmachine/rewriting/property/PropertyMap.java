/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.reqmachine.rewriting.property;

import com.vaticle.reqmachine.common.collection.Pair;
import com.vaticle.reqmachine.common.exception.ReqMachineException;
import com.vaticle.reqmachine.common.parameters.Options;
import com.vaticle.reqmachine.conformance.ProtocolConformance;
import com.vaticle.reqmachine.rewriting.RequirementError;
import com.vaticle.reqmachine.rewriting.RewriteContext;
import com.vaticle.reqmachine.rewriting.RewriteSystem;
import com.vaticle.reqmachine.rewriting.Rule;
import com.vaticle.reqmachine.rewriting.Symbol;
import com.vaticle.reqmachine.rewriting.Term;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.vaticle.reqmachine.common.exception.ErrorMessage.Internal.DUPLICATE_CONCRETE_CONFORMANCE;
import static com.vaticle.reqmachine.common.exception.ErrorMessage.Internal.ILLEGAL_STATE;
import static com.vaticle.reqmachine.common.exception.ErrorMessage.Rewriting.NOT_A_PROPERTY_SYMBOL;
import static com.vaticle.reqmachine.common.parameters.DebugFlags.PROPERTY_MAP;
import static java.util.Collections.unmodifiableCollection;
import static java.util.Collections.unmodifiableList;
import static java.util.Collections.unmodifiableMap;

/**
 * The property bags of one completion pass, together with the concrete conformances resolved during the pass.
 * <p>
 * A bag describes every term ending with its key. When a bag is created for a key that has a shorter suffix with
 * a bag of its own, it starts out with a copy of that bag's properties.
 */
public class PropertyMap {

    private static final Logger LOG = LoggerFactory.getLogger(PropertyMap.class);

    private final RewriteSystem system;
    private final RewriteContext context;
    private final Options options;
    private final Map<Term, PropertyBag> entries;
    private final Map<Pair<Integer, Integer>, ProtocolConformance> concreteConformances;
    private final List<RequirementError> errors;
    private final NestedTypeConcretizer concretizer;

    public PropertyMap(RewriteSystem system, RewriteContext context, Options options) {
        this.system = system;
        this.context = context;
        this.options = options;
        this.entries = new LinkedHashMap<>();
        this.concreteConformances = new HashMap<>();
        this.errors = new ArrayList<>();
        this.concretizer = new NestedTypeConcretizer(this);
    }

    RewriteSystem system() {
        return system;
    }

    RewriteContext context() {
        return context;
    }

    Options options() {
        return options;
    }

    public Collection<PropertyBag> entries() {
        return unmodifiableCollection(entries.values());
    }

    /**
     * The bag whose key is the longest suffix of {@code term}.
     */
    public Optional<PropertyBag> lookUpProperties(Term term) {
        for (int start = 0; start < term.size(); start++) {
            PropertyBag bag = entries.get(term.suffix(start));
            if (bag != null) return Optional.of(bag);
        }
        return Optional.empty();
    }

    PropertyBag getOrCreateProperties(Term key) {
        PropertyBag bag = entries.get(key);
        if (bag != null) return bag;

        bag = new PropertyBag(key);
        for (int start = 1; start < key.size(); start++) {
            PropertyBag suffixBag = entries.get(key.suffix(start));
            if (suffixBag != null) {
                bag.copyPropertiesFrom(suffixBag);
                break;
            }
        }
        entries.put(key, bag);
        return bag;
    }

    /**
     * Records that every term ending with {@code key} has the property {@code property}, as implied by rule
     * {@code ruleID}. A concrete type, superclass or layout that disagrees with the one already recorded marks the
     * rule conflicting. Concrete conformance symbols are not properties of the bag.
     */
    public void addProperty(Term key, Symbol property, int ruleID) {
        switch (property.kind()) {
            case PROTOCOL:
                getOrCreateProperties(key).addConformance(property.protocol(), ruleID);
                return;
            case LAYOUT: {
                PropertyBag bag = getOrCreateProperties(key);
                if (!bag.layout().isPresent()) bag.setLayout(property.layout(), ruleID);
                else if (bag.layout().get() != property.layout()) markConflicting(key, ruleID, property);
                return;
            }
            case SUPERCLASS: {
                PropertyBag bag = getOrCreateProperties(key);
                if (!bag.hasSuperclassBound()) bag.setSuperclass(property, ruleID);
                else if (!bag.superclassSymbol().equals(property)) markConflicting(key, ruleID, property);
                return;
            }
            case CONCRETE_TYPE: {
                PropertyBag bag = getOrCreateProperties(key);
                if (!bag.isConcreteType()) bag.setConcreteType(property, ruleID);
                else if (!bag.concreteTypeSymbol().equals(property)) markConflicting(key, ruleID, property);
                return;
            }
            case CONCRETE_CONFORMANCE:
                return;
            case ASSOCIATED_TYPE:
            case GENERIC_PARAM:
                throw ReqMachineException.of(NOT_A_PROPERTY_SYMBOL, property);
            default:
                throw ReqMachineException.of(ILLEGAL_STATE);
        }
    }

    private void markConflicting(Term key, int ruleID, Symbol property) {
        Rule rule = system.getRule(ruleID);
        if (rule.rhs().size() == key.size()) rule.markConflicting();
        if (options.debug(PROPERTY_MAP)) LOG.debug("Property {} on {} conflicts with rule {}", property, key, rule);
    }

    /**
     * Rebuilds every bag from the property rules of the rewrite system, shortest keys first, and then derives the
     * nested types of keys with a concrete type or superclass.
     */
    public void buildPropertyMap() {
        entries.clear();
        concreteConformances.clear();
        errors.clear();

        List<Rule> propertyRules = new ArrayList<>();
        for (Rule rule : system.rules()) {
            if (rule.isPropertyRule().isPresent()) propertyRules.add(rule);
        }
        propertyRules.sort(Comparator.<Rule>comparingInt(rule -> rule.rhs().size()).thenComparingInt(Rule::id));
        for (Rule rule : propertyRules) {
            addProperty(rule.rhs(), rule.isPropertyRule().get(), rule.id());
        }
        if (options.debug(PROPERTY_MAP)) LOG.debug("Built property map:\n{}", this);

        concretizeNestedTypesFromConcreteParents();
    }

    /**
     * For every bag that has protocol conformances together with a concrete type or a superclass, resolves the
     * concrete conformances and adds rules for the nested types of the key.
     */
    public void concretizeNestedTypesFromConcreteParents() {
        concretizer.concretizeNestedTypesFromConcreteParents();
    }

    Optional<ProtocolConformance> cachedConformance(int concreteRuleID, int conformanceRuleID) {
        return Optional.ofNullable(concreteConformances.get(Pair.of(concreteRuleID, conformanceRuleID)));
    }

    void recordConcreteConformance(int concreteRuleID, int conformanceRuleID, ProtocolConformance conformance) {
        Pair<Integer, Integer> pair = Pair.of(concreteRuleID, conformanceRuleID);
        if (concreteConformances.containsKey(pair)) {
            throw ReqMachineException.of(DUPLICATE_CONCRETE_CONFORMANCE, concreteRuleID, conformanceRuleID);
        }
        concreteConformances.put(pair, conformance);
    }

    /**
     * Concrete conformances resolved in this pass, keyed by the pair (concrete type or superclass rule, conformance
     * rule).
     */
    public Map<Pair<Integer, Integer>, ProtocolConformance> concreteConformances() {
        return unmodifiableMap(concreteConformances);
    }

    /**
     * Conditional requirements that could never hold, found in this pass.
     */
    public List<RequirementError> errors() {
        return unmodifiableList(errors);
    }

    void addError(RequirementError error) {
        errors.add(error);
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        builder.append("Property map: {\n");
        for (PropertyBag bag : entries.values()) builder.append("  ").append(bag).append("\n");
        builder.append("}");
        return builder.toString();
    }
}
