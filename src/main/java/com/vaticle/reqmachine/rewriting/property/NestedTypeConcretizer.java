/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.reqmachine.rewriting.property;

import com.vaticle.reqmachine.ast.AssociatedTypeDecl;
import com.vaticle.reqmachine.ast.ErrorType;
import com.vaticle.reqmachine.ast.ProtocolDecl;
import com.vaticle.reqmachine.ast.RequirementKind;
import com.vaticle.reqmachine.ast.Type;
import com.vaticle.reqmachine.common.exception.ReqMachineException;
import com.vaticle.reqmachine.common.parameters.Options;
import com.vaticle.reqmachine.conformance.ProtocolConformance;
import com.vaticle.reqmachine.conformance.ProtocolConformanceRef;
import com.vaticle.reqmachine.rewriting.MutableTerm;
import com.vaticle.reqmachine.rewriting.RewritePath;
import com.vaticle.reqmachine.rewriting.RewriteSystem;
import com.vaticle.reqmachine.rewriting.Rule;
import com.vaticle.reqmachine.rewriting.Symbol;
import com.vaticle.reqmachine.rewriting.Term;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

import static com.vaticle.reqmachine.common.exception.ErrorMessage.Internal.ABSTRACT_CONFORMANCE;
import static com.vaticle.reqmachine.common.exception.ErrorMessage.Internal.EMPTY_REWRITE_PATH;
import static com.vaticle.reqmachine.common.parameters.DebugFlags.CONCRETIZE_NESTED_TYPES;

/**
 * Introduces concrete type requirements on the nested types of type parameters that are subject to both a protocol
 * conformance and a concrete type (or superclass) requirement.
 * <p>
 * Suppose {@code protocol P { associatedtype A; associatedtype B }} and {@code struct Foo<X, Y: Q>: P} with the
 * witnesses {@code A == X} and {@code B == Y.V}, and the bag
 * <pre>
 *     T => { conforms_to: [P], concrete_type: [concrete: Foo&lt;Int, τ_0_0&gt; with &lt;U&gt;] }
 * </pre>
 * The witness for {@code A} is {@code Int}, which gives {@code T.[concrete: Foo<Int, τ_0_0> with <U> : P].[P:A]}
 * the concrete type {@code Int}; the witness for {@code B} is {@code τ_0_0.V}, which makes the same projection of
 * {@code B} equal to {@code U.[Q:V]}.
 */
class NestedTypeConcretizer {

    private static final Logger LOG = LoggerFactory.getLogger(NestedTypeConcretizer.class);

    private final PropertyMap map;
    private final RewriteSystem system;
    private final Options options;
    private final TypeWitnessConstraint constraints;
    private final ConcreteConformanceRule conformanceRules;
    private final ConditionalRequirementInference conditionalRequirements;

    NestedTypeConcretizer(PropertyMap map) {
        this.map = map;
        this.system = map.system();
        this.options = map.options();
        this.constraints = new TypeWitnessConstraint(map);
        this.conformanceRules = new ConcreteConformanceRule(map.system());
        this.conditionalRequirements = new ConditionalRequirementInference(map);
    }

    void concretizeNestedTypesFromConcreteParents() {
        for (PropertyBag bag : map.entries()) {
            if (bag.conformsTo().isEmpty()) continue;

            if (options.debug(CONCRETIZE_NESTED_TYPES) && (bag.isConcreteType() || bag.hasSuperclassBound())) {
                LOG.debug("^ Concretizing nested types of {}", bag);
            }

            if (bag.isConcreteType()) {
                if (options.debug(CONCRETIZE_NESTED_TYPES)) LOG.debug("- via concrete type requirement");
                concretizeNestedTypesFromConcreteParent(bag, RequirementKind.SAME_TYPE, bag.concreteTypeRule(),
                                                        bag.concreteTypeSymbol());
            }

            if (bag.hasSuperclassBound()) {
                if (options.debug(CONCRETIZE_NESTED_TYPES)) LOG.debug("- via superclass requirement");
                concretizeNestedTypesFromConcreteParent(bag, RequirementKind.SUPERCLASS, bag.superclassRule(),
                                                        bag.superclassSymbol());
            }
        }
    }

    private void concretizeNestedTypesFromConcreteParent(PropertyBag bag, RequirementKind requirementKind,
                                                         int concreteRuleID, Symbol concreteSymbol) {
        assert requirementKind == RequirementKind.SAME_TYPE || requirementKind == RequirementKind.SUPERCLASS;
        Term key = bag.key();
        Type concreteType = concreteSymbol.concreteType();
        List<Term> substitutions = concreteSymbol.substitutions();
        boolean fromSuperclass = requirementKind == RequirementKind.SUPERCLASS;
        List<ProtocolDecl> conformsTo = bag.conformsTo();
        List<Integer> conformsToRules = bag.conformsToRules();

        for (int i = 0; i < conformsTo.size(); i++) {
            ProtocolDecl protocol = conformsTo.get(i);
            int conformanceRuleID = conformsToRules.get(i);

            // the pair was inherited from the bag of a suffix of the key
            Optional<ProtocolConformance> cached = map.cachedConformance(concreteRuleID, conformanceRuleID);
            if (cached.isPresent()) {
                bag.recordConformance(cached.get(), fromSuperclass);
                continue;
            }

            ProtocolConformanceRef conformance = map.context().conformances().lookupConformance(concreteType, protocol);
            if (conformance.isInvalid()) {
                // a superclass need not conform to the protocols of its subclass bound
                if (requirementKind == RequirementKind.SAME_TYPE) {
                    Rule concreteRule = system.getRule(concreteRuleID);
                    if (concreteRule.rhs().size() == key.size()) concreteRule.markConflicting();
                    Rule conformanceRule = system.getRule(conformanceRuleID);
                    if (conformanceRule.rhs().size() == key.size()) conformanceRule.markConflicting();
                }
                if (options.debug(CONCRETIZE_NESTED_TYPES)) {
                    LOG.debug("^^ {} does not conform to {}", concreteType, protocol.name());
                }
                continue;
            }
            if (conformance.isAbstract()) throw ReqMachineException.of(ABSTRACT_CONFORMANCE, concreteType, protocol);

            ProtocolConformance concrete = conformance.getConcrete();
            map.recordConcreteConformance(concreteRuleID, conformanceRuleID, concrete);
            bag.recordConformance(concrete, fromSuperclass);

            Symbol concreteConformanceSymbol = Symbol.forConcreteConformance(concreteType, substitutions, protocol);
            conformanceRules.recordConcreteConformanceRule(concreteRuleID, conformanceRuleID, concreteConformanceSymbol);

            for (AssociatedTypeDecl assocType : protocol.associatedTypes()) {
                concretizeTypeWitnessInConformance(key, requirementKind, concreteConformanceSymbol, concrete, assocType);
            }

            // only top-level generic signatures get conditional requirements, not requirement signatures
            if (!key.rootProtocol().isPresent()) {
                conditionalRequirements.inferConditionalRequirements(concrete, substitutions);
            }
        }
    }

    private void concretizeTypeWitnessInConformance(Term key, RequirementKind requirementKind,
                                                    Symbol concreteConformanceSymbol, ProtocolConformance concrete,
                                                    AssociatedTypeDecl assocType) {
        Type concreteType = concreteConformanceSymbol.concreteType();
        List<Term> substitutions = concreteConformanceSymbol.substitutions();
        ProtocolDecl protocol = concreteConformanceSymbol.protocol();

        if (options.debug(CONCRETIZE_NESTED_TYPES)) {
            LOG.debug("^^ Looking up type witness for {}:{} on {}", protocol.name(), assocType.name(), concreteType);
        }

        Type typeWitness = concrete.getTypeWitness(assocType);
        if (typeWitness == null) {
            if (options.debug(CONCRETIZE_NESTED_TYPES)) {
                LOG.debug("^^ Type witness for {} of {} could not be inferred", assocType.name(), concreteType);
            }
            typeWitness = ErrorType.of(concreteType);
        }

        if (options.debug(CONCRETIZE_NESTED_TYPES)) {
            LOG.debug("^^ Type witness for {} of {} is {}", assocType.name(), concreteType, typeWitness);
        }

        // T.[concrete: C : P].[P:X]
        MutableTerm subjectType = new MutableTerm(key);
        subjectType.add(concreteConformanceSymbol);
        subjectType.add(Symbol.forAssociatedType(protocol, assocType.name()));

        RewritePath path = new RewritePath();
        MutableTerm constraintType = constraints.computeConstraintTermForTypeWitness(
                key, requirementKind, concreteType, typeWitness, subjectType, substitutions, path
        );
        if (path.isEmpty()) throw ReqMachineException.of(EMPTY_REWRITE_PATH, constraintType, subjectType);

        system.addRule(constraintType, subjectType, path);
        if (options.debug(CONCRETIZE_NESTED_TYPES)) {
            LOG.debug("^^ Induced rule {} => {}", constraintType, subjectType);
        }
    }
}
