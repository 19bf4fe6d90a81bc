/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.reqmachine.rewriting.property;

import com.vaticle.reqmachine.ast.RequirementKind;
import com.vaticle.reqmachine.ast.Type;
import com.vaticle.reqmachine.common.parameters.Options;
import com.vaticle.reqmachine.rewriting.MutableTerm;
import com.vaticle.reqmachine.rewriting.RewriteContext;
import com.vaticle.reqmachine.rewriting.RewritePath;
import com.vaticle.reqmachine.rewriting.RewriteStep;
import com.vaticle.reqmachine.rewriting.RewriteSystem;
import com.vaticle.reqmachine.rewriting.Symbol;
import com.vaticle.reqmachine.rewriting.Term;
import com.vaticle.reqmachine.rewriting.TypeDifference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.vaticle.reqmachine.common.parameters.DebugFlags.CONCRETIZE_NESTED_TYPES;

/**
 * Relates the projection {@code T.[concrete: C : P].[P:X]} of an associated type to the term representing its type
 * witness.
 */
class TypeWitnessConstraint {

    private static final Logger LOG = LoggerFactory.getLogger(TypeWitnessConstraint.class);

    private final PropertyMap map;
    private final RewriteSystem system;
    private final RewriteContext context;
    private final Options options;

    TypeWitnessConstraint(PropertyMap map) {
        this.map = map;
        this.system = map.system();
        this.context = map.context();
        this.options = map.options();
    }

    /**
     * Returns the term that {@code subjectType} must be equal to, and adds to {@code path} the steps that transform
     * that term into {@code subjectType}.
     * <ul>
     *     <li>An abstract witness {@code τ_0_n.X} gives {@code S[n].X}, where {@code S[n]} is the {@code n}th
     *     substitution;</li>
     *     <li>a fully concrete witness already bound on a prefix {@code U} of the key gives
     *     {@code U.[concrete: W]};</li>
     *     <li>a witness equal to the parent's concrete type gives {@code T.[concrete: C : P]};</li>
     *     <li>any other witness gives {@code T.[concrete: C : P].[P:X].[concrete: W]}.</li>
     * </ul>
     */
    MutableTerm computeConstraintTermForTypeWitness(Term key, RequirementKind requirementKind, Type concreteType,
                                                    Type typeWitness, MutableTerm subjectType,
                                                    List<Term> substitutions, RewritePath path) {
        if (typeWitness.isTypeParameter()) {
            MutableTerm result = context.getRelativeTermForType(typeWitness, substitutions);
            int relationID = system.recordRelation(result.toTerm(), subjectType.toTerm());
            path.add(RewriteStep.forRelation(0, relationID, false));
            return result;
        }

        List<Term> result = new ArrayList<>();
        Type typeWitnessSchema = context.getRelativeSubstitutionSchemaFromType(typeWitness, substitutions, result);
        Symbol typeWitnessSymbol = Symbol.forConcreteType(typeWitnessSchema, result);

        if (!typeWitness.hasTypeParameter() && options.reuseConcreteParents()) {
            Optional<MutableTerm> parent = tieOffToConcreteParent(key, typeWitness, typeWitnessSymbol, subjectType, path);
            if (parent.isPresent()) return parent.get();
        }

        Symbol concreteConformanceSymbol = subjectType.get(subjectType.size() - 2);
        Symbol associatedTypeSymbol = subjectType.get(subjectType.size() - 1);

        // recorded before simplification, relates the unsimplified witness to the projection
        int concreteRelationID = system.recordConcreteTypeWitnessRelation(
                concreteConformanceSymbol, associatedTypeSymbol, typeWitnessSymbol
        );

        RewritePath substPath = new RewritePath();
        Optional<Integer> differenceID = system.simplifySubstitutions(
                key, typeWitnessSymbol, subjectType.size(), map, substPath
        );
        if (differenceID.isPresent()) {
            TypeDifference difference = system.getTypeDifference(differenceID.get());
            assert difference.lhs().equals(typeWitnessSymbol);
            typeWitnessSymbol = difference.rhs();
            substPath.invert();
        }

        if (requirementKind == RequirementKind.SAME_TYPE &&
                typeWitnessSymbol.concreteType().equals(concreteType) &&
                typeWitnessSymbol.substitutions().equals(substitutions)) {
            if (options.debug(CONCRETIZE_NESTED_TYPES)) LOG.debug("^^ Type witness is the same as the concrete type");

            // T.[concrete: C : P]
            MutableTerm sameType = new MutableTerm(key);
            sameType.add(concreteConformanceSymbol);

            int sameRelationID = system.recordSameTypeWitnessRelation(concreteConformanceSymbol, associatedTypeSymbol);
            // [concrete: C : P] => [concrete: C : P].[P:X].[concrete: C]
            path.add(RewriteStep.forRelation(key.size(), sameRelationID, true));
            // [concrete: C] => [concrete: C.X]
            path.append(substPath);
            // [concrete: C : P].[P:X].[concrete: C.X] => [concrete: C : P].[P:X]
            path.add(RewriteStep.forRelation(key.size(), concreteRelationID, false));
            return sameType;
        }

        // T.[concrete: C : P].[P:X].[concrete: C.X']
        MutableTerm constraintType = new MutableTerm(subjectType);
        constraintType.add(typeWitnessSymbol);
        path.append(substPath);
        path.add(RewriteStep.forRelation(key.size(), concreteRelationID, false));
        return constraintType;
    }

    /**
     * Scans the prefixes of {@code key}, longest first, for one whose bag is bound to exactly {@code typeWitness}.
     * Reusing that bag's key stops recursive conformances from introducing a new concrete type requirement at every
     * level of nesting.
     */
    private Optional<MutableTerm> tieOffToConcreteParent(Term key, Type typeWitness, Symbol typeWitnessSymbol,
                                                         MutableTerm subjectType, RewritePath path) {
        for (int length = key.size(); length > 0; length--) {
            Optional<PropertyBag> bag = map.lookUpProperties(key.prefix(length));
            if (bag.isPresent() && bag.get().isConcreteType() && bag.get().concreteType().equals(typeWitness)) {
                // U.[concrete: C.X] =>> T.[concrete: C : P].[P:X]
                MutableTerm result = new MutableTerm(bag.get().key());
                result.add(typeWitnessSymbol);
                int relationID = system.recordRelation(result.toTerm(), subjectType.toTerm());
                path.add(RewriteStep.forRelation(0, relationID, false));
                if (options.debug(CONCRETIZE_NESTED_TYPES)) {
                    LOG.debug("^^ Type witness can re-use property bag of {}", result);
                }
                return Optional.of(result);
            }
        }
        return Optional.empty();
    }
}
