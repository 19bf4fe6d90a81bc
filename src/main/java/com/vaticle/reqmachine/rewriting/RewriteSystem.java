/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.reqmachine.rewriting;

import com.vaticle.reqmachine.ast.ProtocolDecl;
import com.vaticle.reqmachine.rewriting.property.PropertyMap;

import javax.annotation.Nullable;
import java.util.List;
import java.util.Optional;

/**
 * The rule table that nested type concretization reads from and writes to. Rule, relation and type difference IDs
 * are allocated in the order the corresponding operations are issued.
 */
public interface RewriteSystem {

    Rule getRule(int ruleID);

    List<Rule> rules();

    /**
     * Adds the rule {@code lhs => rhs}, orienting it so that the greater term is on the left. The path, if given,
     * must transform {@code lhs} into {@code rhs}; it is inverted when the rule is flipped.
     *
     * @return true if a new rule was inserted
     */
    boolean addRule(MutableTerm lhs, MutableTerm rhs, @Nullable RewritePath path);

    void addPermanentRule(MutableTerm lhs, MutableTerm rhs);

    void addExplicitRule(MutableTerm lhs, MutableTerm rhs);

    int recordRelation(Term lhs, Term rhs);

    Relation getRelation(int relationID);

    List<Relation> relations();

    /**
     * Records {@code [concrete: C].[P] =>> [concrete: C : P]}.
     */
    int recordConcreteConformanceRelation(Symbol concreteSymbol, Symbol protocolSymbol,
                                          Symbol concreteConformanceSymbol);

    /**
     * Records {@code [concrete: C : P].[P:A].[concrete: W] =>> [concrete: C : P].[P:A]}.
     */
    int recordConcreteTypeWitnessRelation(Symbol concreteConformanceSymbol, Symbol associatedTypeSymbol,
                                          Symbol typeWitnessSymbol);

    /**
     * Records {@code [concrete: C : P].[P:A].[concrete: C] =>> [concrete: C : P]}.
     */
    int recordSameTypeWitnessRelation(Symbol concreteConformanceSymbol, Symbol associatedTypeSymbol);

    /**
     * Rewrites {@code term} to its normal form with respect to the current rules.
     *
     * @return true if the term changed
     */
    boolean simplify(MutableTerm term, @Nullable RewritePath path);

    /**
     * Simplifies the substitution terms of a superclass, concrete type or concrete conformance symbol appearing at
     * {@code startOffset} in a term whose prefix is {@code base}. With a property map, substitutions that are known
     * to be fixed to a concrete type without substitutions of their own are folded into the type schema.
     *
     * @return the ID of the recorded {@link TypeDifference}, if the symbol changed
     */
    Optional<Integer> simplifySubstitutions(Term base, Symbol symbol, int startOffset, @Nullable PropertyMap map,
                                            RewritePath path);

    TypeDifference getTypeDifference(int differenceID);

    boolean isKnownProtocol(ProtocolDecl protocol);

    ProtocolMap protocols();
}
