/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.reqmachine.rewriting;

import com.vaticle.reqmachine.ast.GenericParamType;
import com.vaticle.reqmachine.ast.ProtocolDecl;
import com.vaticle.reqmachine.ast.Type;
import com.vaticle.reqmachine.common.collection.Pair;
import com.vaticle.reqmachine.common.exception.ReqMachineException;
import com.vaticle.reqmachine.common.parameters.Options;
import com.vaticle.reqmachine.rewriting.property.PropertyBag;
import com.vaticle.reqmachine.rewriting.property.PropertyMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.vaticle.reqmachine.common.exception.ErrorMessage.Rewriting.UNEXPECTED_SYMBOL_KIND;
import static com.vaticle.reqmachine.common.exception.ErrorMessage.Rewriting.UNKNOWN_RELATION;
import static com.vaticle.reqmachine.common.exception.ErrorMessage.Rewriting.UNKNOWN_RULE;
import static com.vaticle.reqmachine.common.exception.ErrorMessage.Rewriting.UNKNOWN_TYPE_DIFFERENCE;
import static com.vaticle.reqmachine.common.parameters.DebugFlags.ADD;
import static com.vaticle.reqmachine.common.parameters.DebugFlags.SIMPLIFY;
import static java.util.Collections.unmodifiableList;

/**
 * An in-memory rule table. Rules are oriented by the shortlex order on terms and deduplicated, but the system is
 * never completed: left and right hand sides are stored as given.
 */
public class BasicRewriteSystem implements RewriteSystem {

    private static final Logger LOG = LoggerFactory.getLogger(BasicRewriteSystem.class);

    private final Options options;
    private final List<Rule> rules;
    private final Map<Pair<Term, Term>, Integer> ruleIndex;
    private final List<Relation> relations;
    private final Map<Pair<Term, Term>, Integer> relationIndex;
    private final List<TypeDifference> differences;
    private final ProtocolMap protocols;

    public BasicRewriteSystem(Options options) {
        this.options = options;
        this.rules = new ArrayList<>();
        this.ruleIndex = new HashMap<>();
        this.relations = new ArrayList<>();
        this.relationIndex = new HashMap<>();
        this.differences = new ArrayList<>();
        this.protocols = new ProtocolMap();
    }

    @Override
    public Rule getRule(int ruleID) {
        if (ruleID < 0 || ruleID >= rules.size()) throw ReqMachineException.of(UNKNOWN_RULE, ruleID);
        return rules.get(ruleID);
    }

    @Override
    public List<Rule> rules() {
        return unmodifiableList(rules);
    }

    @Override
    public boolean addRule(MutableTerm lhs, MutableTerm rhs, @Nullable RewritePath path) {
        return insert(lhs.toTerm(), rhs.toTerm(), path, false, false);
    }

    @Override
    public void addPermanentRule(MutableTerm lhs, MutableTerm rhs) {
        insert(lhs.toTerm(), rhs.toTerm(), null, true, false);
    }

    @Override
    public void addExplicitRule(MutableTerm lhs, MutableTerm rhs) {
        insert(lhs.toTerm(), rhs.toTerm(), null, false, true);
    }

    private boolean insert(Term lhs, Term rhs, @Nullable RewritePath path, boolean permanent, boolean explicit) {
        int order = lhs.compareTo(rhs);
        if (order == 0) return false;

        RewritePath ownPath = null;
        if (path != null) ownPath = new RewritePath().append(path);
        if (order < 0) {
            Term swap = lhs;
            lhs = rhs;
            rhs = swap;
            if (ownPath != null) ownPath.invert();
        }

        Pair<Term, Term> key = Pair.of(lhs, rhs);
        if (ruleIndex.containsKey(key)) return false;

        Rule rule = new Rule(rules.size(), lhs, rhs, ownPath, permanent, explicit);
        rules.add(rule);
        ruleIndex.put(key, rule.id());
        if (options.debug(ADD)) LOG.debug("Adding rule #{}: {} via {}", rule.id(), rule, ownPath);
        return true;
    }

    @Override
    public int recordRelation(Term lhs, Term rhs) {
        Pair<Term, Term> key = Pair.of(lhs, rhs);
        Integer existing = relationIndex.get(key);
        if (existing != null) return existing;

        Relation relation = new Relation(relations.size(), lhs, rhs);
        relations.add(relation);
        relationIndex.put(key, relation.id());
        if (options.debug(ADD)) LOG.debug("Recording relation #{}: {}", relation.id(), relation);
        return relation.id();
    }

    @Override
    public Relation getRelation(int relationID) {
        if (relationID < 0 || relationID >= relations.size()) throw ReqMachineException.of(UNKNOWN_RELATION, relationID);
        return relations.get(relationID);
    }

    @Override
    public List<Relation> relations() {
        return unmodifiableList(relations);
    }

    @Override
    public int recordConcreteConformanceRelation(Symbol concreteSymbol, Symbol protocolSymbol,
                                                 Symbol concreteConformanceSymbol) {
        return recordRelation(Term.of(concreteSymbol, protocolSymbol), Term.of(concreteConformanceSymbol));
    }

    @Override
    public int recordConcreteTypeWitnessRelation(Symbol concreteConformanceSymbol, Symbol associatedTypeSymbol,
                                                 Symbol typeWitnessSymbol) {
        return recordRelation(Term.of(concreteConformanceSymbol, associatedTypeSymbol, typeWitnessSymbol),
                              Term.of(concreteConformanceSymbol, associatedTypeSymbol));
    }

    @Override
    public int recordSameTypeWitnessRelation(Symbol concreteConformanceSymbol, Symbol associatedTypeSymbol) {
        Symbol concreteSymbol = Symbol.forConcreteType(concreteConformanceSymbol.concreteType(),
                                                       concreteConformanceSymbol.substitutions());
        return recordRelation(Term.of(concreteConformanceSymbol, associatedTypeSymbol, concreteSymbol),
                              Term.of(concreteConformanceSymbol));
    }

    @Override
    public boolean simplify(MutableTerm term, @Nullable RewritePath path) {
        boolean changed = false;
        boolean applied;
        do {
            applied = false;
            for (int offset = 0; offset < term.size() && !applied; offset++) {
                for (Rule rule : rules) {
                    if (!term.matchesAt(offset, rule.lhs())) continue;
                    int endOffset = term.size() - offset - rule.lhs().size();
                    term.replace(offset, rule.lhs().size(), rule.rhs());
                    if (path != null) path.add(RewriteStep.forRewriteRule(offset, endOffset, rule.id(), false));
                    applied = true;
                    changed = true;
                    break;
                }
            }
        } while (applied);
        return changed;
    }

    @Override
    public Optional<Integer> simplifySubstitutions(Term base, Symbol symbol, int startOffset,
                                                   @Nullable PropertyMap map, RewritePath path) {
        if (!symbol.hasSubstitutions()) throw ReqMachineException.of(UNEXPECTED_SYMBOL_KIND, symbol.kind(), symbol);
        if (symbol.substitutions().isEmpty()) return Optional.empty();

        List<Term> simplified = new ArrayList<>();
        for (Term substitution : symbol.substitutions()) {
            MutableTerm term = new MutableTerm(substitution);
            simplify(term, null);
            simplified.add(term.toTerm());
        }

        Type schema = symbol.concreteType();
        List<Term> remaining = simplified;
        if (map != null) {
            Map<Integer, Type> folded = new HashMap<>();
            Map<Integer, Integer> renumbered = new HashMap<>();
            remaining = new ArrayList<>();
            for (int i = 0; i < simplified.size(); i++) {
                Optional<PropertyBag> bag = map.lookUpProperties(simplified.get(i));
                if (bag.isPresent() && bag.get().isConcreteType() &&
                        bag.get().concreteTypeSymbol().substitutions().isEmpty()) {
                    folded.put(i, bag.get().concreteType());
                } else {
                    renumbered.put(i, remaining.size());
                    remaining.add(simplified.get(i));
                }
            }
            if (!folded.isEmpty()) {
                schema = schema.transformTypeParameters(param -> {
                    int index = param.asGenericParam().index();
                    if (folded.containsKey(index)) return folded.get(index);
                    else return GenericParamType.of(0, renumbered.get(index));
                });
            }
        }

        Symbol result = symbol.withConcreteSubstitutions(schema, remaining);
        if (result.equals(symbol)) return Optional.empty();

        TypeDifference difference = new TypeDifference(differences.size(), base, symbol, result);
        differences.add(difference);
        int relationID = recordRelation(Term.of(symbol), Term.of(result));
        path.add(RewriteStep.forRelation(startOffset, relationID, false));
        if (options.debug(SIMPLIFY)) LOG.debug("Simplified substitutions of {} to {} in context {}", symbol, result, base);
        return Optional.of(difference.id());
    }

    @Override
    public TypeDifference getTypeDifference(int differenceID) {
        if (differenceID < 0 || differenceID >= differences.size()) {
            throw ReqMachineException.of(UNKNOWN_TYPE_DIFFERENCE, differenceID);
        }
        return differences.get(differenceID);
    }

    @Override
    public boolean isKnownProtocol(ProtocolDecl protocol) {
        return protocols.contains(protocol);
    }

    @Override
    public ProtocolMap protocols() {
        return protocols;
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        builder.append("Rewrite system: {\n");
        for (Rule rule : rules) builder.append("- ").append(rule).append("\n");
        builder.append("}");
        return builder.toString();
    }
}
