/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.reqmachine.rewriting;

import com.vaticle.reqmachine.ast.AssociatedTypeDecl;
import com.vaticle.reqmachine.ast.ProtocolDecl;
import com.vaticle.reqmachine.ast.Requirement;
import com.vaticle.reqmachine.ast.RequirementKind;
import com.vaticle.reqmachine.common.collection.Pair;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static java.util.Collections.unmodifiableList;

/**
 * Collects the rules for a generic signature and for every protocol it references, directly or through other
 * protocols. Protocols already registered in the {@link ProtocolMap} are skipped, so a builder can be used to
 * extend an existing rewrite system with the rules of newly discovered protocols.
 */
public class RuleBuilder {

    private final RequirementLowering lowering;
    private final ProtocolMap protocols;
    private final Deque<Pair<ProtocolDecl, Boolean>> worklist;
    private final Set<ProtocolDecl> queued;
    private final List<Pair<MutableTerm, MutableTerm>> permanentRules;
    private final List<Pair<MutableTerm, MutableTerm>> requirementRules;

    public RuleBuilder(RewriteContext context, ProtocolMap protocols) {
        this.lowering = new RequirementLowering(context);
        this.protocols = protocols;
        this.worklist = new ArrayDeque<>();
        this.queued = new HashSet<>();
        this.permanentRules = new ArrayList<>();
        this.requirementRules = new ArrayList<>();
    }

    public void addProtocol(ProtocolDecl protocol, boolean initialComponent) {
        if (protocols.contains(protocol) || !queued.add(protocol)) return;
        worklist.addLast(Pair.of(protocol, initialComponent));
    }

    /**
     * Adds the rules for the requirements of a top-level generic signature, and queues the protocols they name.
     */
    public void addRequirements(List<Requirement> requirements) {
        for (Requirement req : requirements) {
            if (req.kind() == RequirementKind.CONFORMANCE) addProtocol(req.protocol(), false);
            requirementRules.add(lowering.getRuleForRequirement(req, null, null));
        }
    }

    public void collectRulesFromReferencedProtocols() {
        while (!worklist.isEmpty()) {
            Pair<ProtocolDecl, Boolean> next = worklist.removeFirst();
            ProtocolDecl protocol = next.first();
            protocols.add(protocol, next.second());
            addPermanentProtocolRules(protocol);
            for (Requirement req : protocol.requirementSignature()) {
                if (req.kind() == RequirementKind.CONFORMANCE) addProtocol(req.protocol(), false);
                requirementRules.add(lowering.getRuleForRequirement(req, protocol, null));
            }
        }
    }

    private void addPermanentProtocolRules(ProtocolDecl protocol) {
        Symbol protocolSymbol = Symbol.forProtocol(protocol);
        // [P].[P] => [P]
        permanentRules.add(Pair.of(new MutableTerm().add(protocolSymbol).add(protocolSymbol),
                                   new MutableTerm().add(protocolSymbol)));
        // [P].[P:A] => [P:A]
        for (AssociatedTypeDecl assocType : protocol.associatedTypes()) {
            Symbol assocSymbol = Symbol.forAssociatedType(assocType);
            permanentRules.add(Pair.of(new MutableTerm().add(protocolSymbol).add(assocSymbol),
                                       new MutableTerm().add(assocSymbol)));
        }
    }

    public List<Pair<MutableTerm, MutableTerm>> permanentRules() {
        return unmodifiableList(permanentRules);
    }

    public List<Pair<MutableTerm, MutableTerm>> requirementRules() {
        return unmodifiableList(requirementRules);
    }

    /**
     * Adds the collected rules to {@code system}: permanent rules first, then requirement rules as explicit rules.
     */
    public void addTo(RewriteSystem system) {
        for (Pair<MutableTerm, MutableTerm> rule : permanentRules) system.addPermanentRule(rule.first(), rule.second());
        for (Pair<MutableTerm, MutableTerm> rule : requirementRules) system.addExplicitRule(rule.first(), rule.second());
    }
}
