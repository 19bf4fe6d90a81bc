/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.reqmachine.rewriting;

import com.vaticle.reqmachine.ast.AssociatedTypeDecl;
import com.vaticle.reqmachine.ast.GenericParamType;
import com.vaticle.reqmachine.ast.NominalDecl;
import com.vaticle.reqmachine.ast.NominalType;
import com.vaticle.reqmachine.ast.ProtocolDecl;
import com.vaticle.reqmachine.ast.Requirement;
import com.vaticle.reqmachine.common.collection.Pair;
import com.vaticle.reqmachine.common.parameters.Options;
import com.vaticle.reqmachine.conformance.ConformanceTable;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class RuleBuilderTest {

    private static final GenericParamType T0 = GenericParamType.of(0, 0);

    private static Term term(MutableTerm term) {
        return term.toTerm();
    }

    @Test
    public void test_referenced_protocols_are_collected_transitively() {
        ProtocolDecl r = ProtocolDecl.of("R");
        ProtocolDecl q = ProtocolDecl.of("Q");
        AssociatedTypeDecl element = q.addAssociatedType("Element");
        q.addRequirement(Requirement.conformance(element.selfMemberType(), r));
        ProtocolDecl p = ProtocolDecl.of("P");
        p.addInherited(q);

        ProtocolMap protocols = new ProtocolMap();
        RuleBuilder builder = new RuleBuilder(new RewriteContext(new ConformanceTable()), protocols);
        builder.addRequirements(List.of(Requirement.conformance(T0, p)));
        builder.collectRulesFromReferencedProtocols();

        assertEquals(List.of(p, q, r), List.copyOf(protocols.all()));
        // [P].[P], [Q].[Q], [Q].[Q:Element], [R].[R]
        assertEquals(4, builder.permanentRules().size());
        // τ_0_0.[P], [P].[Q], [Q:Element].[R]
        assertEquals(3, builder.requirementRules().size());

        Symbol elementSymbol = Symbol.forAssociatedType(element);
        Pair<MutableTerm, MutableTerm> memberRule = builder.requirementRules().get(2);
        assertEquals(Term.of(elementSymbol, Symbol.forProtocol(r)), term(memberRule.first()));
        assertEquals(Term.of(elementSymbol), term(memberRule.second()));
    }

    @Test
    public void test_known_protocols_are_skipped() {
        ProtocolDecl p = ProtocolDecl.of("P");
        ProtocolMap protocols = new ProtocolMap();
        protocols.add(p, true);

        RuleBuilder builder = new RuleBuilder(new RewriteContext(new ConformanceTable()), protocols);
        builder.addProtocol(p, false);
        builder.collectRulesFromReferencedProtocols();

        assertTrue(builder.permanentRules().isEmpty());
        assertTrue(protocols.isInitialComponent(p));
    }

    @Test
    public void test_rules_are_added_permanent_first() {
        ProtocolDecl p = ProtocolDecl.of("P");
        p.addAssociatedType("A");
        NominalDecl box = NominalDecl.struct("Box", 1);
        Options options = new Options();
        BasicRewriteSystem system = new BasicRewriteSystem(options);

        RuleBuilder builder = new RuleBuilder(new RewriteContext(new ConformanceTable()), system.protocols());
        builder.addRequirements(List.of(Requirement.conformance(T0, p),
                                        Requirement.sameType(T0, NominalType.of(box, GenericParamType.of(0, 1)))));
        builder.collectRulesFromReferencedProtocols();
        builder.addTo(system);

        assertTrue(system.isKnownProtocol(p));
        assertEquals(4, system.rules().size());
        assertTrue(system.getRule(0).isPermanent());
        assertTrue(system.getRule(1).isPermanent());
        assertTrue(system.getRule(2).isExplicit());
        assertFalse(system.getRule(3).isPermanent());

        Symbol concrete = system.getRule(3).isPropertyRule().get();
        assertEquals(Symbol.Kind.CONCRETE_TYPE, concrete.kind());
        assertEquals(NominalType.of(box, T0), concrete.concreteType());
        assertEquals(List.of(Term.of(Symbol.forGenericParam(GenericParamType.of(0, 1)))), concrete.substitutions());
    }
}
