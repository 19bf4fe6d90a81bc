/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.reqmachine.rewriting;

import com.vaticle.reqmachine.ast.ErrorType;
import com.vaticle.reqmachine.ast.GenericParamType;
import com.vaticle.reqmachine.ast.NominalDecl;
import com.vaticle.reqmachine.ast.NominalType;
import com.vaticle.reqmachine.ast.ProtocolDecl;
import com.vaticle.reqmachine.common.exception.ErrorMessage;
import com.vaticle.reqmachine.common.parameters.Options;
import com.vaticle.reqmachine.conformance.ConformanceTable;
import com.vaticle.reqmachine.rewriting.property.PropertyMap;
import org.junit.Test;

import java.util.List;
import java.util.Optional;

import static com.vaticle.reqmachine.common.test.Util.assertThrowsWithCode;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;

public class BasicRewriteSystemTest {

    private static final Symbol T0 = Symbol.forGenericParam(GenericParamType.of(0, 0));
    private static final Symbol T1 = Symbol.forGenericParam(GenericParamType.of(0, 1));
    private static final ProtocolDecl P = ProtocolDecl.of("P");
    private static final Symbol P_A = Symbol.forAssociatedType(P, "A");

    private static MutableTerm mutable(Symbol... symbols) {
        return new MutableTerm(Term.of(symbols));
    }

    @Test
    public void test_rules_are_oriented_and_paths_inverted() {
        BasicRewriteSystem system = new BasicRewriteSystem(new Options());
        RewritePath path = new RewritePath()
                .add(RewriteStep.forRelation(0, 0, false))
                .add(RewriteStep.forRelation(1, 1, false));

        assertTrue(system.addRule(mutable(T0), mutable(T0, P_A), path));

        Rule rule = system.getRule(0);
        assertEquals(Term.of(T0, P_A), rule.lhs());
        assertEquals(Term.of(T0), rule.rhs());
        assertEquals(List.of(RewriteStep.forRelation(1, 1, true), RewriteStep.forRelation(0, 0, true)),
                     rule.path().get().steps());
        assertEquals(2, path.size());
        assertFalse(path.steps().get(0).isInverse());
    }

    @Test
    public void test_duplicate_and_trivial_rules_are_rejected() {
        BasicRewriteSystem system = new BasicRewriteSystem(new Options());
        assertTrue(system.addRule(mutable(T0, P_A), mutable(T1), null));
        assertFalse(system.addRule(mutable(T1), mutable(T0, P_A), null));
        assertFalse(system.addRule(mutable(T0), mutable(T0), null));
        assertEquals(1, system.rules().size());
    }

    @Test
    public void test_concrete_symbols_that_print_alike_are_ordered() {
        NominalType intType = NominalType.of(NominalDecl.struct("Int", 0));
        NominalType stringType = NominalType.of(NominalDecl.struct("String", 0));
        Symbol intError = Symbol.forConcreteType(ErrorType.of(intType), List.of());
        Symbol stringError = Symbol.forConcreteType(ErrorType.of(stringType), List.of());
        Symbol unknownError = Symbol.forConcreteType(ErrorType.of(null), List.of());

        assertEquals(intError.toString(), stringError.toString());
        assertNotEquals(0, intError.compareTo(stringError));
        assertEquals(-Integer.signum(intError.compareTo(stringError)), Integer.signum(stringError.compareTo(intError)));
        assertNotEquals(0, unknownError.compareTo(intError));
        assertEquals(0, intError.compareTo(Symbol.forConcreteType(ErrorType.of(intType), List.of())));

        BasicRewriteSystem system = new BasicRewriteSystem(new Options());
        assertTrue(system.addRule(mutable(T0, intError), mutable(T0), null));
        assertTrue(system.addRule(mutable(T0, stringError), mutable(T0), null));
        assertTrue(system.addRule(mutable(T1, intError), mutable(T1, stringError), null));
        assertEquals(3, system.rules().size());
    }

    @Test
    public void test_rule_kinds_are_kept() {
        BasicRewriteSystem system = new BasicRewriteSystem(new Options());
        Symbol protocol = Symbol.forProtocol(P);
        system.addPermanentRule(mutable(protocol, protocol), mutable(protocol));
        system.addExplicitRule(mutable(T0, protocol), mutable(T0));

        assertTrue(system.getRule(0).isPermanent());
        assertFalse(system.getRule(0).isExplicit());
        assertTrue(system.getRule(1).isExplicit());
        assertEquals(Optional.of(protocol), system.getRule(1).isPropertyRule());
        assertFalse(system.getRule(1).path().isPresent());
    }

    @Test
    public void test_simplify_records_rule_steps() {
        BasicRewriteSystem system = new BasicRewriteSystem(new Options());
        system.addRule(mutable(T0, P_A), mutable(T1), null);

        MutableTerm term = mutable(T0, P_A, P_A);
        RewritePath path = new RewritePath();
        assertTrue(system.simplify(term, path));
        assertEquals(mutable(T1, P_A), term);
        assertEquals(List.of(RewriteStep.forRewriteRule(0, 1, 0, false)), path.steps());

        assertFalse(system.simplify(term, path));
        assertEquals(1, path.size());
    }

    @Test
    public void test_relations_are_deduplicated() {
        BasicRewriteSystem system = new BasicRewriteSystem(new Options());
        Symbol concrete = Symbol.forConcreteType(NominalType.of(NominalDecl.struct("Int", 0)), List.of());
        int first = system.recordRelation(Term.of(T0, concrete), Term.of(T0));
        int second = system.recordRelation(Term.of(T0, concrete), Term.of(T0));
        int other = system.recordRelation(Term.of(T1, concrete), Term.of(T1));

        assertEquals(first, second);
        assertEquals(first + 1, other);
        assertEquals(Term.of(T1), system.getRelation(other).rhs());
        assertEquals(2, system.relations().size());
    }

    @Test
    public void test_simplify_substitutions_reduces_each_substitution() {
        BasicRewriteSystem system = new BasicRewriteSystem(new Options());
        system.addRule(mutable(T0, P_A), mutable(T1), null);
        NominalDecl box = NominalDecl.struct("Box", 1);
        Symbol symbol = Symbol.forConcreteType(NominalType.of(box, GenericParamType.of(0, 0)),
                                               List.of(Term.of(T0, P_A)));

        RewritePath path = new RewritePath();
        Optional<Integer> difference = system.simplifySubstitutions(Term.of(T0), symbol, 1, null, path);

        assertTrue(difference.isPresent());
        TypeDifference typeDifference = system.getTypeDifference(difference.get());
        assertEquals(symbol, typeDifference.lhs());
        assertEquals(List.of(Term.of(T1)), typeDifference.rhs().substitutions());
        assertEquals(1, path.size());
        assertEquals(RewriteStep.Kind.RELATION, path.steps().get(0).kind());
        assertEquals(1, path.steps().get(0).startOffset());
    }

    @Test
    public void test_simplify_substitutions_folds_concrete_substitutions() {
        Options options = new Options();
        BasicRewriteSystem system = new BasicRewriteSystem(options);
        NominalType intType = NominalType.of(NominalDecl.struct("Int", 0));
        NominalDecl pair = NominalDecl.struct("Pair", 2);
        // τ_0_0.[concrete: Int] => τ_0_0
        system.addExplicitRule(mutable(T0, Symbol.forConcreteType(intType, List.of())), mutable(T0));
        PropertyMap map = new PropertyMap(system, new RewriteContext(new ConformanceTable()), options);
        map.buildPropertyMap();

        Symbol symbol = Symbol.forConcreteType(
                NominalType.of(pair, GenericParamType.of(0, 0), GenericParamType.of(0, 1)),
                List.of(Term.of(T0), Term.of(T1))
        );
        Optional<Integer> difference = system.simplifySubstitutions(Term.of(T1), symbol, 1, map, new RewritePath());

        assertTrue(difference.isPresent());
        Symbol simplified = system.getTypeDifference(difference.get()).rhs();
        assertEquals(NominalType.of(pair, intType, GenericParamType.of(0, 0)), simplified.concreteType());
        assertEquals(List.of(Term.of(T1)), simplified.substitutions());
    }

    @Test
    public void test_simplify_substitutions_of_normal_symbol_is_empty() {
        BasicRewriteSystem system = new BasicRewriteSystem(new Options());
        Symbol symbol = Symbol.forConcreteType(NominalType.of(NominalDecl.struct("Int", 0)), List.of());
        RewritePath path = new RewritePath();
        assertFalse(system.simplifySubstitutions(Term.of(T0), symbol, 1, null, path).isPresent());
        assertTrue(path.isEmpty());
        assertThrowsWithCode(() -> system.simplifySubstitutions(Term.of(T0), P_A, 1, null, new RewritePath()),
                             ErrorMessage.Rewriting.UNEXPECTED_SYMBOL_KIND.code());
    }

    @Test
    public void test_unknown_ids_throw() {
        BasicRewriteSystem system = new BasicRewriteSystem(new Options());
        assertThrowsWithCode(() -> system.getRule(0), ErrorMessage.Rewriting.UNKNOWN_RULE.code());
        assertThrowsWithCode(() -> system.getRelation(-1), ErrorMessage.Rewriting.UNKNOWN_RELATION.code());
        assertThrowsWithCode(() -> system.getTypeDifference(3), ErrorMessage.Rewriting.UNKNOWN_TYPE_DIFFERENCE.code());
    }
}
