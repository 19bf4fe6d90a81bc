/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.reqmachine.conformance;

import com.vaticle.reqmachine.ast.AssociatedTypeDecl;
import com.vaticle.reqmachine.ast.DependentMemberType;
import com.vaticle.reqmachine.ast.ErrorType;
import com.vaticle.reqmachine.ast.GenericParamType;
import com.vaticle.reqmachine.ast.NominalDecl;
import com.vaticle.reqmachine.ast.NominalType;
import com.vaticle.reqmachine.ast.ProtocolDecl;
import com.vaticle.reqmachine.ast.Requirement;
import com.vaticle.reqmachine.ast.Type;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class ConformanceTableTest {

    private static final GenericParamType T0 = GenericParamType.of(0, 0);
    private static final GenericParamType T1 = GenericParamType.of(0, 1);

    @Test
    public void test_declared_type_resolves_to_normal_conformance() {
        ConformanceTable table = new ConformanceTable();
        ProtocolDecl p = ProtocolDecl.of("P");
        NominalDecl box = NominalDecl.struct("Box", 1);
        NormalConformance normal = table.declare(box, p);

        ProtocolConformanceRef ref = table.lookupConformance(box.declaredType(), p);
        assertTrue(ref.isConcrete());
        assertSame(normal, ref.getConcrete());
    }

    @Test
    public void test_specialised_conformance_substitutes_witnesses() {
        ConformanceTable table = new ConformanceTable();
        ProtocolDecl q = ProtocolDecl.of("Q");
        AssociatedTypeDecl v = q.addAssociatedType("V");
        ProtocolDecl p = ProtocolDecl.of("P");
        AssociatedTypeDecl a = p.addAssociatedType("A");
        AssociatedTypeDecl b = p.addAssociatedType("B");
        NominalDecl foo = NominalDecl.struct("Foo", 2);
        NominalType intType = NominalType.of(NominalDecl.struct("Int", 0));
        table.declare(foo, p)
                .typeWitness(a, T0)
                .typeWitness(b, DependentMemberType.of(T1, v))
                .conditionalRequirement(Requirement.conformance(T1, q));

        ProtocolConformance conformance = table.lookupConformance(NominalType.of(foo, intType, T0), p).getConcrete();

        assertTrue(conformance instanceof SpecializedConformance);
        assertEquals(intType, conformance.getTypeWitness(a));
        assertEquals(DependentMemberType.of(T0, v), conformance.getTypeWitness(b));
        assertEquals(List.of(Requirement.conformance(T0, q)), conformance.getConditionalRequirements());
    }

    @Test
    public void test_member_of_concrete_argument_resolves_through_its_conformance() {
        ConformanceTable table = new ConformanceTable();
        ProtocolDecl q = ProtocolDecl.of("Q");
        AssociatedTypeDecl v = q.addAssociatedType("V");
        ProtocolDecl p = ProtocolDecl.of("P");
        AssociatedTypeDecl a = p.addAssociatedType("A");
        NominalDecl wrapper = NominalDecl.struct("Wrapper", 1);
        NominalDecl bar = NominalDecl.struct("Bar", 0);
        NominalType stringType = NominalType.of(NominalDecl.struct("String", 0));
        table.declare(wrapper, p).typeWitness(a, DependentMemberType.of(T0, v));
        table.declare(bar, q).typeWitness(v, stringType);

        ProtocolConformance conformance = table.lookupConformance(NominalType.of(wrapper, bar.declaredType()), p).getConcrete();
        assertEquals(stringType, conformance.getTypeWitness(a));

        NominalType unrelated = NominalType.of(NominalDecl.struct("Unrelated", 0));
        Type broken = table.lookupConformance(NominalType.of(wrapper, unrelated), p).getConcrete().getTypeWitness(a);
        assertEquals(ErrorType.of(unrelated), broken);
    }

    @Test
    public void test_subclass_inherits_conformance_of_superclass() {
        ConformanceTable table = new ConformanceTable();
        ProtocolDecl p = ProtocolDecl.of("P");
        AssociatedTypeDecl a = p.addAssociatedType("A");
        NominalDecl base = NominalDecl.classDecl("Base", 0);
        NominalDecl derived = NominalDecl.classDecl("Derived", 0).superclass(base.declaredType());
        NominalType intType = NominalType.of(NominalDecl.struct("Int", 0));
        table.declare(base, p).typeWitness(a, intType);

        ProtocolConformanceRef ref = table.lookupConformance(derived.declaredType(), p);
        assertTrue(ref.getConcrete() instanceof InheritedConformance);
        assertEquals(derived.declaredType(), ref.getConcrete().getType());
        assertEquals(intType, ref.getConcrete().getTypeWitness(a));
    }

    @Test
    public void test_type_parameters_have_abstract_conformances() {
        ConformanceTable table = new ConformanceTable();
        ProtocolDecl p = ProtocolDecl.of("P");
        assertTrue(table.lookupConformance(T0, p).isAbstract());
    }

    @Test
    public void test_missing_conformances_are_invalid() {
        ConformanceTable table = new ConformanceTable();
        ProtocolDecl p = ProtocolDecl.of("P");
        AssociatedTypeDecl a = p.addAssociatedType("A");
        NominalDecl bar = NominalDecl.struct("Bar", 0);
        assertTrue(table.lookupConformance(bar.declaredType(), p).isInvalid());
        assertTrue(table.lookupConformance(ErrorType.of(null), p).isInvalid());

        table.declare(bar, p);
        assertTrue(table.lookupConformance(bar.declaredType(), p).isConcrete());
        assertNull(table.lookupConformance(bar.declaredType(), p).getConcrete().getTypeWitness(a));
    }
}
