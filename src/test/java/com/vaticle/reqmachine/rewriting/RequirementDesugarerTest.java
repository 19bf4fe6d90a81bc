/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.reqmachine.rewriting;

import com.vaticle.reqmachine.ast.ErrorType;
import com.vaticle.reqmachine.ast.GenericParamType;
import com.vaticle.reqmachine.ast.LayoutConstraint;
import com.vaticle.reqmachine.ast.NominalDecl;
import com.vaticle.reqmachine.ast.NominalType;
import com.vaticle.reqmachine.ast.ProtocolDecl;
import com.vaticle.reqmachine.ast.Requirement;
import com.vaticle.reqmachine.common.exception.ErrorMessage;
import com.vaticle.reqmachine.conformance.ConformanceTable;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class RequirementDesugarerTest {

    private static final GenericParamType T0 = GenericParamType.of(0, 0);
    private static final GenericParamType T1 = GenericParamType.of(0, 1);
    private static final NominalType INT = NominalType.of(NominalDecl.struct("Int", 0));

    private ConformanceTable table;
    private RequirementDesugarer desugarer;
    private List<Requirement> result;
    private List<RequirementError> errors;

    @Before
    public void setUp() {
        table = new ConformanceTable();
        desugarer = new RequirementDesugarer(table);
        result = new ArrayList<>();
        errors = new ArrayList<>();
    }

    @Test
    public void test_type_parameter_requirements_are_kept() {
        ProtocolDecl p = ProtocolDecl.of("P");
        desugarer.desugarRequirement(Requirement.conformance(T0, p), result, errors);
        desugarer.desugarRequirement(Requirement.layout(T1, LayoutConstraint.CLASS), result, errors);
        assertEquals(List.of(Requirement.conformance(T0, p), Requirement.layout(T1, LayoutConstraint.CLASS)), result);
        assertTrue(errors.isEmpty());
    }

    @Test
    public void test_concrete_conformance_is_replaced_by_its_conditional_requirements() {
        ProtocolDecl p = ProtocolDecl.of("P");
        ProtocolDecl q = ProtocolDecl.of("Q");
        NominalDecl array = NominalDecl.struct("Array", 1);
        table.declare(array, p).conditionalRequirement(Requirement.conformance(T0, q));

        desugarer.desugarRequirement(Requirement.conformance(NominalType.of(array, T1), p), result, errors);
        assertEquals(List.of(Requirement.conformance(T1, q)), result);

        desugarer.desugarRequirement(Requirement.conformance(NominalType.of(array, INT), p), result, errors);
        assertEquals(1, result.size());
        assertEquals(1, errors.size());
        assertEquals(ErrorMessage.Requirement.CONFLICTING_CONFORMANCE, errors.get(0).error());
    }

    @Test
    public void test_same_type_is_flipped_and_decomposed() {
        NominalDecl pair = NominalDecl.struct("Pair", 2);
        desugarer.desugarRequirement(Requirement.sameType(INT, T0), result, errors);
        desugarer.desugarRequirement(Requirement.sameType(NominalType.of(pair, T1, INT), NominalType.of(pair, INT, INT)),
                                     result, errors);
        assertEquals(List.of(Requirement.sameType(T0, INT), Requirement.sameType(T1, INT)), result);
        assertTrue(errors.isEmpty());
    }

    @Test
    public void test_mismatched_concrete_types_are_errors() {
        NominalType string = NominalType.of(NominalDecl.struct("String", 0));
        desugarer.desugarRequirement(Requirement.sameType(INT, string), result, errors);
        desugarer.desugarRequirement(Requirement.layout(INT, LayoutConstraint.CLASS), result, errors);
        assertTrue(result.isEmpty());
        assertEquals(2, errors.size());
        assertEquals(ErrorMessage.Requirement.CONFLICTING_SAME_TYPE, errors.get(0).error());
        assertEquals(ErrorMessage.Requirement.CONFLICTING_LAYOUT, errors.get(1).error());
    }

    @Test
    public void test_superclass_of_concrete_type_walks_the_class_hierarchy() {
        NominalDecl base = NominalDecl.classDecl("Base", 1);
        NominalDecl derived = NominalDecl.classDecl("Derived", 1).superclass(NominalType.of(base, T0));
        NominalDecl unrelated = NominalDecl.classDecl("Unrelated", 0);

        desugarer.desugarRequirement(Requirement.superclass(NominalType.of(derived, INT), NominalType.of(base, T1)),
                                     result, errors);
        assertEquals(List.of(Requirement.sameType(T1, INT)), result);

        desugarer.desugarRequirement(Requirement.superclass(unrelated.declaredType(), NominalType.of(base, INT)),
                                     result, errors);
        assertEquals(1, errors.size());
        assertEquals(ErrorMessage.Requirement.CONFLICTING_SUPERCLASS, errors.get(0).error());
    }

    @Test
    public void test_error_types_are_dropped() {
        ProtocolDecl p = ProtocolDecl.of("P");
        desugarer.desugarRequirement(Requirement.conformance(ErrorType.of(null), p), result, errors);
        desugarer.desugarRequirement(Requirement.sameType(T0, ErrorType.of(INT)), result, errors);
        desugarer.desugarRequirement(Requirement.sameType(INT, INT), result, errors);
        assertTrue(result.isEmpty());
        assertTrue(errors.isEmpty());
    }
}
