/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.reqmachine.common.parameters;

import org.junit.After;
import org.junit.Test;

import java.util.EnumSet;

import static com.vaticle.reqmachine.common.config.SystemProperty.DEBUG_FLAGS;
import static com.vaticle.reqmachine.common.config.SystemProperty.INFER_CONDITIONAL_REQUIREMENTS;
import static com.vaticle.reqmachine.common.config.SystemProperty.REUSE_CONCRETE_PARENTS;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class OptionsTest {

    @After
    public void tearDown() {
        DEBUG_FLAGS.clear();
        REUSE_CONCRETE_PARENTS.clear();
        INFER_CONDITIONAL_REQUIREMENTS.clear();
    }

    @Test
    public void test_defaults() {
        Options options = new Options();
        assertTrue(options.debugFlags().isEmpty());
        assertTrue(options.reuseConcreteParents());
        assertTrue(options.inferConditionalRequirements());
    }

    @Test
    public void test_child_inherits_from_parent_until_overridden() {
        Options parent = new Options().reuseConcreteParents(false).debugFlags(DebugFlags.ADD);
        Options child = new Options().parent(parent);
        assertFalse(child.reuseConcreteParents());
        assertTrue(child.debug(DebugFlags.ADD));

        child.reuseConcreteParents(true).debugFlags(DebugFlags.SIMPLIFY);
        assertTrue(child.reuseConcreteParents());
        assertFalse(child.debug(DebugFlags.ADD));
        assertTrue(child.debug(DebugFlags.SIMPLIFY));
        assertFalse(parent.reuseConcreteParents());
    }

    @Test
    public void test_defaults_read_from_system_properties() {
        DEBUG_FLAGS.set("add, Concretize-Nested-Types,unknown");
        REUSE_CONCRETE_PARENTS.set("false");
        Options options = new Options();
        assertEquals(EnumSet.of(DebugFlags.ADD, DebugFlags.CONCRETIZE_NESTED_TYPES), options.debugFlags());
        assertFalse(options.reuseConcreteParents());
    }

    @Test
    public void test_conditional_requirements_default_read_from_system_property() {
        INFER_CONDITIONAL_REQUIREMENTS.set("false");
        Options options = new Options();
        assertFalse(options.inferConditionalRequirements());
        assertTrue(new Options().parent(options).inferConditionalRequirements(true).inferConditionalRequirements());

        INFER_CONDITIONAL_REQUIREMENTS.clear();
        assertTrue(new Options().inferConditionalRequirements());
    }
}
