/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.reqmachine.rewriting;

import org.junit.Test;

import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class RewritePathTest {

    @Test
    public void test_invert_reverses_and_flips_every_step() {
        RewritePath path = new RewritePath()
                .add(RewriteStep.forRewriteRule(0, 0, 3, true))
                .add(RewriteStep.forPrefixSubstitutions(1, 1, false))
                .add(RewriteStep.forRelation(2, 0, false));
        path.invert();

        assertEquals(List.of(RewriteStep.forRelation(2, 0, true),
                             RewriteStep.forPrefixSubstitutions(1, 1, true),
                             RewriteStep.forRewriteRule(0, 0, 3, false)), path.steps());

        path.invert();
        assertEquals(RewriteStep.forRewriteRule(0, 0, 3, true), path.steps().get(0));
    }

    @Test
    public void test_append_copies_steps() {
        RewritePath first = new RewritePath().add(RewriteStep.forRelation(0, 0, false));
        RewritePath second = new RewritePath().add(RewriteStep.forRelation(1, 1, false));
        first.append(second);
        second.invert();

        assertEquals(2, first.size());
        assertEquals(RewriteStep.forRelation(1, 1, false), first.steps().get(1));
        assertTrue(new RewritePath().isEmpty());
    }

    @Test
    public void test_prefix_substitutions_step_stores_length_as_id() {
        RewriteStep step = RewriteStep.forPrefixSubstitutions(2, 1, false);
        assertEquals(RewriteStep.Kind.PREFIX_SUBSTITUTIONS, step.kind());
        assertEquals(2, step.id());
        assertEquals(0, step.startOffset());
        assertEquals(1, step.endOffset());
    }
}
