/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.reqmachine.common.exception;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class ReqMachineExceptionTest {

    @Test
    public void test_message_is_formatted_from_parameters() {
        ReqMachineException exception = ReqMachineException.of(ErrorMessage.Internal.ABSTRACT_CONFORMANCE, "Bar", "P");
        assertEquals(ErrorMessage.Internal.ABSTRACT_CONFORMANCE, exception.errorMessage());
        assertEquals(ErrorMessage.Internal.ABSTRACT_CONFORMANCE.message("Bar", "P"), exception.getMessage());
        assertTrue(exception.getMessage().startsWith(ErrorMessage.Internal.ABSTRACT_CONFORMANCE.code()));
    }

    @Test
    public void test_throwable_parameter_is_formatted_not_chained() {
        IllegalStateException parameter = new IllegalStateException("broken");
        ReqMachineException exception = ReqMachineException.of(ErrorMessage.Rewriting.UNKNOWN_RULE, parameter);
        assertNull(exception.getCause());
        assertTrue(exception.getMessage().contains(parameter.toString()));
        assertFalse(exception.getMessage().contains("%s"));
    }
}
