/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.reqmachine.common.test;

import com.vaticle.reqmachine.common.exception.ReqMachineException;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

public class Util {

    public static void assertThrowsWithCode(Runnable function, String errorCode) {
        try {
            function.run();
            fail();
        } catch (ReqMachineException e) {
            assertEquals(errorCode, e.errorMessage().code());
        }
    }
}
