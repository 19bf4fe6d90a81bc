/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.reqmachine.common.exception;

import java.util.Objects;

/**
 * Raised when an invariant of the rewriting session is broken. The core never catches it: a pass either runs
 * to exhaustion or aborts with this exception.
 */
public class ReqMachineException extends RuntimeException {

    private final ErrorMessage error;

    private ReqMachineException(ErrorMessage error, Object... parameters) {
        super(error.message(parameters));
        assert !getMessage().contains("%s");
        this.error = error;
    }

    public static ReqMachineException of(ErrorMessage errorMessage, Object... parameters) {
        return new ReqMachineException(errorMessage, parameters);
    }

    public ErrorMessage errorMessage() {
        return error;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ReqMachineException that = (ReqMachineException) o;
        return error.equals(that.error);
    }

    @Override
    public int hashCode() {
        return Objects.hash(error);
    }
}
