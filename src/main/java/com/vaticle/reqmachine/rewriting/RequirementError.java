/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.reqmachine.rewriting;

import com.vaticle.reqmachine.ast.Requirement;
import com.vaticle.reqmachine.common.exception.ErrorMessage;

/**
 * A requirement that can never be satisfied, found while desugaring. Errors are collected, not thrown, so that the
 * remaining requirements are still processed.
 */
public class RequirementError {

    private final ErrorMessage.Requirement error;
    private final Requirement requirement;
    private final Object[] parameters;

    RequirementError(ErrorMessage.Requirement error, Requirement requirement, Object... parameters) {
        this.error = error;
        this.requirement = requirement;
        this.parameters = parameters;
    }

    public ErrorMessage.Requirement error() {
        return error;
    }

    public Requirement requirement() {
        return requirement;
    }

    public String message() {
        return error.message(parameters);
    }

    @Override
    public String toString() {
        return message() + " (in requirement '" + requirement + "')";
    }
}
