/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.reqmachine.ast;

import com.vaticle.reqmachine.common.exception.ReqMachineException;

import static com.vaticle.reqmachine.common.exception.ErrorMessage.Internal.ILLEGAL_STATE;

public enum LayoutConstraint {

    CLASS("AnyObject"),
    TRIVIAL("_Trivial");

    private final String spelling;

    LayoutConstraint(String spelling) {
        this.spelling = spelling;
    }

    public boolean isSatisfiedBy(NominalType type) {
        switch (this) {
            case CLASS:
                return type.isClass();
            case TRIVIAL:
                return !type.isClass();
            default:
                throw ReqMachineException.of(ILLEGAL_STATE);
        }
    }

    @Override
    public String toString() {
        return spelling;
    }
}
