/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.reqmachine.common.config;

import javax.annotation.Nullable;

/**
 * Enum representing system properties read by the requirement machine
 */
public enum SystemProperty {

    DEBUG_FLAGS("reqmachine.debug"),
    REUSE_CONCRETE_PARENTS("reqmachine.reuse-concrete-parents"),
    INFER_CONDITIONAL_REQUIREMENTS("reqmachine.infer-conditional-requirements");

    private final String key;

    SystemProperty(String key) {
        this.key = key;
    }

    /**
     * Return the key identifying the system property
     *
     * @return the key identifying the system property
     */
    public String key() {
        return key;
    }

    /**
     * Retrieve the value of the system property
     *
     * @return the value of the system property, or null if the system property is not set
     */
    @Nullable
    public String value() {
        return System.getProperty(key);
    }

    public void set(String value) {
        System.setProperty(key, value);
    }

    public void clear() {
        System.clearProperty(key);
    }
}
