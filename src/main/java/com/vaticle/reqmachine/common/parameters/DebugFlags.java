/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.reqmachine.common.parameters;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Per-subsystem switches for debug logging of a rewriting session.
 */
public enum DebugFlags {

    ADD("add"),
    SIMPLIFY("simplify"),
    PROPERTY_MAP("property-map"),
    CONCRETIZE_NESTED_TYPES("concretize-nested-types"),
    CONDITIONAL_REQUIREMENTS("conditional-requirements");

    private final String name;

    DebugFlags(String name) {
        this.name = name;
    }

    /**
     * Parses a comma separated list of flag names, e.g. {@code "add,concretize-nested-types"}. Unknown names are
     * ignored.
     */
    public static Set<DebugFlags> parse(String flags) {
        Set<DebugFlags> parsed = EnumSet.noneOf(DebugFlags.class);
        for (String token : flags.split(",")) {
            String trimmed = token.trim().toLowerCase(Locale.ROOT);
            for (DebugFlags flag : values()) {
                if (flag.name.equals(trimmed)) parsed.add(flag);
            }
        }
        return parsed;
    }
}
