/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.reqmachine.common.parameters;

import com.vaticle.reqmachine.common.config.SystemProperty;

import javax.annotation.Nullable;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

import static com.vaticle.reqmachine.common.config.SystemProperty.DEBUG_FLAGS;
import static com.vaticle.reqmachine.common.config.SystemProperty.INFER_CONDITIONAL_REQUIREMENTS;
import static com.vaticle.reqmachine.common.config.SystemProperty.REUSE_CONCRETE_PARENTS;

public class Options {

    public static final boolean DEFAULT_REUSE_CONCRETE_PARENTS = true;
    public static final boolean DEFAULT_INFER_CONDITIONAL_REQUIREMENTS = true;

    private Options parent;
    private Set<DebugFlags> debugFlags = null;
    private Boolean reuseConcreteParents = null;
    private Boolean inferConditionalRequirements = null;

    public Options parent(Options parent) {
        this.parent = parent;
        return this;
    }

    public Set<DebugFlags> debugFlags() {
        if (debugFlags != null) return debugFlags;
        else if (parent != null) return parent.debugFlags();
        else return defaultDebugFlags();
    }

    public Options debugFlags(DebugFlags... flags) {
        this.debugFlags = flags.length == 0 ? EnumSet.noneOf(DebugFlags.class) : EnumSet.copyOf(Arrays.asList(flags));
        return this;
    }

    public boolean debug(DebugFlags flag) {
        return debugFlags().contains(flag);
    }

    /**
     * Whether a fully concrete type witness may be tied back to a prefix of the key that is already bound to the
     * same concrete type, instead of introducing a fresh concrete type requirement.
     */
    public boolean reuseConcreteParents() {
        if (reuseConcreteParents != null) return reuseConcreteParents;
        else if (parent != null) return parent.reuseConcreteParents();
        else return defaultBoolean(REUSE_CONCRETE_PARENTS, DEFAULT_REUSE_CONCRETE_PARENTS);
    }

    public Options reuseConcreteParents(boolean reuseConcreteParents) {
        this.reuseConcreteParents = reuseConcreteParents;
        return this;
    }

    public boolean inferConditionalRequirements() {
        if (inferConditionalRequirements != null) return inferConditionalRequirements;
        else if (parent != null) return parent.inferConditionalRequirements();
        else return defaultBoolean(INFER_CONDITIONAL_REQUIREMENTS, DEFAULT_INFER_CONDITIONAL_REQUIREMENTS);
    }

    public Options inferConditionalRequirements(boolean inferConditionalRequirements) {
        this.inferConditionalRequirements = inferConditionalRequirements;
        return this;
    }

    private static Set<DebugFlags> defaultDebugFlags() {
        String value = DEBUG_FLAGS.value();
        if (value == null || value.isBlank()) return Collections.emptySet();
        return DebugFlags.parse(value);
    }

    private static boolean defaultBoolean(SystemProperty property, boolean defaultValue) {
        @Nullable String value = property.value();
        if (value == null) return defaultValue;
        return Boolean.parseBoolean(value.trim());
    }
}
