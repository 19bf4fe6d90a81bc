/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.reqmachine.rewriting;

import com.vaticle.reqmachine.ast.ProtocolDecl;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import static java.util.Collections.unmodifiableSet;

/**
 * The protocols whose rules have been added to a rewrite system.
 */
public class ProtocolMap {

    // protocol -> whether it belongs to the initial component being built
    private final Map<ProtocolDecl, Boolean> protocols;

    public ProtocolMap() {
        this.protocols = new LinkedHashMap<>();
    }

    public void add(ProtocolDecl protocol, boolean initialComponent) {
        protocols.putIfAbsent(protocol, initialComponent);
    }

    public boolean contains(ProtocolDecl protocol) {
        return protocols.containsKey(protocol);
    }

    public boolean isInitialComponent(ProtocolDecl protocol) {
        return protocols.getOrDefault(protocol, false);
    }

    public Set<ProtocolDecl> all() {
        return unmodifiableSet(protocols.keySet());
    }
}
