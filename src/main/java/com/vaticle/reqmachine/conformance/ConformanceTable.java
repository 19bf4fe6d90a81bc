/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.reqmachine.conformance;

import com.vaticle.reqmachine.ast.NominalDecl;
import com.vaticle.reqmachine.ast.NominalType;
import com.vaticle.reqmachine.ast.ProtocolDecl;
import com.vaticle.reqmachine.ast.Type;
import com.vaticle.reqmachine.common.cache.CommonCache;
import com.vaticle.reqmachine.common.collection.Pair;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Declared conformances of nominal types, and the lookup of conformances of arbitrary types against them.
 * <p>
 * Lookup results are uniqued, so that repeated lookups of the same type and protocol return the same witness.
 */
public class ConformanceTable implements ConformanceLookup {

    private final Map<Pair<NominalDecl, ProtocolDecl>, NormalConformance> declared;
    private final CommonCache<Pair<Type, ProtocolDecl>, ProtocolConformanceRef> lookups;

    public ConformanceTable() {
        this.declared = new HashMap<>();
        this.lookups = new CommonCache<>();
    }

    public NormalConformance declare(NominalDecl decl, ProtocolDecl protocol) {
        lookups.clear();
        return declared.computeIfAbsent(Pair.of(decl, protocol), pair -> new NormalConformance(decl, protocol));
    }

    @Override
    public ProtocolConformanceRef lookupConformance(Type type, ProtocolDecl protocol) {
        Pair<Type, ProtocolDecl> key = Pair.of(type, protocol);
        ProtocolConformanceRef ref = lookups.getIfPresent(key);
        if (ref == null) {
            // computed outside the cache: specialising can look up other conformances recursively
            ref = computeConformance(type, protocol);
            lookups.put(key, ref);
        }
        return ref;
    }

    private ProtocolConformanceRef computeConformance(Type type, ProtocolDecl protocol) {
        if (type.isTypeParameter()) return ProtocolConformanceRef.forAbstract(type, protocol);
        if (!type.isNominal()) return ProtocolConformanceRef.invalid();

        NominalType nominal = type.asNominal();
        NormalConformance normal = declared.get(Pair.of(nominal.decl(), protocol));
        if (normal != null) {
            if (nominal.equals(normal.getType())) return ProtocolConformanceRef.forConcrete(normal);
            return ProtocolConformanceRef.forConcrete(new SpecializedConformance(nominal, normal, this));
        }

        Optional<Type> superclass = nominal.superclass();
        if (superclass.isPresent()) {
            ProtocolConformanceRef inherited = lookupConformance(superclass.get(), protocol);
            if (inherited.isConcrete()) {
                return ProtocolConformanceRef.forConcrete(new InheritedConformance(type, inherited.getConcrete()));
            }
        }
        return ProtocolConformanceRef.invalid();
    }
}
