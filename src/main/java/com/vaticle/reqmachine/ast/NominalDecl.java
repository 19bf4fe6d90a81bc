/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.reqmachine.ast;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A struct or class declaration with {@code genericParamCount} generic parameters {@code τ_0_0 ... τ_0_n}.
 * Declarations are identified by name.
 */
public class NominalDecl {

    public enum Kind {STRUCT, CLASS}

    private final String name;
    private final Kind kind;
    private final int genericParamCount;
    private Type superclass;

    private NominalDecl(String name, Kind kind, int genericParamCount) {
        this.name = name;
        this.kind = kind;
        this.genericParamCount = genericParamCount;
        this.superclass = null;
    }

    public static NominalDecl struct(String name, int genericParamCount) {
        return new NominalDecl(name, Kind.STRUCT, genericParamCount);
    }

    public static NominalDecl classDecl(String name, int genericParamCount) {
        return new NominalDecl(name, Kind.CLASS, genericParamCount);
    }

    public String name() {
        return name;
    }

    public boolean isClass() {
        return kind == Kind.CLASS;
    }

    public int genericParamCount() {
        return genericParamCount;
    }

    /**
     * The superclass, written in terms of this declaration's generic parameters.
     */
    public Optional<Type> superclass() {
        return Optional.ofNullable(superclass);
    }

    public NominalDecl superclass(@Nullable Type superclass) {
        assert isClass();
        this.superclass = superclass;
        return this;
    }

    /**
     * The type of this declaration applied to its own generic parameters.
     */
    public NominalType declaredType() {
        List<Type> params = new ArrayList<>();
        for (int i = 0; i < genericParamCount; i++) params.add(GenericParamType.of(0, i));
        return NominalType.of(this, params);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return name.equals(((NominalDecl) o).name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return name;
    }
}
