/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.reqmachine.ast;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

import static java.util.Collections.unmodifiableList;

public class NominalType extends Type {

    private final NominalDecl decl;
    private final List<Type> args;
    private final int hash;

    private NominalType(NominalDecl decl, List<Type> args) {
        assert decl.genericParamCount() == args.size();
        this.decl = decl;
        this.args = unmodifiableList(new ArrayList<>(args));
        this.hash = Objects.hash(decl, this.args);
    }

    public static NominalType of(NominalDecl decl, List<Type> args) {
        return new NominalType(decl, args);
    }

    public static NominalType of(NominalDecl decl, Type... args) {
        return new NominalType(decl, Arrays.asList(args));
    }

    public NominalDecl decl() {
        return decl;
    }

    public List<Type> args() {
        return args;
    }

    public boolean isClass() {
        return decl.isClass();
    }

    /**
     * The superclass of this class type, with the generic arguments of this type substituted in.
     */
    public Optional<Type> superclass() {
        return decl.superclass().map(superclass -> superclass.subst(this::argumentFor));
    }

    /**
     * The generic argument for {@code param}, one of the declaration's own generic parameters.
     */
    public Type argumentFor(GenericParamType param) {
        if (param.depth() != 0 || param.index() >= args.size()) return ErrorType.of(param);
        return args.get(param.index());
    }

    @Override
    public boolean hasTypeParameter() {
        for (Type arg : args) {
            if (arg.hasTypeParameter()) return true;
        }
        return false;
    }

    @Override
    public Type transformTypeParameters(Function<Type, Type> function) {
        if (!hasTypeParameter()) return this;
        List<Type> newArgs = new ArrayList<>();
        for (Type arg : args) newArgs.add(arg.transformTypeParameters(function));
        return of(decl, newArgs);
    }

    @Override
    public Type subst(Substitution substitution) {
        if (!hasTypeParameter()) return this;
        List<Type> newArgs = new ArrayList<>();
        for (Type arg : args) newArgs.add(arg.subst(substitution));
        return of(decl, newArgs);
    }

    @Override
    public boolean isNominal() {
        return true;
    }

    @Override
    public NominalType asNominal() {
        return this;
    }

    @Override
    int kindOrder() {
        return 0;
    }

    @Override
    int compareSameKind(Type other) {
        NominalType that = (NominalType) other;
        int result = decl.name().compareTo(that.decl.name());
        if (result != 0) return result;
        result = Integer.compare(args.size(), that.args.size());
        if (result != 0) return result;
        for (int i = 0; i < args.size(); i++) {
            result = args.get(i).compareTo(that.args.get(i));
            if (result != 0) return result;
        }
        return 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        NominalType that = (NominalType) o;
        return decl.equals(that.decl) && args.equals(that.args);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        if (args.isEmpty()) return decl.name();
        return decl.name() + args.stream().map(Type::toString).collect(Collectors.joining(", ", "<", ">"));
    }
}
