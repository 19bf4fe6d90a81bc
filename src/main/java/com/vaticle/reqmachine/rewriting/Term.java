/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.reqmachine.rewriting;

import com.vaticle.reqmachine.ast.ProtocolDecl;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static java.util.Collections.unmodifiableList;

/**
 * An immutable sequence of symbols, compared structurally. Terms are ordered by length first and then
 * symbol-by-symbol, which is the reduction order of the rewrite system.
 */
public class Term implements Comparable<Term> {

    private final List<Symbol> symbols;
    private final int hash;

    private Term(List<Symbol> symbols) {
        this.symbols = unmodifiableList(symbols);
        this.hash = symbols.hashCode();
    }

    public static Term of(Symbol... symbols) {
        return new Term(new ArrayList<>(Arrays.asList(symbols)));
    }

    public static Term of(List<Symbol> symbols) {
        return new Term(new ArrayList<>(symbols));
    }

    public int size() {
        return symbols.size();
    }

    public boolean isEmpty() {
        return symbols.isEmpty();
    }

    public Symbol get(int index) {
        return symbols.get(index);
    }

    public Symbol last() {
        return symbols.get(symbols.size() - 1);
    }

    public List<Symbol> symbols() {
        return symbols;
    }

    /**
     * The first {@code length} symbols of this term.
     */
    public Term prefix(int length) {
        return new Term(new ArrayList<>(symbols.subList(0, length)));
    }

    /**
     * The symbols of this term starting at {@code start}.
     */
    public Term suffix(int start) {
        return new Term(new ArrayList<>(symbols.subList(start, symbols.size())));
    }

    /**
     * The protocol whose requirement signature this term is written in, if the term is rooted in a protocol or
     * associated type symbol rather than a generic parameter.
     */
    public Optional<ProtocolDecl> rootProtocol() {
        if (symbols.isEmpty()) return Optional.empty();
        Symbol first = symbols.get(0);
        switch (first.kind()) {
            case PROTOCOL:
            case ASSOCIATED_TYPE:
                return Optional.of(first.protocol());
            default:
                return Optional.empty();
        }
    }

    @Override
    public int compareTo(Term other) {
        int result = Integer.compare(size(), other.size());
        if (result != 0) return result;
        for (int i = 0; i < size(); i++) {
            result = symbols.get(i).compareTo(other.symbols.get(i));
            if (result != 0) return result;
        }
        return 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Term that = (Term) o;
        return hash == that.hash && symbols.equals(that.symbols);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return symbols.stream().map(Symbol::toString).collect(Collectors.joining("."));
    }
}
