/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.reqmachine.rewriting;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A term under construction. Converted into an immutable {@link Term} once it is stored anywhere.
 */
public class MutableTerm {

    private final List<Symbol> symbols;

    public MutableTerm() {
        this.symbols = new ArrayList<>();
    }

    public MutableTerm(Term term) {
        this.symbols = new ArrayList<>(term.symbols());
    }

    public MutableTerm(MutableTerm term) {
        this.symbols = new ArrayList<>(term.symbols);
    }

    public MutableTerm add(Symbol symbol) {
        symbols.add(symbol);
        return this;
    }

    public MutableTerm append(Term term) {
        symbols.addAll(term.symbols());
        return this;
    }

    public MutableTerm append(MutableTerm term) {
        symbols.addAll(term.symbols);
        return this;
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

    /**
     * Whether {@code pattern} occurs in this term starting at {@code offset}.
     */
    public boolean matchesAt(int offset, Term pattern) {
        if (offset + pattern.size() > symbols.size()) return false;
        for (int i = 0; i < pattern.size(); i++) {
            if (!symbols.get(offset + i).equals(pattern.get(i))) return false;
        }
        return true;
    }

    /**
     * Replaces the {@code length} symbols starting at {@code offset} with {@code replacement}.
     */
    public void replace(int offset, int length, Term replacement) {
        List<Symbol> tail = new ArrayList<>(symbols.subList(offset + length, symbols.size()));
        symbols.subList(offset, symbols.size()).clear();
        symbols.addAll(replacement.symbols());
        symbols.addAll(tail);
    }

    public Term toTerm() {
        return Term.of(symbols);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return symbols.equals(((MutableTerm) o).symbols);
    }

    @Override
    public int hashCode() {
        return symbols.hashCode();
    }

    @Override
    public String toString() {
        return symbols.stream().map(Symbol::toString).collect(Collectors.joining("."));
    }
}
