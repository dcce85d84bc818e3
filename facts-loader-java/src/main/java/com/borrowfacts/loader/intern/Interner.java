package com.borrowfacts.loader.intern;

import com.borrowfacts.core.Atom;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.IntFunction;

/**
 * Maps textual tokens to dense atoms of one kind, in first-seen order.
 *
 * @param <A> the atom kind handed out
 */
public class Interner<A extends Atom> {

    private final IntFunction<A> factory;
    private final Map<String, A> byToken = new HashMap<>();
    private final List<String> tokens = new ArrayList<>();

    public Interner(IntFunction<A> factory) {
        this.factory = factory;
    }

    /** Returns the atom for {@code token}, allocating the next index on first sight. */
    public A intern(String token) {
        A atom = byToken.get(token);
        if (atom == null) {
            atom = factory.apply(tokens.size());
            tokens.add(token);
            byToken.put(token, atom);
        }
        return atom;
    }

    /**
     * Returns the token an atom was interned from.
     *
     * @throws IllegalArgumentException if the atom was not handed out by this interner
     */
    public String untern(A atom) {
        int index = atom.index();
        if (index >= tokens.size()) {
            throw new IllegalArgumentException("unknown atom: " + atom);
        }
        return tokens.get(index);
    }

    public int size() {
        return tokens.size();
    }
}
