package FSM.Model;

import it.unimi.dsi.fastutil.ints.Int2ObjectRBTreeMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectSortedMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;

/**
 * Maps symbols (or {@link Automaton#EPSILON}) to the closure of destination states.
 * The table of a {@link State} only accepts destinations of the state's automaton.
 */
public class Transitions {
    private final Int2ObjectSortedMap<Closure> edges = new Int2ObjectRBTreeMap<>();
    private final Automaton owner;

    public Transitions() {
        this(null);
    }

    Transitions(Automaton owner) {
        this.owner = owner;
    }

    /**
     * Closure associated with sym. If there is none, an empty closure not attached to this table.
     * The closures of a state's table are returned as copies.
     */
    public Closure get(int sym) {
        Closure c = edges.get(sym);
        if (c == null) {
            return new Closure();
        }
        return owner == null ? c : new Closure(c);
    }

    /**
     * @throws IllegalArgumentException if this is the table of a state and c has a member of another automaton
     */
    public void set(int sym, Closure c) {
        if (owner == null) {
            edges.put(sym, c);
            return;
        }
        for (State s : c.list()) {
            owner.checkOwned(s);
        }
        edges.put(sym, new Closure(c));
    }

    public void delete(int sym) {
        edges.remove(sym);
    }

    public boolean contains(int sym) {
        return edges.containsKey(sym);
    }

    /**
     * Adds next to the closure of sym, creating it if needed. Idempotent.
     * @throws IllegalArgumentException if this is the table of a state and next belongs to another automaton
     */
    public void add(int sym, State next) {
        if (owner != null) {
            owner.checkOwned(next);
        }
        Closure c = edges.get(sym);
        if (c == null) {
            c = new Closure();
            edges.put(sym, c);
        }
        c.include(next);
    }

    /**
     * @return symbols in ascending order; epsilon, if present, comes first
     */
    public IntList symbols() {
        return new IntArrayList(edges.keySet());
    }

    public boolean isEmpty() {
        return edges.isEmpty();
    }
}
