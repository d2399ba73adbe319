package FSM.Model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import FSM.BrzozowskiMinimizer;
import FSM.PowersetDeterminizer;
import FSM.Reversal;

/**
 * Finite automaton, possibly nondeterministic and with ε edges.
 * Owns its states; state IDs are dense, zero based and never reused.
 */
public class Automaton {
    /**
     * Symbol value of an ε edge (with no priority). Other negative values are reserved.
     */
    public static final int EPSILON = -1;

    private final List<State> states = new ArrayList<>();
    private State start;

    /**
     * Adds a new state. If the automaton was empty, the new state becomes the start state.
     */
    public State newState() {
        State s = new State(this, states.size());
        states.add(s);
        if (start == null) {
            start = s;
        }
        return s;
    }

    /**
     * Shorthand for {@code from.newEdge(sym, to)}.
     */
    public void newEdge(State from, int sym, State to) {
        checkOwned(from);
        from.newEdge(sym, to);
    }

    /**
     * @throws IllegalArgumentException if s belongs to a different automaton
     */
    public void setStart(State s) {
        checkOwned(s);
        start = s;
    }

    /**
     * @return start state, or null if the automaton has no states
     */
    public State getStart() {
        return start;
    }

    /**
     * @return the state with the given ID, or null if no such state exists
     */
    public State getState(int id) {
        if (id < 0 || id >= states.size()) {
            return null;
        }
        return states.get(id);
    }

    public int size() {
        return states.size();
    }

    public List<State> getStates() {
        return Collections.unmodifiableList(states);
    }

    /**
     * @return one plus the largest non-negative symbol on any edge, 0 if there is none
     */
    public int alphabetSize() {
        int size = 0;
        for (State s : states) {
            for (int sym : s.transitions().symbols()) {
                size = Math.max(size, sym + 1);
            }
        }
        return size;
    }

    /**
     * True if there are no ε (or other negative) edges and no state has two destinations on a symbol.
     */
    public boolean isDeterministic() {
        for (State s : states) {
            Transitions t = s.transitions();
            for (int sym : t.symbols()) {
                if (sym < 0 || t.get(sym).size() > 1) {
                    return false;
                }
            }
        }
        return true;
    }

    /**
     * @return automaton for the reverse language
     */
    public Automaton reverse() {
        return Reversal.reverse(this);
    }

    /**
     * Subset construction. The result has no ε edges.
     * @param withDeadState whether to complete the result with a dead state
     */
    public Automaton powerset(boolean withDeadState) {
        return PowersetDeterminizer.determinize(this, withDeadState);
    }

    /**
     * Minimal DFA by Brzozowski's double reversal.
     * @param withDeadState whether to complete the result with a dead state
     */
    public Automaton minimalDFA(boolean withDeadState) {
        return BrzozowskiMinimizer.minimize(this, withDeadState);
    }

    void checkOwned(State s) {
        if (s == null || s.getAutomaton() != this) {
            throw new IllegalArgumentException("State " + (s == null ? "null" : s.getId())
                + " does not belong to this automaton");
        }
    }

    /**
     * Debug rendering, one block per state in ID order.
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (State s : states) {
            sb.append(s);
        }
        return sb.toString();
    }
}
