package FSM.Model;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * One vertex of an {@link Automaton}. States are created by {@link Automaton#newState()} and
 * belong to that automaton for their whole lifetime.
 */
public class State {
    private final Automaton automaton;
    private final int id;
    private final Transitions edges;
    private boolean accepting;

    State(Automaton automaton, int id) {
        this.automaton = automaton;
        this.id = id;
        this.edges = new Transitions(automaton);
    }

    /**
     * @return zero based index of this state in its automaton
     */
    public int getId() {
        return id;
    }

    public Automaton getAutomaton() {
        return automaton;
    }

    public boolean isAccepting() {
        return accepting;
    }

    public void setAccepting(boolean accepting) {
        this.accepting = accepting;
    }

    /**
     * Symbol to destination projection of this state. The returned table is live, the closures
     * it hands out are copies.
     */
    public Transitions transitions() {
        return edges;
    }

    /**
     * Destinations reachable on sym, or an empty closure.
     */
    public Closure edge(int sym) {
        return edges.get(sym);
    }

    /**
     * Connects this state to next by an edge labelled sym. Passing {@link Automaton#EPSILON}
     * adds an ε edge.
     * @throws IllegalArgumentException if next belongs to a different automaton
     */
    public void newEdge(int sym, State next) {
        edges.add(sym, next);
    }

    /**
     * Epsilon closure: this state and all states reachable from it through ε edges, transitively.
     * Computed anew on every call.
     */
    public Closure closure() {
        Closure c = new Closure();
        Deque<State> stack = new ArrayDeque<>();
        stack.push(this);
        while (!stack.isEmpty()) {
            State s = stack.pop();
            if (c.has(s)) {
                continue;
            }
            c.include(s);
            for (State next : s.edge(Automaton.EPSILON).list()) {
                if (!c.has(next)) {
                    stack.push(next);
                }
            }
        }
        return c;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (automaton.getStart() == this) {
            sb.append("->");
        }
        if (accepting) {
            sb.append('[');
        }
        sb.append('[').append(id).append(']');
        if (accepting) {
            sb.append(']');
        }
        sb.append('\n');
        for (int sym : edges.symbols()) {
            sb.append('\t');
            if (sym == Automaton.EPSILON) {
                sb.append("ε");
            } else {
                sb.append(sym);
            }
            sb.append(" ->");
            for (State next : edges.get(sym).list()) {
                sb.append(" [").append(next.getId()).append(']');
            }
            sb.append('\n');
        }
        return sb.toString();
    }
}
