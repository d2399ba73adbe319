package FSM;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import FSM.Model.Automaton;
import FSM.Model.Closure;
import FSM.Model.State;
import FSM.Model.Transitions;
import FSM.Registry.CanonicalKeyRegistry;
import FSM.Registry.Registry;
import it.unimi.dsi.fastutil.ints.IntIterator;

public class PowersetDeterminizer {
    public static boolean DEBUG = false;

    /**
     * Subset construction.
     * @param nfa - input automaton, may contain ε edges. Not modified.
     * @param withDeadState - whether missing transitions are completed with a shared dead state
     * @return - new automaton without ε edges, deterministic on every symbol
     */
    public static Automaton determinize(Automaton nfa, boolean withDeadState) {
        return determinize(nfa, withDeadState, new CanonicalKeyRegistry());
    }

    /**
     * Subset construction with a caller-supplied registry.
     * @throws IllegalArgumentException if the registry is not empty
     */
    public static Automaton determinize(Automaton nfa, boolean withDeadState, Registry registry) {
        if (registry.size() != 0) {
            throw new IllegalArgumentException("Registry already holds " + registry.size() + " closures");
        }
        final Automaton out = new Automaton();
        if (nfa.getStart() == null) {
            return out;
        }

        int skipped = doDeterminize(nfa.getStart().closure(), out, registry);

        if (withDeadState) {
            addDeadState(out, nfa.alphabetSize());
        }
        if (DEBUG) {
            System.out.println("DEBUG: Powerset " + nfa.size() + " -> " + out.size() + " states"
                + (skipped > 0 ? ", skipped " + skipped + " edges with negative symbols" : ""));
        }
        return out;
    }

    /**
     * Explores closures depth first, symbols in ascending order. Output IDs are assigned in pre-order.
     * @return number of skipped edges labelled with a negative symbol other than ε
     */
    private static int doDeterminize(Closure init, Automaton out, Registry registry) {
        Deque<DeterminizeRecord> stack = new ArrayDeque<>();

        DeterminizeRecord first = newRecord(important(init), out, registry);
        int skipped = first.skipped;
        stack.push(first);

        while (!stack.isEmpty()) {
            DeterminizeRecord curr = stack.peek();
            if (!curr.symbols.hasNext()) {
                stack.pop();
                continue;
            }

            int sym = curr.symbols.nextInt();
            Closure succ = important(curr.successors.get(sym));
            int outSucc = registry.get(succ);
            if (outSucc == Registry.MISSING_ELEMENT) {
                // add new state to DFA and to stack
                DeterminizeRecord next = newRecord(succ, out, registry);
                outSucc = next.outputState.getId();
                skipped += next.skipped;
                stack.push(next);
            }
            curr.outputState.newEdge(sym, out.getState(outSucc));
        }
        return skipped;
    }

    /**
     * Members that are accepting or have an edge on a symbol. The others only pass on ε edges,
     * whose targets are already in the closure, so they do not change the accepted language.
     */
    static Closure important(Closure c) {
        Closure result = new Closure();
        for (State member : c.list()) {
            if (member.isAccepting() || hasSymbolEdge(member)) {
                result.include(member);
            }
        }
        return result;
    }

    private static boolean hasSymbolEdge(State s) {
        for (int sym : s.transitions().symbols()) {
            if (sym >= 0) {
                return true;
            }
        }
        return false;
    }

    private static DeterminizeRecord newRecord(Closure in, Automaton out, Registry registry) {
        State result = out.newState();
        registry.put(in, result.getId());

        int skipped = 0;
        Transitions successors = new Transitions();
        for (State member : in.list()) {
            result.setAccepting(result.isAccepting() || member.isAccepting());
            Transitions edges = member.transitions();
            for (int sym : edges.symbols()) {
                if (sym < 0) {
                    // ε is resolved by the closures; other negative symbols are reserved
                    if (sym != Automaton.EPSILON) {
                        skipped++;
                    }
                    continue;
                }
                for (State next : edges.get(sym).list()) {
                    for (State reached : next.closure().list()) {
                        successors.add(sym, reached);
                    }
                }
            }
        }
        return new DeterminizeRecord(result, successors, successors.symbols().iterator(), skipped);
    }

    /**
     * Completes out over symbols [0, alphabetSize) with a single dead state, created only if needed.
     */
    static void addDeadState(Automaton out, int alphabetSize) {
        State dead = null;
        List<State> states = new ArrayList<>(out.getStates());
        for (State state : states) {
            Transitions edges = state.transitions();
            for (int sym = 0; sym < alphabetSize; sym++) {
                if (!edges.contains(sym)) {
                    if (dead == null) {
                        dead = out.newState();
                    }
                    state.newEdge(sym, dead);
                }
            }
        }
        if (dead != null) {
            for (int sym = 0; sym < alphabetSize; sym++) {
                dead.newEdge(sym, dead);
            }
        }
    }

    private record DeterminizeRecord(State outputState, Transitions successors, IntIterator symbols, int skipped) { }
}
