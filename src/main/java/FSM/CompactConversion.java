package FSM;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import FSM.Model.Automaton;
import FSM.Model.Closure;
import FSM.Model.State;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.automaton.fsa.impl.CompactNFA;

/**
 * Conversions between {@link Automaton} and AutomataLib's compact automata.
 * Symbols are integers; a symbol equals its index in the alphabet.
 */
public class CompactConversion {

    public static Alphabet<Integer> alphabetOf(Automaton automaton) {
        return alphabet(automaton.alphabetSize());
    }

    public static Alphabet<Integer> alphabet(int size) {
        List<Integer> symbols = new ArrayList<>(size);
        for (int sym = 0; sym < size; sym++) {
            symbols.add(sym);
        }
        return Alphabets.fromCollection(symbols);
    }

    public static CompactNFA<Integer> toCompactNFA(Automaton automaton) {
        return toCompactNFA(automaton, alphabetOf(automaton));
    }

    /**
     * ε edges are eliminated: state s reaches, on a, the closures of all a-successors of closure(s),
     * and is accepting if closure(s) contains an accepting state. State IDs are preserved.
     */
    public static CompactNFA<Integer> toCompactNFA(Automaton automaton, Alphabet<Integer> alphabet) {
        CompactNFA<Integer> out = new CompactNFA<>(alphabet, automaton.size());
        List<Closure> closures = new ArrayList<>(automaton.size());
        for (State s : automaton.getStates()) {
            Closure c = s.closure();
            closures.add(c);
            boolean accepting = false;
            for (State member : c.list()) {
                accepting |= member.isAccepting();
            }
            out.addState(accepting);
        }
        if (automaton.getStart() != null) {
            out.setInitial(automaton.getStart().getId(), true);
        }

        for (State s : automaton.getStates()) {
            for (State member : closures.get(s.getId()).list()) {
                for (int sym : member.transitions().symbols()) {
                    if (sym == Automaton.EPSILON) {
                        continue;
                    }
                    checkSymbol(sym, alphabet);
                    for (State next : member.edge(sym).list()) {
                        for (State reached : closures.get(next.getId()).list()) {
                            out.addTransition(s.getId(), sym, reached.getId());
                        }
                    }
                }
            }
        }
        return out;
    }

    public static CompactDFA<Integer> toCompactDFA(Automaton automaton) {
        return toCompactDFA(automaton, alphabetOf(automaton));
    }

    /**
     * Missing transitions stay undefined in the result, i.e. the DFA may be partial.
     * @throws IllegalArgumentException if the automaton is not deterministic
     */
    public static CompactDFA<Integer> toCompactDFA(Automaton automaton, Alphabet<Integer> alphabet) {
        if (!automaton.isDeterministic()) {
            throw new IllegalArgumentException("Automaton is not deterministic");
        }
        CompactDFA<Integer> out = new CompactDFA<>(alphabet, automaton.size());
        for (State s : automaton.getStates()) {
            out.addState(s.isAccepting());
        }
        if (automaton.getStart() != null) {
            out.setInitialState(automaton.getStart().getId());
        }
        for (State s : automaton.getStates()) {
            for (int sym : s.transitions().symbols()) {
                checkSymbol(sym, alphabet);
                for (State next : s.edge(sym).list()) {
                    out.setTransition(s.getId(), sym, next.getId());
                }
            }
        }
        return out;
    }

    /**
     * One state per NFA state. A single initial state becomes the start state, otherwise a fresh
     * start state is connected to every initial state by an ε edge.
     */
    public static Automaton fromCompactNFA(CompactNFA<Integer> nfa) {
        Automaton out = new Automaton();
        int size = nfa.size();
        for (int i = 0; i < size; i++) {
            out.newState().setAccepting(nfa.isAccepting(i));
        }
        Alphabet<Integer> alphabet = nfa.getInputAlphabet();
        for (int i = 0; i < size; i++) {
            Integer state = i;
            for (Integer sym : alphabet) {
                for (Integer next : nfa.getTransitions(state, sym)) {
                    out.newEdge(out.getState(i), alphabet.getSymbolIndex(sym), out.getState(next));
                }
            }
        }

        Set<Integer> initialStates = nfa.getInitialStates();
        if (initialStates.size() == 1) {
            out.setStart(out.getState(initialStates.iterator().next()));
        } else {
            State start = out.newState();
            out.setStart(start);
            for (int i = 0; i < size; i++) {
                if (initialStates.contains(i)) {
                    start.newEdge(Automaton.EPSILON, out.getState(i));
                }
            }
        }
        return out;
    }

    private static void checkSymbol(int sym, Alphabet<Integer> alphabet) {
        if (sym < 0 || sym >= alphabet.size()) {
            throw new IllegalArgumentException("Symbol " + sym + " is outside of the alphabet");
        }
    }
}
