package FSM;

import FSM.Model.Automaton;

public class BrzozowskiMinimizer {

    /**
     * Brzozowski's double-reversal algorithm: determinize(reverse(determinize(reverse(nfa)))).
     * Minimality follows from the two subset constructions; there is no explicit state merging.
     * @param nfa - input automaton, may contain ε edges
     * @param withDeadState - passed to both subset constructions; true yields a total DFA
     * @return - minimal DFA
     */
    public static Automaton minimize(Automaton nfa, boolean withDeadState) {
        Automaton brz1DFA = BrzStep(nfa, withDeadState);
        if (PowersetDeterminizer.DEBUG) {
            System.out.println("DEBUG: BRZ step 1 size: " + brz1DFA.size());
        }
        return BrzStep(brz1DFA, withDeadState);
    }

    private static Automaton BrzStep(Automaton nfa, boolean withDeadState) {
        return PowersetDeterminizer.determinize(Reversal.reverse(nfa), withDeadState);
    }
}
