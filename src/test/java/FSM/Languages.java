package FSM;

import java.util.ArrayList;
import java.util.List;

import FSM.Model.Automaton;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.util.automaton.Automata;
import net.automatalib.util.automaton.fsa.NFAs;

/**
 * Language checks backed by AutomataLib. Only for tests.
 */
public class Languages {
    /**
     * Complete, unminimized DFA for the language of a, computed by AutomataLib.
     */
    public static CompactDFA<Integer> completeDFA(Automaton a, Alphabet<Integer> alphabet) {
        return NFAs.determinize(CompactConversion.toCompactNFA(a, alphabet), alphabet, false, false);
    }

    public static boolean sameLanguage(Automaton a, Automaton b, Alphabet<Integer> alphabet) {
        return Automata.testEquivalence(completeDFA(a, alphabet), completeDFA(b, alphabet), alphabet);
    }

    /**
     * All words over [0, alphabetSize) of length at most maxLength, the empty word included.
     */
    public static List<List<Integer>> words(int alphabetSize, int maxLength) {
        List<List<Integer>> result = new ArrayList<>();
        List<List<Integer>> current = new ArrayList<>();
        current.add(new ArrayList<>());
        for (int length = 0; length <= maxLength; length++) {
            result.addAll(current);
            List<List<Integer>> next = new ArrayList<>();
            for (List<Integer> w : current) {
                for (int a = 0; a < alphabetSize; a++) {
                    List<Integer> longer = new ArrayList<>(w);
                    longer.add(a);
                    next.add(longer);
                }
            }
            current = next;
        }
        return result;
    }
}
