package FSM;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import FSM.Model.Automaton;
import FSM.Model.State;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.automaton.fsa.impl.CompactNFA;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class ReversalTest {
  @Test
  void testWikipediaExample() {
    Automaton nfa = Examples.wikipediaNFA();
    Assertions.assertEquals(
        "->[0]\n" +
        "\tε -> [2]\n" +
        "\t0 -> [1]\n" +
        "[1]\n" +
        "\t1 -> [1] [3]\n" +
        "[[2]]\n" +
        "\tε -> [1]\n" +
        "\t0 -> [3]\n" +
        "[[3]]\n" +
        "\t0 -> [2]\n",
        nfa.toString());

    Automaton reversed = nfa.reverse();
    Assertions.assertEquals(
        "[[0]]\n" +
        "[1]\n" +
        "\tε -> [2]\n" +
        "\t0 -> [0]\n" +
        "\t1 -> [1]\n" +
        "[2]\n" +
        "\tε -> [0]\n" +
        "\t0 -> [3]\n" +
        "[3]\n" +
        "\t0 -> [2]\n" +
        "\t1 -> [1]\n" +
        "->[4]\n" +
        "\tε -> [2] [3]\n",
        reversed.toString());
  }

  @Test
  void testSingleAcceptingStateBecomesStart() {
    Automaton nfa = Examples.lexiconNFA();
    Automaton reversed = nfa.reverse();
    Assertions.assertEquals(nfa.size(), reversed.size());
    Assertions.assertEquals(3, reversed.getStart().getId());
    Assertions.assertTrue(reversed.getState(0).isAccepting());
    for (int i = 1; i < reversed.size(); i++) {
      Assertions.assertFalse(reversed.getState(i).isAccepting());
    }
    Assertions.assertEquals(List.of(2), reversed.getState(3).transitions().symbols());
    Assertions.assertEquals(List.of(2, 4, 5), reversed.getState(3).edge(2).ids());
  }

  @Test
  void testNoAcceptingState() {
    Automaton nfa = new Automaton();
    State s0 = nfa.newState();
    State s1 = nfa.newState();
    s0.newEdge(0, s1);

    Automaton reversed = nfa.reverse();
    Assertions.assertEquals(3, reversed.size());
    Assertions.assertEquals("[[0]]\n[1]\n\t0 -> [0]\n->[2]\n", reversed.toString());
    Assertions.assertEquals(1, reversed.powerset(false).size());
  }

  @Test
  void testEmptyAutomaton() {
    Assertions.assertEquals(0, new Automaton().reverse().size());
  }

  @Test
  void testInputNotModified() {
    Automaton nfa = Examples.wikipediaNFA();
    String before = nfa.toString();
    nfa.reverse();
    Assertions.assertEquals(before, nfa.toString());
  }

  @Test
  void testReverseLanguage() {
    for (int randomSeed = 0; randomSeed < 50; randomSeed++) {
      Automaton nfa = RandomNFA.getRandomAutomaton(randomSeed, 6);
      Alphabet<Integer> alphabet = CompactConversion.alphabet(2);
      CompactNFA<Integer> forward = CompactConversion.toCompactNFA(nfa, alphabet);
      CompactNFA<Integer> backward = CompactConversion.toCompactNFA(nfa.reverse(), alphabet);

      for (List<Integer> word : Languages.words(2, 6)) {
        List<Integer> reversedWord = new ArrayList<>(word);
        Collections.reverse(reversedWord);
        Assertions.assertEquals(forward.accepts(word), backward.accepts(reversedWord));
      }
    }
  }
}
