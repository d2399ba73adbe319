package FSM.Model;

import java.util.List;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class TransitionsTest {
  @Test
  void testGetSetDelete() {
    Automaton a = new Automaton();
    State s0 = a.newState(), s1 = a.newState();

    Transitions t = new Transitions();
    Assertions.assertTrue(t.isEmpty());
    Assertions.assertTrue(t.get(0).isEmpty());
    Assertions.assertFalse(t.contains(0)); // get does not create

    t.add(5, s1);
    t.add(Automaton.EPSILON, s0);
    t.add(2, s0);
    t.add(2, s1);
    Assertions.assertEquals(List.of(-1, 2, 5), t.symbols());
    Assertions.assertEquals(List.of(s0, s1), t.get(2).list());

    Closure c = new Closure();
    c.include(s0);
    t.set(5, c);
    Assertions.assertSame(c, t.get(5));

    t.delete(2);
    Assertions.assertEquals(List.of(-1, 5), t.symbols());
    Assertions.assertTrue(t.get(2).isEmpty());
  }

  @Test
  void testStateTransitionsAreLive() {
    Automaton a = new Automaton();
    State s0 = a.newState(), s1 = a.newState();
    s0.newEdge(1, s1);

    s0.transitions().delete(1);
    Assertions.assertTrue(s0.edge(1).isEmpty());
    Assertions.assertEquals("->[0]\n[1]\n", a.toString());

    s0.edge(1).include(s1); // detached empty closure
    Assertions.assertTrue(s0.transitions().isEmpty());
  }
}
