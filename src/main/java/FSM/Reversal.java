package FSM;

import FSM.Model.Automaton;
import FSM.Model.State;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;

public class Reversal {

    /**
     * Automaton for the reverse language. Every edge is flipped, ε edges included.
     * The image of the original start state becomes the only accepting state. A single accepting
     * state becomes the new start state; otherwise a fresh start state fans out to all of them by ε edges.
     * @param nfa - input automaton. Not modified.
     * @return - reversed automaton
     */
    public static Automaton reverse(Automaton nfa) {
        final Automaton out = new Automaton();
        if (nfa.getStart() == null) {
            return out;
        }

        final State[] image = new State[nfa.size()];
        for (int i = 0; i < image.length; i++) {
            image[i] = out.newState();
        }

        IntList acceptingIds = new IntArrayList();
        for (State from : nfa.getStates()) {
            if (from.isAccepting()) {
                acceptingIds.add(from.getId());
            }
            for (int sym : from.transitions().symbols()) {
                for (State to : from.edge(sym).list()) {
                    image[to.getId()].newEdge(sym, image[from.getId()]);
                }
            }
        }

        image[nfa.getStart().getId()].setAccepting(true);
        if (acceptingIds.size() == 1) {
            out.setStart(image[acceptingIds.getInt(0)]);
        } else {
            State start = out.newState();
            out.setStart(start);
            for (int id : acceptingIds) {
                start.newEdge(Automaton.EPSILON, image[id]);
            }
        }
        return out;
    }
}
