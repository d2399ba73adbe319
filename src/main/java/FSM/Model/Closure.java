package FSM.Model;

import java.util.ArrayList;
import java.util.List;

import it.unimi.dsi.fastutil.ints.Int2ObjectRBTreeMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectSortedMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;

/**
 * A set of states, keyed by state ID.
 * Iteration is always in ascending ID order, independent of insertion order.
 */
public class Closure {
    private final Int2ObjectSortedMap<State> members;

    public Closure() {
        members = new Int2ObjectRBTreeMap<>();
    }

    public Closure(Closure other) {
        members = new Int2ObjectRBTreeMap<>(other.members);
    }

    public boolean has(State s) {
        return members.get(s.getId()) == s;
    }

    public void include(State s) {
        members.put(s.getId(), s);
    }

    public void exclude(State s) {
        if (has(s)) {
            members.remove(s.getId());
        }
    }

    /**
     * Union of other into this closure.
     */
    public void includeAll(Closure other) {
        members.putAll(other.members);
    }

    public List<State> list() {
        return new ArrayList<>(members.values());
    }

    public IntList ids() {
        return new IntArrayList(members.keySet());
    }

    public int size() {
        return members.size();
    }

    public boolean isEmpty() {
        return members.isEmpty();
    }

    /**
     * Canonical key, e.g. "[0 2 5]". Closures over the same state IDs share the same key.
     */
    public String canonicalKey() {
        StringBuilder sb = new StringBuilder("[");
        boolean first = true;
        for (int id : members.keySet()) {
            if (!first) {
                sb.append(' ');
            }
            sb.append(id);
            first = false;
        }
        return sb.append(']').toString();
    }

    @Override
    public String toString() {
        return canonicalKey();
    }
}
