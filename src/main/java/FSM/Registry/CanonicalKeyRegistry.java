package FSM.Registry;

import FSM.Model.Closure;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

/**
 * Registry keyed by {@link Closure#canonicalKey()}, so closures with equal members map to the same state.
 */
public class CanonicalKeyRegistry implements Registry {
    private final Object2IntMap<String> key2State;

    public CanonicalKeyRegistry() {
        this.key2State = new Object2IntOpenHashMap<>();
        this.key2State.defaultReturnValue(MISSING_ELEMENT); // if missing, return MISSING_ELEMENT
    }

    @Override
    public int get(Closure closure) {
        return key2State.getInt(closure.canonicalKey());
    }

    @Override
    public void put(Closure closure, int stateID) {
        key2State.put(closure.canonicalKey(), stateID);
    }

    @Override
    public int size() {
        return key2State.size();
    }

    @Override
    public String toString() {
        return "CanonicalKey";
    }
}
