package FSM.Registry;

import FSM.Model.Closure;

/**
 * Memo table from closures of input states to output state IDs, used during subset construction.
 */
public interface Registry {
    int MISSING_ELEMENT = -1;

    /**
     * Get output state ID registered for the closure.
     * @param closure closure of input states
     * @return output state ID or MISSING_ELEMENT if the closure was not registered.
     */
    int get(Closure closure);

    /**
     * Register closure, with (fixed) output state ID.
     * @param closure closure of input states
     * @param stateID output state ID
     */
    void put(Closure closure, int stateID);

    int size();
}
