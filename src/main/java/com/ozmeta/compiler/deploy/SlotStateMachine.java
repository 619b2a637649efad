package com.ozmeta.compiler.deploy;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Legal state transitions of a switch group's deployment. Not thread-safe;
 * the controller only touches it while holding the group lock.
 */
public class SlotStateMachine {

    private static final Map<SlotState, Set<SlotState>> TRANSITIONS = new EnumMap<>(SlotState.class);

    static {
        TRANSITIONS.put(SlotState.IDLE, EnumSet.of(SlotState.COMPILING));
        TRANSITIONS.put(SlotState.COMPILING, EnumSet.of(SlotState.DEPLOYING, SlotState.IDLE));
        TRANSITIONS.put(SlotState.DEPLOYING, EnumSet.of(SlotState.VALIDATING, SlotState.ROLLING_BACK));
        TRANSITIONS.put(SlotState.VALIDATING, EnumSet.of(SlotState.PROMOTING, SlotState.ROLLING_BACK));
        TRANSITIONS.put(SlotState.PROMOTING, EnumSet.of(SlotState.IDLE, SlotState.ROLLING_BACK));
        TRANSITIONS.put(SlotState.ROLLING_BACK, EnumSet.of(SlotState.IDLE));
    }

    private SlotState state = SlotState.IDLE;

    public SlotState getState() {
        return state;
    }

    public static boolean isAllowed(SlotState from, SlotState to) {
        return TRANSITIONS.get(from).contains(to);
    }

    /**
     * @throws IllegalStateException when {@code next} is not reachable from the current state
     */
    public void transitionTo(SlotState next) {
        if (!isAllowed(state, next)) {
            throw new IllegalStateException("Illegal slot transition " + state + " -> " + next);
        }
        state = next;
    }
}
