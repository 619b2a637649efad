package com.ozmeta.compiler.deploy;

import java.util.concurrent.atomic.AtomicReference;

/**
 * A pair of production slots with exactly one active. The active slot is a
 * single reference, so there is never a moment with zero or two active.
 */
public class SwitchGroup {

    private final String name;
    private final AtomicReference<Slot> activeSlot;
    private final SlotStateMachine stateMachine = new SlotStateMachine();

    public SwitchGroup(String name, Slot initiallyActive) {
        if (initiallyActive == null) {
            throw new IllegalArgumentException("Switch group " + name + " needs an active slot");
        }
        this.name = name;
        this.activeSlot = new AtomicReference<>(initiallyActive);
    }

    public String getName() {
        return name;
    }

    public Slot getActiveSlot() {
        return activeSlot.get();
    }

    public Slot getInactiveSlot() {
        return activeSlot.get().other();
    }

    public SlotState getState() {
        return stateMachine.getState();
    }

    SlotStateMachine stateMachine() {
        return stateMachine;
    }

    /**
     * Makes {@code candidate} active if {@code expectedActive} still is.
     */
    boolean flip(Slot expectedActive, Slot candidate) {
        return activeSlot.compareAndSet(expectedActive, candidate);
    }
}
