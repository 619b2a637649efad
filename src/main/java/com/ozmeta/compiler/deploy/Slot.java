package com.ozmeta.compiler.deploy;

/**
 * One of the two production slots of a switch group.
 */
public enum Slot {
    PROD_A("ProdA"),
    PROD_B("ProdB");

    private final String env;

    Slot(String env) {
        this.env = env;
    }

    /** Target environment name carrying this slot. */
    public String getEnv() {
        return env;
    }

    public Slot other() {
        return this == PROD_A ? PROD_B : PROD_A;
    }

    public static Slot fromEnv(String env) {
        for (Slot slot : values()) {
            if (slot.env.equalsIgnoreCase(env)) {
                return slot;
            }
        }
        throw new IllegalArgumentException("Not a production slot: " + env);
    }
}
