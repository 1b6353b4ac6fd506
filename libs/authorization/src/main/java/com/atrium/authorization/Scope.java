package com.atrium.authorization;

import java.util.Optional;

/**
 * Breadth of a granted action.
 * <p>
 * {@link #OWN} restricts the operation to records the principal owns or created;
 * {@link #FULL} covers every record within the tenant. {@code FULL} implies {@code OWN},
 * so combining the two always yields {@code FULL}.
 */
public enum Scope {

    OWN("own"),
    FULL("full");

    private final String value;

    Scope(String value) {
        this.value = value;
    }

    /** The canonical string representation (e.g., "own"). */
    public String value() {
        return value;
    }

    /**
     * Returns the wider of this scope and {@code other}.
     */
    public Scope widen(Scope other) {
        return this == FULL || other == FULL ? FULL : OWN;
    }

    /**
     * Checks whether this scope covers everything {@code other} covers.
     */
    public boolean covers(Scope other) {
        return this == FULL || other == OWN;
    }

    /**
     * Looks up a Scope by its canonical string value.
     *
     * @param value the string to match (e.g., "full")
     * @return the matching Scope, or empty if not found
     */
    public static Optional<Scope> fromString(String value) {
        for (Scope scope : values()) {
            if (scope.value.equals(value)) {
                return Optional.of(scope);
            }
        }
        return Optional.empty();
    }
}
