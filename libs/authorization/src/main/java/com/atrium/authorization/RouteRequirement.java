package com.atrium.authorization;

/**
 * What a front-end route requires of the caller.
 */
public sealed interface RouteRequirement
        permits RouteRequirement.Public, RouteRequirement.Authenticated, RouteRequirement.Permission {

    String PUBLIC = "public";
    String AUTHENTICATED = "authenticated";

    /**
     * Parses a route declaration: {@code public}, {@code authenticated} or {@code module:action}.
     *
     * @throws IllegalArgumentException if the declaration is none of these
     */
    static RouteRequirement parse(String declaration) {
        if (declaration == null || declaration.isBlank()) {
            throw new IllegalArgumentException("route declaration must not be null or blank");
        }
        String trimmed = declaration.trim();
        if (PUBLIC.equals(trimmed)) {
            return Public.INSTANCE;
        }
        if (AUTHENTICATED.equals(trimmed)) {
            return Authenticated.INSTANCE;
        }
        return new Permission(Operation.parse(trimmed));
    }

    /** Open to everyone, signed in or not. */
    record Public() implements RouteRequirement {
        static final Public INSTANCE = new Public();
    }

    /** Open to any signed-in user. */
    record Authenticated() implements RouteRequirement {
        static final Authenticated INSTANCE = new Authenticated();
    }

    /** Requires a grant for the operation. */
    record Permission(Operation operation) implements RouteRequirement {
        public Permission {
            if (operation == null) {
                throw new IllegalArgumentException("operation must not be null");
            }
        }
    }
}
