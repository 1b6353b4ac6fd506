package com.atrium.authorization;

/**
 * Outcome of an authorization check: either {@link Allow} with the resolved scope or
 * {@link Deny} with a reason.
 */
public sealed interface Decision permits Decision.Allow, Decision.Deny {

    boolean allowed();

    static Allow allow(Scope scope, String ownerId) {
        return new Allow(scope, ownerId);
    }

    static Deny deny(DenyReason reason) {
        return new Deny(reason);
    }

    /**
     * The operation is permitted within {@code scope}.
     *
     * @param scope   resolved scope
     * @param ownerId id of the principal, used as the owner when {@code scope} is {@link Scope#OWN}
     */
    record Allow(Scope scope, String ownerId) implements Decision {

        public Allow {
            if (scope == null) {
                throw new IllegalArgumentException("scope must not be null");
            }
            if (ownerId == null || ownerId.isBlank()) {
                throw new IllegalArgumentException("ownerId must not be null or blank");
            }
        }

        @Override
        public boolean allowed() {
            return true;
        }

        /**
         * The filter the data-access layer must apply for this decision.
         */
        public ScopeFilter scopeFilter() {
            return scope == Scope.FULL ? ScopeFilter.full() : ScopeFilter.own(ownerId);
        }
    }

    /**
     * The operation is refused.
     *
     * @param reason why, for logs and audit
     */
    record Deny(DenyReason reason) implements Decision {

        public Deny {
            if (reason == null) {
                throw new IllegalArgumentException("reason must not be null");
            }
        }

        @Override
        public boolean allowed() {
            return false;
        }
    }
}
