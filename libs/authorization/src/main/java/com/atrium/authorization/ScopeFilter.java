package com.atrium.authorization;

import java.util.Map;

/**
 * Contract handed to the data-access layer after an {@link Decision.Allow}.
 * <p>
 * {@link Full} means no ownership restriction. {@link Own} obliges the data-access collaborator
 * to restrict the query to records owned by {@link Own#ownerId()}; this core never filters data
 * itself.
 */
public sealed interface ScopeFilter permits ScopeFilter.Full, ScopeFilter.Own {

    /** Attribute key carrying the scope value. */
    String ATTR_SCOPE = "scope";

    /** Attribute key carrying the owner id of an {@link Own} filter. */
    String ATTR_OWNER_ID = "ownerId";

    Scope scope();

    /**
     * Wire form: {@code {scope: "full"}} or {@code {scope: "own", ownerId: ...}}.
     */
    Map<String, String> toAttributes();

    /**
     * Applies this filter to a query of the caller's own type.
     *
     * @param query  the query being built
     * @param filter the collaborator's ownership restriction
     * @return {@code query} unchanged for {@link Full}, the restricted query for {@link Own}
     */
    <Q> Q applyTo(Q query, OwnershipFilter<Q> filter);

    static ScopeFilter full() {
        return Full.INSTANCE;
    }

    static ScopeFilter own(String ownerId) {
        return new Own(ownerId);
    }

    /** Unrestricted access within the tenant. */
    record Full() implements ScopeFilter {

        private static final Full INSTANCE = new Full();

        @Override
        public Scope scope() {
            return Scope.FULL;
        }

        @Override
        public Map<String, String> toAttributes() {
            return Map.of(ATTR_SCOPE, Scope.FULL.value());
        }

        @Override
        public <Q> Q applyTo(Q query, OwnershipFilter<Q> filter) {
            return query;
        }
    }

    /**
     * Access restricted to records owned by {@code ownerId}.
     *
     * @param ownerId the principal's user id
     */
    record Own(String ownerId) implements ScopeFilter {

        public Own {
            if (ownerId == null || ownerId.isBlank()) {
                throw new IllegalArgumentException("ownerId must not be null or blank");
            }
        }

        @Override
        public Scope scope() {
            return Scope.OWN;
        }

        @Override
        public Map<String, String> toAttributes() {
            return Map.of(ATTR_SCOPE, Scope.OWN.value(), ATTR_OWNER_ID, ownerId);
        }

        @Override
        public <Q> Q applyTo(Q query, OwnershipFilter<Q> filter) {
            if (filter == null) {
                throw new IllegalArgumentException("filter must not be null for an ownership-restricted scope");
            }
            return filter.restrictToOwner(query, ownerId);
        }
    }
}
