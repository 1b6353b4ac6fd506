package com.atrium.authorization;

/**
 * Implemented by the data-access layer: restricts a query to records owned by a user.
 * <p>
 * Example with a JPA {@code Specification}:
 * <pre>{@code
 * OwnershipFilter<Specification<Student>> owned =
 *         (where, ownerId) -> where.and((root, q, cb) -> cb.equal(root.get("createdBy"), ownerId));
 * Specification<Student> scoped = allow.scopeFilter().applyTo(base, owned);
 * }</pre>
 *
 * @param <Q> the caller's query type
 */
@FunctionalInterface
public interface OwnershipFilter<Q> {

    Q restrictToOwner(Q query, String ownerId);
}
