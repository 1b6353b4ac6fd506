package com.atrium.authorization.store;

import com.atrium.authorization.Operation;
import com.atrium.authorization.Scope;

/**
 * One (module, action, scope) entry attached to a role.
 * <p>
 * Rows come from an external store and are not validated here; the resolver ignores grants whose
 * operation is outside the catalog or whose scope is missing.
 *
 * @param module module name
 * @param action action name
 * @param scope  granted scope
 */
public record PermissionGrant(String module, String action, Scope scope) {

    public static PermissionGrant of(Operation operation, Scope scope) {
        return new PermissionGrant(operation.module(), operation.action(), scope);
    }

    public boolean matches(Operation operation) {
        return operation.module().equals(module) && operation.action().equals(action);
    }
}
