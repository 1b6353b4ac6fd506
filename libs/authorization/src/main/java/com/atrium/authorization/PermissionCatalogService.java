package com.atrium.authorization;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Administrative view of the permission catalog, for role management screens.
 * <p>
 * Listing the catalog is itself an operation: callers must hold the manage operation
 * (by default {@code user_management:read}).
 */
public final class PermissionCatalogService {

    private static final Logger log = LoggerFactory.getLogger(PermissionCatalogService.class);

    /** Operation guarding the catalog listing unless configured otherwise. */
    public static final Operation DEFAULT_MANAGE_OPERATION = Operation.of("user_management", "read");

    private final AuthorizationEngine engine;
    private final Operation manageOperation;

    public PermissionCatalogService(AuthorizationEngine engine) {
        this(engine, DEFAULT_MANAGE_OPERATION);
    }

    public PermissionCatalogService(AuthorizationEngine engine, Operation manageOperation) {
        if (engine == null) {
            throw new IllegalArgumentException("engine must not be null");
        }
        if (manageOperation == null) {
            throw new IllegalArgumentException("manageOperation must not be null");
        }
        if (!engine.catalog().isValidOperation(manageOperation)) {
            throw new IllegalArgumentException("manageOperation '%s' is not in the catalog".formatted(manageOperation));
        }
        this.engine = engine;
        this.manageOperation = manageOperation;
    }

    /**
     * Lists every module with its actions, modules and actions sorted ascending.
     *
     * @throws AuthorizationDeniedException if the principal may not manage permissions
     */
    public List<ModuleDescriptor> listModules(Principal principal) {
        Decision decision = engine.authorize(principal, manageOperation);
        if (decision instanceof Decision.Deny deny) {
            log.debug("User {} may not list the permission catalog: {}", principal.userId(), deny.reason().code());
            throw new AuthorizationDeniedException(manageOperation, deny.reason());
        }
        return engine.catalog().listModules();
    }

    public Operation manageOperation() {
        return manageOperation;
    }
}
