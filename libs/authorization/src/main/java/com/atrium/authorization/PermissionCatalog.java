package com.atrium.authorization;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Static registry of the (module, action) pairs the platform understands.
 * <p>
 * Built once at startup and immutable afterwards. Any operation outside the catalog is an
 * "unknown operation": it never matches a grant and is denied unconditionally by
 * {@link AuthorizationEngine}. Names are matched exactly.
 */
public final class PermissionCatalog {

    /** Actions every module of the default catalog supports. */
    public static final List<String> STANDARD_ACTIONS =
            List.of("create", "read", "update", "delete", "export");

    /** Modules of the default school platform catalog. */
    public static final List<String> DEFAULT_MODULES = List.of(
            "tenant_management",
            "school_config",
            "user_management",
            "students",
            "admissions",
            "fees",
            "attendance_students",
            "attendance_staff",
            "timetable",
            "exams",
            "communication",
            "transport",
            "library",
            "hostel",
            "hr_payroll",
            "inventory",
            "lms",
            "analytics",
            "technical_ops",
            "data_export");

    private static final PermissionCatalog DEFAULTS = createDefaults();

    private final Map<String, Set<String>> actionsByModule;
    private final List<ModuleDescriptor> listing;

    private PermissionCatalog(Map<String, ? extends Collection<String>> modules) {
        Map<String, Set<String>> copy = new TreeMap<>();
        List<ModuleDescriptor> descriptors = new ArrayList<>();
        for (Map.Entry<String, ? extends Collection<String>> entry : new TreeMap<>(modules).entrySet()) {
            String module = entry.getKey();
            if (module == null || module.isBlank()) {
                throw new IllegalArgumentException("module name must not be null or blank");
            }
            if (entry.getValue() == null || entry.getValue().isEmpty()) {
                throw new IllegalArgumentException("module '%s' must declare at least one action".formatted(module));
            }
            Set<String> actions = new TreeSet<>();
            for (String action : entry.getValue()) {
                if (action == null || action.isBlank()) {
                    throw new IllegalArgumentException("module '%s' declares a blank action".formatted(module));
                }
                actions.add(action);
            }
            copy.put(module, Collections.unmodifiableSet(actions));
            descriptors.add(new ModuleDescriptor(module, List.copyOf(actions)));
        }
        this.actionsByModule = Collections.unmodifiableMap(copy);
        this.listing = List.copyOf(descriptors);
    }

    /**
     * Creates a catalog from a module-to-actions map.
     *
     * @param modules module names mapped to the actions they support
     * @return the immutable catalog
     * @throws IllegalArgumentException if a module or action name is blank or a module has no actions
     */
    public static PermissionCatalog of(Map<String, ? extends Collection<String>> modules) {
        if (modules == null || modules.isEmpty()) {
            throw new IllegalArgumentException("catalog must declare at least one module");
        }
        return new PermissionCatalog(modules);
    }

    /**
     * The default catalog: every module in {@link #DEFAULT_MODULES} with the
     * {@link #STANDARD_ACTIONS}.
     */
    public static PermissionCatalog defaults() {
        return DEFAULTS;
    }

    private static PermissionCatalog createDefaults() {
        Map<String, List<String>> modules = new TreeMap<>();
        for (String module : DEFAULT_MODULES) {
            modules.put(module, STANDARD_ACTIONS);
        }
        return new PermissionCatalog(modules);
    }

    /**
     * Checks whether the (module, action) pair is part of the catalog.
     */
    public boolean isValidOperation(String module, String action) {
        if (module == null || action == null) {
            return false;
        }
        Set<String> actions = actionsByModule.get(module);
        return actions != null && actions.contains(action);
    }

    public boolean isValidOperation(Operation operation) {
        return operation != null && isValidOperation(operation.module(), operation.action());
    }

    /**
     * Lists every module with its actions, modules and actions both in ascending order.
     *
     * @return immutable listing, identical on every call
     */
    public List<ModuleDescriptor> listModules() {
        return listing;
    }

    /**
     * Returns every operation in the catalog, in listing order.
     */
    public List<Operation> operations() {
        List<Operation> operations = new ArrayList<>();
        for (ModuleDescriptor descriptor : listing) {
            for (String action : descriptor.actions()) {
                operations.add(new Operation(descriptor.module(), action));
            }
        }
        return List.copyOf(operations);
    }

    /** Number of modules in the catalog. */
    public int size() {
        return actionsByModule.size();
    }
}
