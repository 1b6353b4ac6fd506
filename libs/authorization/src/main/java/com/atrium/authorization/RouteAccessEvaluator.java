package com.atrium.authorization;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Computes which front-end routes a user may open, from a static map of route key to
 * requirement ({@code public}, {@code authenticated} or {@code module:action}).
 * <p>
 * Declarations are parsed and checked against the catalog once, at construction. A syntactically
 * invalid declaration fails construction; a well-formed declaration naming an operation outside
 * the catalog is logged once and the route is never accessible.
 */
public final class RouteAccessEvaluator {

    private static final Logger log = LoggerFactory.getLogger(RouteAccessEvaluator.class);

    /** Route map of the school front end. */
    public static final Map<String, String> DEFAULT_ROUTES = Map.ofEntries(
            Map.entry("manageusers", "user_management:read"),
            Map.entry("permissions", "user_management:read"),
            Map.entry("rolesPermissions", "user_management:update"),
            Map.entry("deleteRequest", "user_management:delete"),
            Map.entry("studentList", "students:read"),
            Map.entry("studentDetail", "students:read"),
            Map.entry("addStudent", "students:create"),
            Map.entry("editStudent", "students:update"),
            Map.entry("studentTimeTable", "timetable:read"),
            Map.entry("studentLeaves", "attendance_students:read"),
            Map.entry("studentResult", "exams:read"),
            Map.entry("teacherList", "hr_payroll:read"),
            Map.entry("addTeacher", "hr_payroll:create"),
            Map.entry("teacherLeaves", "attendance_staff:read"),
            Map.entry("classes", "school_config:read"),
            Map.entry("classRoutine", "timetable:read"),
            Map.entry("classHomeWork", "lms:read"),
            Map.entry("examSchedule", "exams:read"),
            Map.entry("collectFees", "fees:create"),
            Map.entry("feesReport", "fees:read"),
            Map.entry("libraryBooks", "library:read"),
            Map.entry("libraryIssueBook", "library:create"),
            Map.entry("transportRoutes", "transport:read"),
            Map.entry("hostelList", "hostel:read"),
            Map.entry("payroll", "hr_payroll:read"),
            Map.entry("staffAttendance", "attendance_staff:read"),
            Map.entry("noticeBoard", "communication:read"),
            Map.entry("schoolSettings", "school_config:update"),
            Map.entry("backup", "technical_ops:read"),
            Map.entry("attendanceReport", "analytics:read"),
            Map.entry("todo", RouteRequirement.AUTHENTICATED),
            Map.entry("calendar", RouteRequirement.AUTHENTICATED),
            Map.entry("login", RouteRequirement.PUBLIC),
            Map.entry("register", RouteRequirement.PUBLIC),
            Map.entry("error404", RouteRequirement.PUBLIC));

    private final Map<String, RouteRequirement> routes;
    private final Set<String> unreachable;

    /**
     * @param routes  route key to declaration
     * @param catalog catalog the declared operations are checked against
     * @throws IllegalArgumentException if a declaration cannot be parsed
     */
    public RouteAccessEvaluator(Map<String, String> routes, PermissionCatalog catalog) {
        if (routes == null) {
            throw new IllegalArgumentException("routes must not be null");
        }
        if (catalog == null) {
            throw new IllegalArgumentException("catalog must not be null");
        }
        Map<String, RouteRequirement> parsed = new TreeMap<>();
        Set<String> unknownRoutes = new LinkedHashSet<>();
        Set<Operation> reported = new LinkedHashSet<>();
        new TreeMap<>(routes).forEach((route, declaration) -> {
            RouteRequirement requirement;
            try {
                requirement = RouteRequirement.parse(declaration);
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Invalid declaration for route '%s': %s"
                        .formatted(route, e.getMessage()), e);
            }
            if (requirement instanceof RouteRequirement.Permission permission
                    && !catalog.isValidOperation(permission.operation())) {
                unknownRoutes.add(route);
                if (reported.add(permission.operation())) {
                    log.warn("Route '{}' requires unknown operation '{}'; routes declaring it are never accessible",
                            route, permission.operation());
                }
            }
            parsed.put(route, requirement);
        });
        this.routes = Collections.unmodifiableMap(parsed);
        this.unreachable = Collections.unmodifiableSet(unknownRoutes);
    }

    /** Evaluator over {@link #DEFAULT_ROUTES}. */
    public static RouteAccessEvaluator withDefaults(PermissionCatalog catalog) {
        return new RouteAccessEvaluator(DEFAULT_ROUTES, catalog);
    }

    /**
     * Route key to accessibility for a user holding the given permissions, keys sorted.
     */
    public Map<String, Boolean> evaluate(EffectivePermissions permissions) {
        Map<String, Boolean> access = new TreeMap<>();
        routes.forEach((route, requirement) -> access.put(route, permits(requirement, route, permissions)));
        return Collections.unmodifiableMap(access);
    }

    /**
     * Route access for a principal, using the engine's view of the principal's permissions. When
     * the permissions cannot be determined only public and authenticated routes are accessible.
     */
    public Map<String, Boolean> evaluate(Principal principal, AuthorizationEngine engine) {
        return evaluate(engine.effectivePermissions(principal));
    }

    public Map<String, RouteRequirement> routes() {
        return routes;
    }

    /** Routes whose declared operation is not in the catalog. */
    public Set<String> unreachableRoutes() {
        return unreachable;
    }

    private boolean permits(RouteRequirement requirement, String route, EffectivePermissions permissions) {
        if (requirement instanceof RouteRequirement.Permission permission) {
            return !unreachable.contains(route) && permissions.allows(permission.operation());
        }
        return true;
    }
}
