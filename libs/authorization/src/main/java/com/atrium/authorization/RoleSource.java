package com.atrium.authorization;

/**
 * Where the decision engine takes a principal's role ids from.
 */
public enum RoleSource {

    /** Role assignments are read from the role store on every decision. */
    STORE,

    /** The role ids carried in the {@link Principal} are evaluated as-is. */
    PRINCIPAL
}
