package com.atrium.authorization;

import java.util.List;

/**
 * One entry of the catalog listing: a module and the actions it supports, in ascending order.
 *
 * @param module  module name
 * @param actions supported actions, sorted ascending
 */
public record ModuleDescriptor(String module, List<String> actions) {

    public ModuleDescriptor {
        actions = List.copyOf(actions);
    }
}
