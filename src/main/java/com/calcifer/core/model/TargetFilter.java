package com.calcifer.core.model;

import com.calcifer.core.registry.ConfigException;

/**
 * Restricts a run to hosts matching a selector. A host matches when its
 * name equals the selector or when it belongs to a group of that name.
 * The selector comes from the command line, so a blank one is a {@link ConfigException}.
 */
public record TargetFilter(String selector) {

    public TargetFilter {
        if (selector == null || selector.isBlank()) {
            throw new ConfigException("Target selector must not be blank");
        }
        selector = selector.trim();
    }

    public boolean matches(Host host) {
        return host.name().equals(selector) || host.memberOf(new HostGroup(selector));
    }
}
