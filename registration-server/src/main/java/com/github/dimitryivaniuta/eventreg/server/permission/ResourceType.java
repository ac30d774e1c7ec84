package com.github.dimitryivaniuta.eventreg.server.permission;

/** Kind of resource a role or capability refers to. */
public enum ResourceType {
    SERVER,
    ORGANIZATION,
    EVENT
}
