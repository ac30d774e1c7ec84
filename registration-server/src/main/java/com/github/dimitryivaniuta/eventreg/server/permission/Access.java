package com.github.dimitryivaniuta.eventreg.server.permission;

/** Level of access an operation needs, from weakest to strongest. */
public enum Access {
    READ,
    EDIT,
    ADMIN
}
