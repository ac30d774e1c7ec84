package com.github.dimitryivaniuta.eventreg.server.web;

/** Result of a delete operation. */
public record DeleteResponse(long deleted) {
}
