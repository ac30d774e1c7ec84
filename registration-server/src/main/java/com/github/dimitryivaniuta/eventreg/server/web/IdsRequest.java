package com.github.dimitryivaniuta.eventreg.server.web;

import java.util.List;

/** Body of the delete operations. */
public record IdsRequest(List<String> ids) {
}
