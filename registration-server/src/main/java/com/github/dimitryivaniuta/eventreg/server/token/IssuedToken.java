package com.github.dimitryivaniuta.eventreg.server.token;

/** A serialized token together with the claims it carries. */
public record IssuedToken(String token, Claims claims) {
}
