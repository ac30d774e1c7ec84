package com.github.dimitryivaniuta.eventreg.server.permission;

import com.github.dimitryivaniuta.eventreg.common.query.Field;

/**
 * The permission columns visible to a query over entity {@code F}, so authorization predicates
 * can be expressed in that entity's field set.
 *
 * @param grantee      user id column
 * @param role         role column
 * @param organization organization id column
 * @param event        event id column
 * @param <F>          field set of the queried entity
 */
public record GrantColumns<F extends Field>(F grantee, F role, F organization, F event) {
}
