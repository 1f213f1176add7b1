/**
 * Deterministic identity for every business entity.
 *
 * <ul>
 *   <li>{@link com.onevault.identity.IdentityResolver} derives {@link com.onevault.identity.HashKey}s
 *       from (tenant key, business key) and records hub rows.
 *   <li>{@link com.onevault.identity.HubStore} is the storage port for hubs.
 *   <li>{@link com.onevault.identity.MutationListener} receives every appended hub, satellite and
 *       link row, which is how the audit module observes mutations without the stores depending
 *       on it.
 * </ul>
 */
package com.onevault.identity;
