/**
 * Bitemporal satellite storage. Every change to an entity is a new immutable {@link
 * com.onevault.versioning.Version}; nothing is updated in place or deleted.
 */
package com.onevault.versioning;
