package org.prw.data.identity;

/**
 * One row of the persistent identity store. Both columns are unique across the store.
 */
public record IdentityMapping(String sourceId, String pseudonymousId) {
}
