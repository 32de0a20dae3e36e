package org.argus.attribution;

/**
 * An attribution hit: the address belongs to a tracked organization.
 */
public record Attribution(String orgId, String platform, String dataset) {
}
