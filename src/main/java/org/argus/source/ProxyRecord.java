package org.argus.source;

/**
 * Raw proxy-database row. Any field may hold the reader's unknown marker {@link ProxyReader#UNKNOWN}.
 */
public record ProxyRecord(String countryCode, String proxyType, String isp, String domain, String usageType) {
}
