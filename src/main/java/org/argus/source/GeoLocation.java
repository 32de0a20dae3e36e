package org.argus.source;

public record GeoLocation(String city, String region, String country, String isoCode, String postal) {
}
