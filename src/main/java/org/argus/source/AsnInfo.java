package org.argus.source;

public record AsnInfo(Long number, String organization) {
}
