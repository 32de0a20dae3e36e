package org.argus;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;
import java.util.Optional;

/**
 * One enriched address. Either a populated record or an error record; an error record carries the
 * address and the error and nothing else.
 */
@JsonPropertyOrder({"ip", "domain", "city", "region", "country", "iso_code", "postal", "asn", "asn_org",
        "org_managed", "org_id", "platform", "proxy_type", "isp", "usage_type", "error"})
public record EnrichedRecord(@JsonProperty("ip") String address,
                             String domain,
                             String city,
                             String region,
                             String country,
                             @JsonProperty("iso_code") String isoCode,
                             String postal,
                             Long asn,
                             @JsonProperty("asn_org") String asnOrg,
                             @JsonProperty("proxy_type") String proxyType,
                             String isp,
                             @JsonProperty("usage_type") String usageType,
                             @JsonProperty("org_managed") boolean orgManaged,
                             @JsonProperty("org_id") String orgId,
                             String platform,
                             String error) {

    public EnrichedRecord {
        Objects.requireNonNull(address, "address");
    }

    public static EnrichedRecord failure(String address, String error) {
        return new EnrichedRecord(address, null, null, null, null, null, null, null, null, null, null, null,
                false, null, null, Objects.requireNonNull(error, "error"));
    }

    public static Builder builder(String address) {
        return new Builder(address);
    }

    @JsonIgnore
    public boolean hasError() {
        return error != null;
    }

    @JsonIgnore
    public boolean hasProxyInfo() {
        return proxyType != null;
    }

    public Optional<String> locationDisplay() {
        final var parts = new StringBuilder();
        for (var part : new String[]{city, country}) {
            if (part == null || part.isBlank()) continue;
            if (parts.length() > 0) parts.append(", ");
            parts.append(part);
        }
        return parts.length() == 0 ? Optional.empty() : Optional.of(parts.toString());
    }

    public Optional<String> asnDisplay() {
        if (asn == null && asnOrg == null) return Optional.empty();
        if (asn == null) return Optional.of("(" + asnOrg + ")");
        return Optional.of(asnOrg == null ? "AS" + asn : "AS" + asn + " (" + asnOrg + ")");
    }

    public static final class Builder {
        private final String address;
        private String domain;
        private String city;
        private String region;
        private String country;
        private String isoCode;
        private String postal;
        private Long asn;
        private String asnOrg;
        private String proxyType;
        private String isp;
        private String usageType;
        private boolean orgManaged;
        private String orgId;
        private String platform;

        private Builder(String address) {
            this.address = address;
        }

        public Builder domain(String domain) {
            this.domain = domain;
            return this;
        }

        public Builder city(String city) {
            this.city = city;
            return this;
        }

        public Builder region(String region) {
            this.region = region;
            return this;
        }

        public Builder country(String country) {
            this.country = country;
            return this;
        }

        public Builder isoCode(String isoCode) {
            this.isoCode = isoCode;
            return this;
        }

        public Builder postal(String postal) {
            this.postal = postal;
            return this;
        }

        public Builder asn(Long asn) {
            this.asn = asn;
            return this;
        }

        public Builder asnOrg(String asnOrg) {
            this.asnOrg = asnOrg;
            return this;
        }

        public Builder proxy(String proxyType, String isp, String usageType) {
            this.proxyType = proxyType;
            this.isp = isp;
            this.usageType = usageType;
            return this;
        }

        public Builder attribution(String orgId, String platform) {
            this.orgManaged = true;
            this.orgId = orgId;
            this.platform = platform;
            return this;
        }

        public String domain() {
            return domain;
        }

        public EnrichedRecord build() {
            return new EnrichedRecord(address, domain, city, region, country, isoCode, postal, asn, asnOrg,
                    proxyType, isp, usageType, orgManaged, orgId, platform, null);
        }
    }
}
