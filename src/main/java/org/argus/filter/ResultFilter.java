package org.argus.filter;

import org.argus.EnrichedRecord;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Drops records matching any exclusion in a {@link FilterCriteria}. Error records always pass, and an
 * absent field never matches.
 */
public final class ResultFilter {
    private final FilterCriteria criteria;

    public ResultFilter(FilterCriteria criteria) {
        this.criteria = criteria;
    }

    public List<EnrichedRecord> filter(List<EnrichedRecord> records) {
        return records.stream().filter(record -> !shouldExclude(record)).toList();
    }

    public boolean shouldExclude(EnrichedRecord record) {
        if (record.hasError()) return false;
        return excludedByLocation(record) || excludedByNetwork(record) || excludedByOrganization(record);
    }

    private boolean excludedByLocation(EnrichedRecord record) {
        final var countries = criteria.excludedCountries();
        if (matchesUpper(countries, record.country()) || matchesUpper(countries, record.isoCode())) return true;
        return matchesLower(criteria.excludedCities(), record.city());
    }

    private boolean excludedByNetwork(EnrichedRecord record) {
        if (record.asn() != null && criteria.excludedAsns().contains(record.asn())) return true;
        if (record.asnOrg() == null || criteria.excludedOrgs().isEmpty()) return false;
        final var org = record.asnOrg().toLowerCase(Locale.ROOT);
        return criteria.excludedOrgs().stream().anyMatch(org::contains);
    }

    private boolean excludedByOrganization(EnrichedRecord record) {
        if (criteria.excludeOrgManaged() && record.orgManaged()) return true;
        if (criteria.excludeNotOrgManaged() && !record.orgManaged()) return true;
        return matchesLower(criteria.excludedPlatforms(), record.platform())
                || matchesLower(criteria.excludedOrgIds(), record.orgId());
    }

    private static boolean matchesUpper(Set<String> excluded, String value) {
        return value != null && excluded.contains(value.toUpperCase(Locale.ROOT));
    }

    private static boolean matchesLower(Set<String> excluded, String value) {
        return value != null && excluded.contains(value.toLowerCase(Locale.ROOT));
    }
}
