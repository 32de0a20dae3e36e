package org.argus.filter;

import java.util.Collection;
import java.util.HashSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Exclusion settings for {@link ResultFilter}. Values are normalized once here: countries upper case,
 * everything textual else lower case, ASNs as given.
 */
public record FilterCriteria(Set<String> excludedCountries,
                             Set<String> excludedCities,
                             Set<Long> excludedAsns,
                             Set<String> excludedOrgs,
                             boolean excludeOrgManaged,
                             boolean excludeNotOrgManaged,
                             Set<String> excludedPlatforms,
                             Set<String> excludedOrgIds) {

    public FilterCriteria {
        excludedCountries = normalize(excludedCountries, true);
        excludedCities = normalize(excludedCities, false);
        excludedAsns = excludedAsns == null ? Set.of() : excludedAsns.stream()
                .filter(Objects::nonNull)
                .collect(Collectors.toUnmodifiableSet());
        excludedOrgs = normalize(excludedOrgs, false);
        excludedPlatforms = normalize(excludedPlatforms, false);
        excludedOrgIds = normalize(excludedOrgIds, false);
    }

    public static FilterCriteria none() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isEmpty() {
        return excludedCountries.isEmpty() && excludedCities.isEmpty() && excludedAsns.isEmpty()
                && excludedOrgs.isEmpty() && !excludeOrgManaged && !excludeNotOrgManaged
                && excludedPlatforms.isEmpty() && excludedOrgIds.isEmpty();
    }

    private static Set<String> normalize(Collection<String> values, boolean upper) {
        if (values == null) return Set.of();
        return values.stream()
                .filter(value -> value != null && !value.isBlank())
                .map(String::trim)
                .map(value -> upper ? value.toUpperCase(Locale.ROOT) : value.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    public static final class Builder {
        private Collection<String> countries = Set.of();
        private Collection<String> cities = Set.of();
        private Collection<Long> asns = Set.of();
        private Collection<String> orgs = Set.of();
        private boolean orgManaged;
        private boolean notOrgManaged;
        private Collection<String> platforms = Set.of();
        private Collection<String> orgIds = Set.of();

        private Builder() {
        }

        public Builder excludeCountries(Collection<String> countries) {
            this.countries = countries;
            return this;
        }

        public Builder excludeCities(Collection<String> cities) {
            this.cities = cities;
            return this;
        }

        public Builder excludeAsns(Collection<Long> asns) {
            this.asns = asns;
            return this;
        }

        public Builder excludeOrgs(Collection<String> orgs) {
            this.orgs = orgs;
            return this;
        }

        public Builder excludeOrgManaged(boolean orgManaged) {
            this.orgManaged = orgManaged;
            return this;
        }

        public Builder excludeNotOrgManaged(boolean notOrgManaged) {
            this.notOrgManaged = notOrgManaged;
            return this;
        }

        public Builder excludePlatforms(Collection<String> platforms) {
            this.platforms = platforms;
            return this;
        }

        public Builder excludeOrgIds(Collection<String> orgIds) {
            this.orgIds = orgIds;
            return this;
        }

        public FilterCriteria build() {
            return new FilterCriteria(copy(countries), copy(cities), copy(asns), copy(orgs), orgManaged,
                    notOrgManaged, copy(platforms), copy(orgIds));
        }

        private static <T> Set<T> copy(Collection<T> values) {
            return values == null ? Set.of() : new HashSet<>(values);
        }
    }
}
