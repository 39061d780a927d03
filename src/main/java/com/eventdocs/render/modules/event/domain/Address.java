package com.eventdocs.render.modules.event.domain;

import java.util.Collection;
import java.util.Locale;
import java.util.Set;

public record Address(
    String address,
    String addressSupplement,
    String postalCode,
    String location,
    String country
) {
    public static final Set<String> DEFAULT_HOME_COUNTRIES = Set.of("Germany", "Deutschland", "DE", "GER");

    public Address {
        address = address != null ? address : "";
        addressSupplement = addressSupplement != null ? addressSupplement : "";
        postalCode = postalCode != null ? postalCode : "";
        location = location != null ? location : "";
        country = country != null ? country : "";
    }

    public String fullAddress() {
        return fullAddress(DEFAULT_HOME_COUNTRIES);
    }

    /**
     * Multi-line postal block. The country line is left out for the operator's home country and for an empty country.
     */
    public String fullAddress(Collection<String> homeCountries) {
        StringBuilder sb = new StringBuilder(address);
        if (!addressSupplement.isBlank()) {
            sb.append('\n').append(addressSupplement);
        }
        sb.append('\n');
        if (!postalCode.isBlank()) {
            sb.append(postalCode).append(' ');
        }
        sb.append(location);
        if (!country.isBlank() && !isHomeCountry(homeCountries)) {
            sb.append('\n').append(country);
        }
        return sb.toString();
    }

    public boolean isHomeCountry(Collection<String> homeCountries) {
        String normalized = country.trim().toLowerCase(Locale.ROOT);
        return homeCountries.stream()
                .anyMatch(candidate -> candidate.trim().toLowerCase(Locale.ROOT).equals(normalized));
    }
}
