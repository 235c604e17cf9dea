package com.geoipapi.lookup;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.base.MoreObjects;
import java.util.Objects;
import java.util.Optional;
import javax.annotation.ParametersAreNonnullByDefault;

/**
 * The location fields served for one address. Fields the record does not
 * carry are empty and left out of the JSON rendering.
 */
@ParametersAreNonnullByDefault
@JsonInclude(JsonInclude.Include.NON_ABSENT)
public final class LookupResult {
    private static final String LANGUAGE = "en";

    @JsonProperty("ip")
    public final String ip;
    @JsonProperty("city")
    public final Optional<String> city;
    @JsonProperty("subdivision")
    public final Optional<String> subdivision;
    @JsonProperty("country")
    public final Optional<String> country;
    @JsonProperty("country_code")
    public final Optional<String> countryCode;
    @JsonProperty("continent")
    public final Optional<String> continent;
    @JsonProperty("continent_code")
    public final Optional<String> continentCode;
    @JsonProperty("latitude")
    public final Optional<Double> latitude;
    @JsonProperty("longitude")
    public final Optional<Double> longitude;
    @JsonProperty("timezone")
    public final Optional<String> timezone;
    @JsonProperty("accuracy_radius")
    public final Optional<Integer> accuracyRadius;

    LookupResult(final String ip,
                 final Optional<String> city,
                 final Optional<String> subdivision,
                 final Optional<String> country,
                 final Optional<String> countryCode,
                 final Optional<String> continent,
                 final Optional<String> continentCode,
                 final Optional<Double> latitude,
                 final Optional<Double> longitude,
                 final Optional<String> timezone,
                 final Optional<Integer> accuracyRadius) {
        this.ip = Objects.requireNonNull(ip);
        this.city = Objects.requireNonNull(city);
        this.subdivision = Objects.requireNonNull(subdivision);
        this.country = Objects.requireNonNull(country);
        this.countryCode = Objects.requireNonNull(countryCode);
        this.continent = Objects.requireNonNull(continent);
        this.continentCode = Objects.requireNonNull(continentCode);
        this.latitude = Objects.requireNonNull(latitude);
        this.longitude = Objects.requireNonNull(longitude);
        this.timezone = Objects.requireNonNull(timezone);
        this.accuracyRadius = Objects.requireNonNull(accuracyRadius);
    }

    /**
     * Projects a city-style record. Names are taken in English; a field of
     * the wrong type is treated as absent.
     *
     * @param ip     the address as the client wrote it
     * @param record the decoded record
     * @return the projection
     */
    public static LookupResult fromRecord(final String ip, final ObjectNode record) {
        final JsonNode location = record.path("location");
        final JsonNode country = record.path("country");
        final JsonNode continent = record.path("continent");
        return new LookupResult(
                ip,
                text(record.path("city").path("names").path(LANGUAGE)),
                text(record.path("subdivisions").path(0).path("names").path(LANGUAGE)),
                text(country.path("names").path(LANGUAGE)),
                text(country.path("iso_code")),
                text(continent.path("names").path(LANGUAGE)),
                text(continent.path("code")),
                number(location.path("latitude")),
                number(location.path("longitude")),
                text(location.path("time_zone")),
                location.path("accuracy_radius").canConvertToInt()
                        ? Optional.of(location.path("accuracy_radius").intValue())
                        : Optional.empty());
    }

    private static Optional<String> text(final JsonNode node) {
        return node.isTextual() ? Optional.of(node.textValue()) : Optional.empty();
    }

    private static Optional<Double> number(final JsonNode node) {
        return node.isNumber() ? Optional.of(node.doubleValue()) : Optional.empty();
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof LookupResult)) {
            return false;
        }
        final LookupResult other = (LookupResult) o;
        return ip.equals(other.ip)
                && city.equals(other.city)
                && subdivision.equals(other.subdivision)
                && country.equals(other.country)
                && countryCode.equals(other.countryCode)
                && continent.equals(other.continent)
                && continentCode.equals(other.continentCode)
                && latitude.equals(other.latitude)
                && longitude.equals(other.longitude)
                && timezone.equals(other.timezone)
                && accuracyRadius.equals(other.accuracyRadius);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ip, city, subdivision, country, countryCode, continent, continentCode,
                            latitude, longitude, timezone, accuracyRadius);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .omitNullValues()
                .add("ip", ip)
                .add("city", city.orElse(null))
                .add("subdivision", subdivision.orElse(null))
                .add("country", country.orElse(null))
                .add("countryCode", countryCode.orElse(null))
                .add("continent", continent.orElse(null))
                .add("continentCode", continentCode.orElse(null))
                .add("latitude", latitude.orElse(null))
                .add("longitude", longitude.orElse(null))
                .add("timezone", timezone.orElse(null))
                .add("accuracyRadius", accuracyRadius.orElse(null))
                .toString();
    }
}
