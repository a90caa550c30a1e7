package com.delta.adinsights.search.model;

public record Location(int locationCode, String locationName, String countryIsoCode) {
}
