package com.delta.adinsights.search.model;

import java.util.List;

public record LocationsResponse(List<Location> locations) {
}
