package com.delta.adinsights.search.api;

import com.delta.adinsights.search.model.CombinedResult;
import com.delta.adinsights.search.model.LanguagesResponse;
import com.delta.adinsights.search.model.LocationsResponse;
import com.delta.adinsights.search.model.SearchRequest;
import com.delta.adinsights.search.service.AdSearchService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/ads")
public class AdSearchController {
    private final AdSearchService searchService;

    public AdSearchController(AdSearchService searchService) {
        this.searchService = searchService;
    }

    @PostMapping("/search")
    public CombinedResult search(@RequestBody(required = false) AdSearchApiRequest request) {
        SearchRequest searchRequest = new SearchRequest(
            request == null ? null : request.domains(),
            request == null ? null : request.depth(),
            request == null ? null : request.locationCode(),
            request == null ? null : request.language()
        );
        return searchService.search(searchRequest);
    }

    @GetMapping("/locations")
    public LocationsResponse locations() {
        return searchService.locations();
    }

    @GetMapping("/languages")
    public LanguagesResponse languages() {
        return searchService.languages();
    }
}
