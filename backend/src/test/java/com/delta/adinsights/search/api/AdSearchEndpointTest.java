package com.delta.adinsights.search.api;

import com.delta.adinsights.search.model.AdRecord;
import com.delta.adinsights.search.model.Cluster;
import com.delta.adinsights.search.model.ClusterSet;
import com.delta.adinsights.search.model.CombinedResult;
import com.delta.adinsights.search.model.DomainFailure;
import com.delta.adinsights.search.model.Language;
import com.delta.adinsights.search.model.LanguagesResponse;
import com.delta.adinsights.search.model.Location;
import com.delta.adinsights.search.model.LocationsResponse;
import com.delta.adinsights.search.model.PhraseInfo;
import com.delta.adinsights.search.model.SearchRequest;
import com.delta.adinsights.search.provider.ProviderException;
import com.delta.adinsights.search.service.AdSearchService;
import com.delta.adinsights.search.service.AllDomainsFailedException;
import com.delta.adinsights.search.service.SearchValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.context.WebApplicationContext;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@ActiveProfiles("test")
class AdSearchEndpointTest {

    @Autowired
    private WebApplicationContext context;

    @MockBean
    private AdSearchService searchService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        this.mockMvc = MockMvcBuilders.webAppContextSetup(context).build();
    }

    @Test
    void searchReturnsCombinedResult() throws Exception {
        AdRecord ad = new AdRecord("ads_search", 1, 1, "AR1", "CR1", "Liven", "https://ad/CR1", true, "text",
            null, null, null, null);
        ClusterSet clustering = new ClusterSet(
            List.of(new Cluster(0, "Anger", List.of(new PhraseInfo("anger control", "Liven", "https://ad/CR1", "CR1")))),
            List.of(),
            1,
            null
        );
        when(searchService.search(any())).thenReturn(new CombinedResult(
            List.of("theliven.com"), 1, List.of(ad), clustering, 2,
            List.of(new DomainFailure("calm.com", 500, "Provider error (HTTP 500)"))
        ));

        mockMvc.perform(post("/api/ads/search")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"domains\":[\"theliven.com\",\"calm.com\"],\"depth\":20,\"locationCode\":2826,\"language\":\"en\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.domains[0]").value("theliven.com"))
            .andExpect(jsonPath("$.adsCount").value(1))
            .andExpect(jsonPath("$.ads[0].creativeId").value("CR1"))
            .andExpect(jsonPath("$.clustering.clusters[0].size").value(1))
            .andExpect(jsonPath("$.requestedDomains").value(2))
            .andExpect(jsonPath("$.failedDomains[0].domain").value("calm.com"));

        ArgumentCaptor<SearchRequest> captor = ArgumentCaptor.forClass(SearchRequest.class);
        verify(searchService).search(captor.capture());
        assertThat(captor.getValue().domains()).containsExactly("theliven.com", "calm.com");
        assertThat(captor.getValue().depth()).isEqualTo(20);
        assertThat(captor.getValue().locationCode()).isEqualTo(2826);
        assertThat(captor.getValue().language()).isEqualTo("en");
    }

    @Test
    void validationFailureIsBadRequest() throws Exception {
        when(searchService.search(any())).thenThrow(new SearchValidationException("Please enter at least one domain"));

        mockMvc.perform(post("/api/ads/search")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"domains\":[]}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("validation_error"))
            .andExpect(jsonPath("$.message").value("Please enter at least one domain"));
    }

    @Test
    void allDomainsFailedIsBadGateway() throws Exception {
        when(searchService.search(any())).thenThrow(new AllDomainsFailedException(List.of(
            new DomainFailure("a.com", 429, "Provider rate limit exceeded (HTTP 429)")
        )));

        mockMvc.perform(post("/api/ads/search")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"domains\":[\"a.com\"]}"))
            .andExpect(status().isBadGateway())
            .andExpect(jsonPath("$.error").value("all_domains_failed"))
            .andExpect(jsonPath("$.message")
                .value("Failed to fetch ads for all 1 requested domain(s): Provider rate limit exceeded (HTTP 429)"));
    }

    @Test
    void searchIsPostOnly() throws Exception {
        mockMvc.perform(get("/api/ads/search"))
            .andExpect(status().isMethodNotAllowed());
    }

    @Test
    void locationsAndLanguagesAreListed() throws Exception {
        when(searchService.locations()).thenReturn(new LocationsResponse(List.of(
            new Location(2840, "United States", "US")
        )));
        when(searchService.languages()).thenReturn(new LanguagesResponse(List.of(
            new Language("en", "English")
        )));

        mockMvc.perform(get("/api/ads/locations"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.locations[0].locationCode").value(2840))
            .andExpect(jsonPath("$.locations[0].countryIsoCode").value("US"));
        mockMvc.perform(get("/api/ads/languages"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.languages[0].code").value("en"));
    }

    @Test
    void lookupProviderFailureIsBadGateway() throws Exception {
        when(searchService.languages()).thenThrow(new ProviderException(null, "Provider unreachable"));

        mockMvc.perform(get("/api/ads/languages"))
            .andExpect(status().isBadGateway())
            .andExpect(jsonPath("$.error").value("provider_error"))
            .andExpect(jsonPath("$.message").value("Provider unreachable"));
    }
}
