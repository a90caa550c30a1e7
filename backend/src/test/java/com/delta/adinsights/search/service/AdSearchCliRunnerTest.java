package com.delta.adinsights.search.service;

import com.delta.adinsights.config.SearchProperties;
import com.delta.adinsights.search.model.CombinedResult;
import com.delta.adinsights.search.model.SearchRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.context.ConfigurableApplicationContext;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AdSearchCliRunnerTest {
    @Mock
    private AdSearchService searchService;

    @Mock
    private ConfigurableApplicationContext applicationContext;

    private SearchProperties properties;
    private AdSearchCliRunner runner;

    @BeforeEach
    void setUp() {
        properties = new SearchProperties();
        properties.getCli().setExitAfterRun(false);
        runner = new AdSearchCliRunner(properties, searchService, applicationContext);
    }

    @Test
    void doesNothingUnlessEnabled() {
        runner.run(new DefaultApplicationArguments());

        verifyNoInteractions(searchService);
    }

    @Test
    void splitsConfiguredDomainsAndRunsOneSearch() {
        properties.getCli().setRun(true);
        properties.getCli().setDomains(" theliven.com, ,calm.com ");
        properties.getCli().setDepth(30);
        properties.getCli().setLanguage("en");
        when(searchService.search(any())).thenReturn(
            new CombinedResult(List.of("theliven.com", "calm.com"), 0, List.of(), null, 2, List.of()));

        runner.run(new DefaultApplicationArguments());

        ArgumentCaptor<SearchRequest> captor = ArgumentCaptor.forClass(SearchRequest.class);
        verify(searchService).search(captor.capture());
        assertThat(captor.getValue().domains()).containsExactly("theliven.com", "calm.com");
        assertThat(captor.getValue().depth()).isEqualTo(30);
        assertThat(captor.getValue().locationCode()).isNull();
        assertThat(captor.getValue().language()).isEqualTo("en");
    }

    @Test
    void searchFailureIsLoggedNotThrown() {
        properties.getCli().setRun(true);
        properties.getCli().setDomains("");
        when(searchService.search(any())).thenThrow(new SearchValidationException("Please enter at least one domain"));

        assertThatCode(() -> runner.run(new DefaultApplicationArguments())).doesNotThrowAnyException();
    }
}
