package com.delta.adinsights.search.provider;

import com.delta.adinsights.config.SearchProperties;
import com.delta.adinsights.search.http.ProviderHttpClient;
import com.delta.adinsights.search.model.CombinedResult;
import com.delta.adinsights.search.model.DomainResult;
import com.delta.adinsights.search.model.HttpFetchResult;
import com.delta.adinsights.search.model.Language;
import com.delta.adinsights.search.model.Location;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.List;

/**
 * Client for the ad metadata / OCR / keyphrase provider. Every method performs exactly one HTTP
 * call and reports any failure as a {@link ProviderException}.
 */
@Service
public class AdProviderClient {
    private static final Logger log = LoggerFactory.getLogger(AdProviderClient.class);

    static final String DOMAIN_ADS_PATH = "/ads/domain/with-text";
    static final String DOMAINS_ADS_PATH = "/ads/domains/with-text";
    static final String LOCATIONS_PATH = "/ads/locations";
    static final String LANGUAGES_PATH = "/ads/languages";

    private final SearchProperties properties;
    private final ProviderHttpClient httpClient;
    private final ProviderResponseParser parser;
    private final ObjectMapper objectMapper;

    public AdProviderClient(
        SearchProperties properties,
        ProviderHttpClient httpClient,
        ProviderResponseParser parser,
        ObjectMapper objectMapper
    ) {
        this.properties = properties;
        this.httpClient = httpClient;
        this.parser = parser;
        this.objectMapper = objectMapper;
    }

    public DomainResult fetchDomainAds(String domain, int depth, int locationCode, String language) {
        ObjectNode body = baseBody(depth, locationCode);
        body.put("domain", domain);
        String url = withLanguage(properties.getProvider().normalizedBaseUrl() + DOMAIN_ADS_PATH, language);
        HttpFetchResult result = httpClient.postJson(url, write(body), properties.getRequestTimeoutSeconds());
        ensureSuccess(result);
        DomainResult domainResult = parser.parseDomainResult(result.body(), domain);
        log.debug(
            "Provider returned {} ads for {} (clustering={})",
            domainResult.ads().size(),
            domain,
            domainResult.clustering() == null ? "none" : domainResult.clustering().clusters().size()
        );
        return domainResult;
    }

    public CombinedResult fetchUnified(Collection<String> domains, int depth, int locationCode, String language) {
        ObjectNode body = baseBody(depth, locationCode);
        ArrayNode domainsNode = body.putArray("domains");
        domains.forEach(domainsNode::add);
        String url = withLanguage(properties.getProvider().normalizedBaseUrl() + DOMAINS_ADS_PATH, language);
        HttpFetchResult result = httpClient.postJson(url, write(body), properties.getRequestTimeoutSeconds());
        ensureSuccess(result);
        return parser.parseUnifiedResult(result.body(), List.copyOf(domains));
    }

    public List<Location> fetchLocations() {
        HttpFetchResult result = httpClient.get(
            properties.getProvider().normalizedBaseUrl() + LOCATIONS_PATH,
            properties.getLookupTimeoutSeconds()
        );
        ensureSuccess(result);
        return parser.parseLocations(result.body());
    }

    public List<Language> fetchLanguages() {
        HttpFetchResult result = httpClient.get(
            properties.getProvider().normalizedBaseUrl() + LANGUAGES_PATH,
            properties.getLookupTimeoutSeconds()
        );
        ensureSuccess(result);
        return parser.parseLanguages(result.body());
    }

    private ObjectNode baseBody(int depth, int locationCode) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("depth", Math.max(1, Math.min(depth, properties.getProvider().getMaxDepth())));
        body.put("location_code", locationCode);
        body.put("platform", properties.getProvider().getPlatform());
        return body;
    }

    private void ensureSuccess(HttpFetchResult result) {
        if (result.isTransportFailure()) {
            throw new ProviderException(null, transportMessage(result));
        }
        if (!result.isSuccessful()) {
            String detail = parser.extractDetail(result.body());
            throw new ProviderException(
                result.statusCode(),
                detail != null ? detail : genericMessage(result.statusCode())
            );
        }
    }

    private String write(ObjectNode body) {
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to encode provider request", e);
        }
    }

    static String withLanguage(String url, String language) {
        if (language == null || language.isBlank()) {
            return url;
        }
        return url + "?language=" + URLEncoder.encode(language.trim(), StandardCharsets.UTF_8);
    }

    static String transportMessage(HttpFetchResult result) {
        String code = result.errorCode();
        String base = switch (code) {
            case "timeout" -> "Provider request timed out";
            case "invalid_url" -> "Provider URL is invalid";
            case "interrupted" -> "Provider request was interrupted";
            default -> "Provider unreachable";
        };
        String detail = result.errorMessage();
        return detail == null || detail.isBlank() ? base : base + ": " + detail;
    }

    static String genericMessage(int statusCode) {
        if (statusCode >= 500) {
            return "Provider error (HTTP " + statusCode + ")";
        }
        return switch (statusCode) {
            case 400 -> "Provider rejected the request (HTTP 400)";
            case 401, 403 -> "Provider refused access (HTTP " + statusCode + ")";
            case 404 -> "Provider endpoint not found (HTTP 404)";
            case 408 -> "Provider request timed out (HTTP 408)";
            case 422 -> "Provider could not process the request (HTTP 422)";
            case 429 -> "Provider rate limit exceeded (HTTP 429)";
            default -> "HTTP error: " + statusCode;
        };
    }
}
