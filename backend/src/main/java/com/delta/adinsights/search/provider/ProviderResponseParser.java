package com.delta.adinsights.search.provider;

import com.delta.adinsights.search.model.AdRecord;
import com.delta.adinsights.search.model.AdTextContent;
import com.delta.adinsights.search.model.Cluster;
import com.delta.adinsights.search.model.ClusterSet;
import com.delta.adinsights.search.model.CombinedResult;
import com.delta.adinsights.search.model.DomainResult;
import com.delta.adinsights.search.model.Language;
import com.delta.adinsights.search.model.Location;
import com.delta.adinsights.search.model.PhraseInfo;
import com.delta.adinsights.search.model.PreviewImage;
import com.delta.adinsights.search.util.DomainNormalizer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Decodes provider JSON (snake_case) into the search records. Optional scalars decode to
 * {@code null}, absent lists to empty lists, and an absent or {@code null} clustering block to a
 * {@code null} cluster set. Structurally wrong payloads raise {@link ProviderException}.
 */
@Component
public class ProviderResponseParser {
    private final ObjectMapper objectMapper;

    public ProviderResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public DomainResult parseDomainResult(String body, String requestedDomain) {
        JsonNode root = readObject(body);
        List<AdRecord> ads = parseAds(root.get("ads"));
        ClusterSet clustering = parseOptionalClusterSet(root.get("clustering"));
        return new DomainResult(requestedDomain, ads, clustering);
    }

    public CombinedResult parseUnifiedResult(String body, List<String> requestedDomains) {
        JsonNode root = readObject(body);
        JsonNode domainsNode = root.get("domains");
        List<String> domains = new ArrayList<>();
        if (isAbsent(domainsNode)) {
            domains.addAll(requestedDomains);
        } else if (domainsNode.isArray()) {
            for (JsonNode node : domainsNode) {
                String domain = DomainNormalizer.normalize(node.asText(""));
                if (!domain.isEmpty()) {
                    domains.add(domain);
                }
            }
        } else {
            throw malformed("'domains' is not an array");
        }
        List<AdRecord> ads = parseAds(root.get("ads"));
        ClusterSet clustering = parseOptionalClusterSet(root.get("clustering"));
        return new CombinedResult(domains, ads.size(), ads, clustering, requestedDomains.size(), List.of());
    }

    public List<Location> parseLocations(String body) {
        JsonNode root = readObject(body);
        JsonNode items = root.get("locations");
        if (isAbsent(items)) {
            return List.of();
        }
        if (!items.isArray()) {
            throw malformed("'locations' is not an array");
        }
        List<Location> locations = new ArrayList<>();
        for (JsonNode item : items) {
            Integer code = intOrNull(item, "location_code");
            String name = textOrNull(item, "location_name");
            if (code == null || name == null) {
                continue;
            }
            String iso = textOrNull(item, "country_iso_code");
            locations.add(new Location(code, name, iso == null ? "" : iso));
        }
        return locations;
    }

    public List<Language> parseLanguages(String body) {
        JsonNode root = readObject(body);
        JsonNode items = root.get("languages");
        if (isAbsent(items)) {
            return List.of();
        }
        if (!items.isArray()) {
            throw malformed("'languages' is not an array");
        }
        List<Language> languages = new ArrayList<>();
        for (JsonNode item : items) {
            String code = textOrNull(item, "code");
            if (code == null) {
                continue;
            }
            String name = textOrNull(item, "name");
            languages.add(new Language(code, name == null ? code : name));
        }
        return languages;
    }

    /**
     * Human readable error from a provider error body ({@code {"detail": ...}}), or {@code null}
     * when the body carries none.
     */
    public String extractDetail(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            return null;
        }
        if (root == null || !root.isObject()) {
            return null;
        }
        JsonNode detail = root.get("detail");
        if (isAbsent(detail)) {
            return null;
        }
        if (detail.isTextual()) {
            String text = detail.asText().trim();
            return text.isEmpty() ? null : text;
        }
        if (detail.isArray()) {
            List<String> parts = new ArrayList<>();
            for (JsonNode item : detail) {
                String msg = item.isTextual() ? item.asText() : textOrNull(item, "msg");
                if (msg != null && !msg.isBlank()) {
                    parts.add(msg.trim());
                }
            }
            return parts.isEmpty() ? null : String.join("; ", parts);
        }
        return null;
    }

    private List<AdRecord> parseAds(JsonNode adsNode) {
        if (isAbsent(adsNode)) {
            return List.of();
        }
        if (!adsNode.isArray()) {
            throw malformed("'ads' is not an array");
        }
        List<AdRecord> ads = new ArrayList<>(adsNode.size());
        for (JsonNode item : adsNode) {
            if (!item.isObject()) {
                throw malformed("ad entry is not an object");
            }
            ads.add(new AdRecord(
                textOrNull(item, "type"),
                intOrNull(item, "rank_group"),
                intOrNull(item, "rank_absolute"),
                textOrNull(item, "advertiser_id"),
                textOrNull(item, "creative_id"),
                textOrNull(item, "title"),
                textOrNull(item, "url"),
                booleanOrNull(item, "verified"),
                textOrNull(item, "format"),
                parsePreviewImage(item.get("preview_image")),
                textOrNull(item, "first_shown"),
                textOrNull(item, "last_shown"),
                parseTextContent(item.get("text_content"))
            ));
        }
        return ads;
    }

    private PreviewImage parsePreviewImage(JsonNode node) {
        if (isAbsent(node) || !node.isObject()) {
            return null;
        }
        return new PreviewImage(textOrNull(node, "url"), intOrNull(node, "width"), intOrNull(node, "height"));
    }

    private AdTextContent parseTextContent(JsonNode node) {
        if (isAbsent(node) || !node.isObject()) {
            return null;
        }
        return new AdTextContent(
            textOrNull(node, "headline"),
            textOrNull(node, "description"),
            textList(node.get("sitelinks")),
            textOrNull(node, "raw_text"),
            textList(node.get("keyphrases")),
            textOrNull(node, "detected_language"),
            textOrNull(node, "error")
        );
    }

    private ClusterSet parseOptionalClusterSet(JsonNode node) {
        if (isAbsent(node)) {
            return null;
        }
        if (!node.isObject()) {
            throw malformed("'clustering' is neither an object nor null");
        }
        List<Cluster> clusters = new ArrayList<>();
        JsonNode clustersNode = node.get("clusters");
        if (!isAbsent(clustersNode)) {
            if (!clustersNode.isArray()) {
                throw malformed("'clusters' is not an array");
            }
            int position = 0;
            for (JsonNode clusterNode : clustersNode) {
                if (!clusterNode.isObject()) {
                    throw malformed("cluster entry is not an object");
                }
                Integer id = intOrNull(clusterNode, "id");
                String name = textOrNull(clusterNode, "name");
                clusters.add(new Cluster(
                    id == null ? position : id,
                    name == null ? "" : name,
                    parsePhrases(clusterNode.get("phrases"))
                ));
                position++;
            }
        }
        List<PhraseInfo> unclustered = parsePhrases(node.get("unclustered"));
        Integer totalPhrases = intOrNull(node, "total_phrases");
        if (totalPhrases == null) {
            int counted = unclustered.size();
            for (Cluster cluster : clusters) {
                counted += cluster.size();
            }
            totalPhrases = counted;
        }
        return new ClusterSet(clusters, unclustered, totalPhrases, textOrNull(node, "error"));
    }

    private List<PhraseInfo> parsePhrases(JsonNode node) {
        if (isAbsent(node)) {
            return List.of();
        }
        if (!node.isArray()) {
            throw malformed("phrase list is not an array");
        }
        List<PhraseInfo> phrases = new ArrayList<>(node.size());
        for (JsonNode item : node) {
            if (item.isTextual()) {
                phrases.add(new PhraseInfo(item.asText(), null, null, null));
                continue;
            }
            String phrase = textOrNull(item, "phrase");
            if (phrase == null) {
                continue;
            }
            phrases.add(new PhraseInfo(
                phrase,
                textOrNull(item, "ad_title"),
                textOrNull(item, "ad_url"),
                textOrNull(item, "creative_id")
            ));
        }
        return phrases;
    }

    private JsonNode readObject(String body) {
        if (body == null || body.isBlank()) {
            throw malformed("empty body");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new ProviderException(null, "Malformed provider response: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw malformed("top-level value is not an object");
        }
        return root;
    }

    private static ProviderException malformed(String reason) {
        return new ProviderException(null, "Malformed provider response: " + reason);
    }

    private static boolean isAbsent(JsonNode node) {
        return node == null || node.isNull() || node.isMissingNode();
    }

    private static String textOrNull(JsonNode parent, String field) {
        JsonNode node = parent.get(field);
        if (isAbsent(node) || node.isContainerNode()) {
            return null;
        }
        return node.asText();
    }

    private static Integer intOrNull(JsonNode parent, String field) {
        JsonNode node = parent.get(field);
        if (isAbsent(node) || !node.canConvertToInt() || !node.isNumber()) {
            return null;
        }
        return node.intValue();
    }

    private static Boolean booleanOrNull(JsonNode parent, String field) {
        JsonNode node = parent.get(field);
        if (isAbsent(node) || !node.isBoolean()) {
            return null;
        }
        return node.booleanValue();
    }

    private static List<String> textList(JsonNode node) {
        if (isAbsent(node) || !node.isArray()) {
            return List.of();
        }
        List<String> values = new ArrayList<>(node.size());
        for (JsonNode item : node) {
            if (item.isValueNode() && !item.isNull()) {
                values.add(item.asText());
            }
        }
        return values;
    }
}
