package com.example.ConfluenceAgent.client;

import com.example.ConfluenceAgent.auth.AtlassianCredential;
import com.example.ConfluenceAgent.config.ConfluenceAgentProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;
import org.springframework.web.client.RestClient;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Optional;

/**
 * Thin pass-through client for the Confluence Cloud REST API.
 * All calls are scoped to the credential's cloud id.
 */
@Component
public class ConfluenceClient {

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final String apiBase;

    public ConfluenceClient(RestClient.Builder restClientBuilder,
                            ObjectMapper objectMapper,
                            ConfluenceAgentProperties properties) {
        this.restClient = restClientBuilder.build();
        this.objectMapper = objectMapper;
        this.apiBase = properties.atlassian().confluenceApiBase();
    }

    /**
     * CQL search over page titles and bodies (REST API v1).
     */
    public ConfluenceResponse searchPages(AtlassianCredential credential, String cql, int limit) {
        return restClient.get()
                .uri(apiBase + "/{cloudId}/wiki/rest/api/content/search?cql={cql}&limit={limit}",
                        credential.cloudId(), cql, limit)
                .headers(AtlassianHeaders.bearer(credential.accessToken()))
                .exchange((request, response) -> toResponse(response));
    }

    /**
     * Page with its storage-format body (REST API v2).
     */
    public ConfluenceResponse getPage(AtlassianCredential credential, String pageId) {
        return restClient.get()
                .uri(apiBase + "/{cloudId}/wiki/api/v2/pages/{pageId}?body-format={format}",
                        credential.cloudId(), pageId, "storage")
                .headers(AtlassianHeaders.bearer(credential.accessToken()))
                .exchange((request, response) -> toResponse(response));
    }

    /**
     * v2 space id for a space key, or empty if the key is unknown.
     */
    public Optional<String> findSpaceId(AtlassianCredential credential, String spaceKey) {
        ConfluenceResponse response = restClient.get()
                .uri(apiBase + "/{cloudId}/wiki/api/v2/spaces?keys={key}&limit={limit}",
                        credential.cloudId(), spaceKey, 1)
                .headers(AtlassianHeaders.bearer(credential.accessToken()))
                .exchange((request, res) -> toResponse(res));
        if (!response.isOk()) {
            return Optional.empty();
        }
        JsonNode spaces = response.body().path("results");
        if (!spaces.isArray() || spaces.isEmpty()) {
            return Optional.empty();
        }
        String id = spaces.get(0).path("id").asText("");
        return id.isBlank() ? Optional.empty() : Optional.of(id);
    }

    /**
     * Create a page from a v2 payload (spaceId, status, title, body, optional parentId).
     */
    public ConfluenceResponse createPage(AtlassianCredential credential, Map<String, Object> payload) {
        return restClient.post()
                .uri(apiBase + "/{cloudId}/wiki/api/v2/pages", credential.cloudId())
                .headers(AtlassianHeaders.bearer(credential.accessToken()))
                .contentType(MediaType.APPLICATION_JSON)
                .body(payload)
                .exchange((request, response) -> toResponse(response));
    }

    private ConfluenceResponse toResponse(RestClient.RequestHeadersSpec.ConvertibleClientHttpResponse response)
            throws IOException {
        int status = response.getStatusCode().value();
        String raw = StreamUtils.copyToString(response.getBody(), StandardCharsets.UTF_8);
        JsonNode body = null;
        if (status == ConfluenceResponse.HTTP_OK && !raw.isBlank()) {
            body = objectMapper.readTree(raw);
        }
        return new ConfluenceResponse(status, body, raw);
    }
}
