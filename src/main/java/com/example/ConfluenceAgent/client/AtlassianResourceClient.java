package com.example.ConfluenceAgent.client;

import com.example.ConfluenceAgent.config.ConfluenceAgentProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.io.IOException;
import java.util.Optional;

/**
 * Resolves which Atlassian site (cloud id) an access token belongs to.
 */
@Component
public class AtlassianResourceClient {

    private static final Logger log = LoggerFactory.getLogger(AtlassianResourceClient.class);

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final String accessibleResourcesUrl;

    public AtlassianResourceClient(RestClient.Builder restClientBuilder,
                                   ObjectMapper objectMapper,
                                   ConfluenceAgentProperties properties) {
        this.restClient = restClientBuilder.build();
        this.objectMapper = objectMapper;
        this.accessibleResourcesUrl = properties.atlassian().accessibleResourcesUrl();
    }

    /**
     * First resource visible to the token, or empty when the lookup does not return
     * HTTP 200 with a non-empty array.
     */
    public Optional<AccessibleResource> findPrimaryResource(String accessToken) {
        return restClient.get()
                .uri(accessibleResourcesUrl)
                .headers(AtlassianHeaders.bearer(accessToken))
                .exchange((request, response) -> readFirstResource(response));
    }

    public Optional<String> resolveCloudId(String accessToken) {
        return findPrimaryResource(accessToken).map(AccessibleResource::id);
    }

    private Optional<AccessibleResource> readFirstResource(RestClient.RequestHeadersSpec.ConvertibleClientHttpResponse response)
            throws IOException {
        int status = response.getStatusCode().value();
        if (status != ConfluenceResponse.HTTP_OK) {
            log.warn("Accessible-resources lookup returned HTTP {}", status);
            return Optional.empty();
        }
        JsonNode resources = objectMapper.readTree(response.getBody());
        if (resources == null || !resources.isArray() || resources.isEmpty()) {
            log.warn("Accessible-resources lookup returned no sites for this token");
            return Optional.empty();
        }
        JsonNode first = resources.get(0);
        String id = first.path("id").asText("");
        if (id.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(new AccessibleResource(
                id,
                first.path("name").asText(null),
                first.path("url").asText(null)
        ));
    }
}
