package com.example.ConfluenceAgent.tools;

import com.example.ConfluenceAgent.auth.AtlassianCredential;
import com.example.ConfluenceAgent.client.ConfluenceClient;
import com.example.ConfluenceAgent.client.ConfluenceResponse;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.model.ToolContext;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.context.annotation.Description;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiFunction;

@Component(CreateConfluencePageToolDefinition.NAME)
@Description(CreateConfluencePageToolDefinition.DESCRIPTION)
@RequiredArgsConstructor
public class CreateConfluencePageToolFunction
        implements BiFunction<CreateConfluencePageToolFunction.Request, ToolContext, Map<String, Object>> {

    private static final Logger log = LoggerFactory.getLogger(CreateConfluencePageToolFunction.class);

    private final ConfluenceClient confluenceClient;
    private final ConfluenceToolSupport toolSupport;

    public record Request(
            @ToolParam(description = "Key of the space to create the page in, e.g. ENG") String spaceKey,
            @ToolParam(description = "Page title") String title,
            @ToolParam(description = "Page content, HTML storage format or plain text") String content,
            @ToolParam(description = "Optional parent page id", required = false) String parentId
    ) {
    }

    @Override
    public Map<String, Object> apply(Request request, ToolContext toolContext) {
        String toolName = CreateConfluencePageToolDefinition.NAME;
        Optional<AtlassianCredential> credential = toolSupport.begin(toolName, toolContext);
        if (credential.isEmpty()) {
            return ConfluenceToolSupport.authRequired(toolName);
        }

        try {
            Optional<String> spaceId = confluenceClient.findSpaceId(credential.get(), request.spaceKey());
            if (spaceId.isEmpty()) {
                return ConfluenceToolSupport.error("Space not found: " + request.spaceKey(),
                        "No space exists for the given space key");
            }

            ConfluenceResponse response = confluenceClient.createPage(credential.get(),
                    buildPayload(spaceId.get(), request));
            if (!response.isOk()) {
                return ConfluenceToolSupport.error("Failed to create page: " + response.statusCode(),
                        response.rawBody());
            }

            String pageTitle = response.body().path("title").asText(request.title());
            log.info("Created Confluence page '{}' in space {}", pageTitle, request.spaceKey());

            Map<String, Object> result = new LinkedHashMap<>();
            result.put("success", true);
            result.put("message", "Created page: " + pageTitle);
            result.put("page_id", response.body().path("id").asText(null));
            result.put("page_title", pageTitle);
            result.put("space_id", spaceId.get());
            return result;
        } catch (RestClientException e) {
            log.warn("Confluence page creation failed: {}", e.getMessage());
            return ConfluenceToolSupport.error("Failed to create page", e.getMessage());
        }
    }

    static Map<String, Object> buildPayload(String spaceId, Request request) {
        String content = request.content() == null ? "" : request.content();
        if (!content.startsWith("<")) {
            content = "<p>" + content + "</p>";
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("representation", "storage");
        body.put("value", content);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("spaceId", spaceId);
        payload.put("status", "current");
        payload.put("title", request.title());
        payload.put("body", body);
        if (request.parentId() != null && !request.parentId().isBlank()) {
            payload.put("parentId", request.parentId());
        }
        return payload;
    }
}
