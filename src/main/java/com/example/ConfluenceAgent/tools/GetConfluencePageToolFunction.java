package com.example.ConfluenceAgent.tools;

import com.example.ConfluenceAgent.auth.AtlassianCredential;
import com.example.ConfluenceAgent.client.ConfluenceClient;
import com.example.ConfluenceAgent.client.ConfluenceResponse;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import org.springframework.ai.chat.model.ToolContext;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.context.annotation.Description;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiFunction;

@Component(GetConfluencePageToolDefinition.NAME)
@Description(GetConfluencePageToolDefinition.DESCRIPTION)
@RequiredArgsConstructor
public class GetConfluencePageToolFunction
        implements BiFunction<GetConfluencePageToolFunction.Request, ToolContext, Map<String, Object>> {

    private final ConfluenceClient confluenceClient;
    private final ConfluenceToolSupport toolSupport;

    public record Request(
            @ToolParam(description = "Confluence page id") String pageId
    ) {
    }

    @Override
    public Map<String, Object> apply(Request request, ToolContext toolContext) {
        String toolName = GetConfluencePageToolDefinition.NAME;
        Optional<AtlassianCredential> credential = toolSupport.begin(toolName, toolContext);
        if (credential.isEmpty()) {
            return ConfluenceToolSupport.authRequired(toolName);
        }

        ConfluenceResponse response;
        try {
            response = confluenceClient.getPage(credential.get(), request.pageId());
        } catch (RestClientException e) {
            return ConfluenceToolSupport.error("Failed to get page", e.getMessage());
        }
        if (!response.isOk()) {
            return ConfluenceToolSupport.error("Failed to get page: " + response.statusCode(), response.rawBody());
        }

        JsonNode page = response.body();
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("id", page.path("id").asText(null));
        details.put("title", page.path("title").asText(null));
        details.put("spaceId", page.path("spaceId").asText(null));
        details.put("version", page.path("version").path("number").asInt(1));
        details.put("content", page.path("body").path("storage").path("value").asText(""));
        details.put("status", page.path("status").asText(null));

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("success", true);
        result.put("page", details);
        return result;
    }
}
