package com.example.ConfluenceAgent.tools;

import com.example.ConfluenceAgent.auth.AtlassianCredential;
import com.example.ConfluenceAgent.client.ConfluenceClient;
import com.example.ConfluenceAgent.client.ConfluenceResponse;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.model.ToolContext;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.context.annotation.Description;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiFunction;

/**
 * Full-text page search exposed to Spring AI as a tool.
 */
@Component(SearchConfluenceToolDefinition.NAME)
@Description(SearchConfluenceToolDefinition.DESCRIPTION)
@RequiredArgsConstructor
public class SearchConfluenceToolFunction
        implements BiFunction<SearchConfluenceToolFunction.Request, ToolContext, Map<String, Object>> {

    private static final Logger log = LoggerFactory.getLogger(SearchConfluenceToolFunction.class);

    static final int DEFAULT_LIMIT = 10;

    private final ConfluenceClient confluenceClient;
    private final ConfluenceToolSupport toolSupport;

    public record Request(
            @ToolParam(description = "Text to look for in page titles and bodies") String searchText,
            @ToolParam(description = "Maximum number of pages to return, default 10", required = false) Integer limit
    ) {
    }

    @Override
    public Map<String, Object> apply(Request request, ToolContext toolContext) {
        String toolName = SearchConfluenceToolDefinition.NAME;
        Optional<AtlassianCredential> credential = toolSupport.begin(toolName, toolContext);
        if (credential.isEmpty()) {
            return ConfluenceToolSupport.authRequired(toolName);
        }

        String searchText = request.searchText() == null ? "" : request.searchText();
        int limit = request.limit() == null || request.limit() <= 0 ? DEFAULT_LIMIT : request.limit();

        ConfluenceResponse response;
        try {
            response = confluenceClient.searchPages(credential.get(), buildCql(searchText), limit);
        } catch (RestClientException e) {
            log.warn("Confluence search failed: {}", e.getMessage());
            return ConfluenceToolSupport.error("Failed to search pages", e.getMessage());
        }
        if (!response.isOk()) {
            return ConfluenceToolSupport.error("Failed to search pages: " + response.statusCode(), response.rawBody());
        }

        List<Map<String, Object>> pages = new ArrayList<>();
        for (JsonNode page : response.body().path("results")) {
            Map<String, Object> summary = new LinkedHashMap<>();
            summary.put("id", page.path("id").asText());
            summary.put("title", page.path("title").asText());
            summary.put("space", page.path("space").path("name").asText("N/A"));
            summary.put("excerpt", page.path("excerpt").asText(""));
            summary.put("url", ConfluenceToolSupport.pageUrl(credential.get(),
                    page.path("_links").path("webui").asText("")));
            pages.add(summary);
        }

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("success", true);
        result.put("search_text", searchText);
        result.put("total", response.body().path("totalSize").asInt(0));
        result.put("pages", pages);
        return result;
    }

    /**
     * CQL matching pages by title or text. Single quotes are escaped so the
     * search text cannot close the string literal.
     */
    static String buildCql(String searchText) {
        String escaped = searchText.replace("\\", "\\\\").replace("'", "\\'");
        return "type=page AND (title~'" + escaped + "' OR text~'" + escaped + "')";
    }
}
