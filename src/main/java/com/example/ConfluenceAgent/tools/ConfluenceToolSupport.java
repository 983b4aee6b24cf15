package com.example.ConfluenceAgent.tools;

import com.example.ConfluenceAgent.auth.AtlassianCredential;
import com.example.ConfluenceAgent.auth.CredentialRegistry;
import com.example.ConfluenceAgent.model.InvocationSession;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.model.ToolContext;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Shared plumbing for the Confluence tools: session lookup, credential lookup
 * and the JSON shapes returned to the model.
 */
@Component
@RequiredArgsConstructor
public class ConfluenceToolSupport {

    private static final Logger log = LoggerFactory.getLogger(ConfluenceToolSupport.class);

    private final CredentialRegistry credentialRegistry;

    /**
     * Record the tool on the invocation session and return the session's credential, if any.
     */
    public Optional<AtlassianCredential> begin(String toolName, ToolContext toolContext) {
        InvocationSession session = session(toolContext);
        if (session == null) {
            log.warn("Tool {} called without an invocation session in the tool context", toolName);
            return Optional.empty();
        }
        session.recordTool(toolName);
        return credentialRegistry.find(session.principal());
    }

    static InvocationSession session(ToolContext toolContext) {
        if (toolContext == null || toolContext.getContext() == null) {
            return null;
        }
        Object value = toolContext.getContext().get(InvocationSession.CONTEXT_KEY);
        return value instanceof InvocationSession ? (InvocationSession) value : null;
    }

    /**
     * Browser URL of a page, from its "webui" link.
     */
    static String pageUrl(AtlassianCredential credential, String webUiPath) {
        String site = credential.siteUrl() != null && !credential.siteUrl().isBlank()
                ? credential.siteUrl()
                : "https://" + credential.cloudId() + ".atlassian.net";
        return site + "/wiki" + webUiPath;
    }

    public static Map<String, Object> authRequired(String toolName) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("auth_required", true);
        response.put("message", "Atlassian authentication is required for " + toolName + ".");
        return response;
    }

    public static Map<String, Object> error(String message, String details) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("success", false);
        response.put("error", message);
        response.put("details", details == null ? "" : details);
        return response;
    }
}
