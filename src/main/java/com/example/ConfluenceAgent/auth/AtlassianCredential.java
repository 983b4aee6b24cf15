package com.example.ConfluenceAgent.auth;

/**
 * Atlassian access token together with the site it is scoped to.
 *
 * @param accessToken  bearer token, never logged
 * @param cloudId      Atlassian cloud id resolved from the accessible-resources lookup
 * @param siteUrl      site base URL, e.g. "https://acme.atlassian.net"; may be null
 * @param metadata     best-effort decoded token claims
 */
public record AtlassianCredential(
        String accessToken,
        String cloudId,
        String siteUrl,
        TokenMetadata metadata
) {
    public AtlassianCredential {
        if (metadata == null) {
            metadata = TokenMetadata.empty();
        }
    }

    @Override
    public String toString() {
        return "AtlassianCredential[cloudId=" + cloudId + ", siteUrl=" + siteUrl
                + ", expires=" + metadata.formattedExpiry().orElse("N/A") + "]";
    }
}
