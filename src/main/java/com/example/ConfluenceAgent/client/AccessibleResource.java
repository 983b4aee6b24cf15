package com.example.ConfluenceAgent.client;

/**
 * One entry of the Atlassian accessible-resources lookup.
 *
 * @param id   cloud id used to scope Confluence API calls
 * @param name site name
 * @param url  site base URL, e.g. "https://acme.atlassian.net"
 */
public record AccessibleResource(
        String id,
        String name,
        String url
) {
}
