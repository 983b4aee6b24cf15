package com.example.ConfluenceAgent.client;

import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;

import java.util.List;
import java.util.function.Consumer;

final class AtlassianHeaders {

    private AtlassianHeaders() {
    }

    static Consumer<HttpHeaders> bearer(String accessToken) {
        return headers -> {
            headers.setBearerAuth(accessToken);
            headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        };
    }
}
