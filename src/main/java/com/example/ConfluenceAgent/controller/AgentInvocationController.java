package com.example.ConfluenceAgent.controller;

import com.example.ConfluenceAgent.model.InvocationRequest;
import com.example.ConfluenceAgent.model.StreamEvent;
import com.example.ConfluenceAgent.service.AgentInvocationService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;

import java.io.IOException;
import java.util.Map;

@RestController
@RequiredArgsConstructor
public class AgentInvocationController {

    private final AgentInvocationService agentInvocationService;

    @GetMapping("/ping")
    public Map<String, String> ping() {
        return Map.of("status", "Healthy");
    }

    /**
     * Streams one agent invocation as server-sent events.
     * Event names: status / error / authorization_url / result
     */
    @PostMapping(value = "/invocations", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter invoke(@RequestBody InvocationRequest request) {
        // 0L means no timeout; authorization may wait on the user
        SseEmitter emitter = new SseEmitter(0L);

        Flux<StreamEvent> stream = agentInvocationService.invoke(request);

        Disposable subscription = stream.subscribe(
                event -> {
                    try {
                        emitter.send(
                                SseEmitter.event()
                                        .name(event.stage())
                                        .data(event)
                        );
                    } catch (IOException e) {
                        emitter.completeWithError(e);
                    }
                },
                emitter::completeWithError,
                emitter::complete
        );

        // Stop draining when the client goes away; the invocation itself still runs to completion
        emitter.onCompletion(subscription::dispose);
        emitter.onTimeout(subscription::dispose);
        emitter.onError(t -> subscription.dispose());

        return emitter;
    }
}
