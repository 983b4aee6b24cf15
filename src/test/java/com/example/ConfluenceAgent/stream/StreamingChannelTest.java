package com.example.ConfluenceAgent.stream;

import com.example.ConfluenceAgent.model.StreamEvent;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

class StreamingChannelTest {

    @ParameterizedTest
    @ValueSource(ints = {0, 1, 5, 200})
    void streamYieldsEveryEventInOrderThenCompletes(int count) {
        StreamingChannel channel = new StreamingChannel();
        List<StreamEvent> events = IntStream.range(0, count)
                .mapToObj(i -> StreamEvent.status("event-" + i))
                .toList();

        events.forEach(channel::put);
        channel.finish();

        StepVerifier.create(channel.stream())
                .expectNextSequence(events)
                .expectComplete()
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void consumerSeesEventsProducedConcurrently() {
        StreamingChannel channel = new StreamingChannel();

        Thread producer = new Thread(() -> {
            for (int i = 0; i < 50; i++) {
                channel.put(StreamEvent.status("step-" + i));
            }
            channel.finish();
        });

        List<String> received = new ArrayList<>();
        StepVerifier.create(channel.stream().map(StreamEvent::message))
                .then(producer::start)
                .thenConsumeWhile(message -> received.add(message))
                .expectComplete()
                .verify(Duration.ofSeconds(5));

        assertThat(received).hasSize(50);
        assertThat(received.get(0)).isEqualTo("step-0");
        assertThat(received.get(49)).isEqualTo("step-49");
    }

    @Test
    void repeatedFinishEndsTheStreamOnlyOnceAfterAllEvents() {
        StreamingChannel channel = new StreamingChannel();
        channel.put(StreamEvent.status("a"));
        channel.finish();
        channel.finish();

        StepVerifier.create(channel.stream())
                .expectNextMatches(e -> e.message().equals("a"))
                .expectComplete()
                .verify(Duration.ofSeconds(5));
        assertThat(channel.isFinished()).isTrue();
    }

    @Test
    void eventsAfterFinishAreDropped() {
        StreamingChannel channel = new StreamingChannel();
        channel.put(StreamEvent.status("before"));
        channel.finish();

        boolean accepted = channel.put(StreamEvent.status("after"));

        assertThat(accepted).isFalse();
        StepVerifier.create(channel.stream().map(StreamEvent::message))
                .expectNext("before")
                .expectComplete()
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void eventLookingLikeTheSentinelDoesNotEndTheStream() {
        StreamingChannel channel = new StreamingChannel();
        StreamEvent lookalike = new StreamEvent("end", "", null);
        channel.put(lookalike);
        channel.put(StreamEvent.status("still here"));
        channel.finish();

        StepVerifier.create(channel.stream())
                .expectNext(lookalike)
                .expectNextMatches(e -> e.message().equals("still here"))
                .expectComplete()
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void streamCanOnlyBeConsumedOnce() {
        StreamingChannel channel = new StreamingChannel();
        channel.finish();

        StepVerifier.create(channel.stream()).expectComplete().verify(Duration.ofSeconds(5));
        StepVerifier.create(channel.stream())
                .expectError(IllegalStateException.class)
                .verify(Duration.ofSeconds(5));
    }
}
