package com.example.ConfluenceAgent.model;

/**
 * Summary of a finished invocation, used for chat memory and the invocation log.
 *
 * @param finalState      last state reached before the stream was closed
 * @param attempts        number of task invocations (1 or 2)
 * @param reauthenticated whether the authentication gate succeeded
 * @param result          emitted result, null when the invocation ended with an error
 * @param errorMessage    error text when finalState is ERROR
 */
public record InvocationOutcome(
        InvocationState finalState,
        int attempts,
        boolean reauthenticated,
        AgentResult result,
        String errorMessage
) {
    public boolean hasResult() {
        return result != null;
    }
}
