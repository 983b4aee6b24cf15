package com.example.ConfluenceAgent.service;

import com.example.ConfluenceAgent.auth.AuthNeedClassifier;
import com.example.ConfluenceAgent.auth.AuthenticationGate;
import com.example.ConfluenceAgent.model.AgentResult;
import com.example.ConfluenceAgent.model.InvocationOutcome;
import com.example.ConfluenceAgent.model.InvocationSession;
import com.example.ConfluenceAgent.model.InvocationState;
import com.example.ConfluenceAgent.model.StreamEvent;
import com.example.ConfluenceAgent.stream.StreamingChannel;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs one agent invocation end to end and always closes its stream.
 *
 * States:
 *  INIT -> EXECUTING -> SUCCESS
 *                    -> NEEDS_AUTH -> AUTHENTICATING -> RETRYING -> SUCCESS | FAILURE
 *                                                    -> AUTH_FAILED
 *  any exception    -> ERROR
 *  then             -> CLOSED
 *
 * The retried result is emitted as-is even if it still looks like an authorization failure;
 * there is never a second retry.
 */
@Service
@RequiredArgsConstructor
public class AgentOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(AgentOrchestrator.class);

    private final AgentTask agentTask;
    private final AuthNeedClassifier authNeedClassifier;
    private final AuthenticationGate authenticationGate;

    public InvocationOutcome run(String prompt, InvocationSession session, StreamingChannel channel) {
        InvocationState state = InvocationState.INIT;
        RetryBudget retryBudget = RetryBudget.singleRetry();
        int attempts = 0;
        boolean reauthenticated = false;
        AgentResult emitted = null;
        String errorMessage = null;

        try {
            channel.put(StreamEvent.status("Begin agent execution"));

            state = InvocationState.EXECUTING;
            AgentResult result = agentTask.invoke(prompt, session);
            attempts++;

            if (authNeedClassifier.needsAuthentication(result.content())) {
                state = InvocationState.NEEDS_AUTH;
                log.info("Agent output for session={} looks like an authorization failure", session.id());

                if (retryBudget.tryConsume()) {
                    state = InvocationState.AUTHENTICATING;
                    if (authenticationGate.handleAuthentication(session, channel)) {
                        reauthenticated = true;
                        state = InvocationState.RETRYING;
                        result = agentTask.invoke(prompt, session);
                        attempts++;
                        if (authNeedClassifier.needsAuthentication(result.content())) {
                            state = InvocationState.FAILURE;
                            log.warn("Retried output for session={} still looks like an authorization failure; "
                                    + "returning it as-is", session.id());
                        } else {
                            state = InvocationState.SUCCESS;
                        }
                    } else {
                        state = InvocationState.AUTH_FAILED;
                    }
                } else {
                    state = InvocationState.AUTH_FAILED;
                }
            } else {
                state = InvocationState.SUCCESS;
            }

            channel.put(StreamEvent.result(result));
            emitted = result;
            channel.put(StreamEvent.status("End agent execution"));
        } catch (Exception e) {
            log.error("Agent invocation failed for session={} in state {}", session.id(), state, e);
            state = InvocationState.ERROR;
            errorMessage = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            channel.put(StreamEvent.error("Error: " + errorMessage));
        } finally {
            channel.finish();
            log.debug("Invocation for session={} closed after {} attempt(s), final state {}",
                    session.id(), attempts, state);
        }

        return new InvocationOutcome(state, attempts, reauthenticated, emitted, errorMessage);
    }
}
