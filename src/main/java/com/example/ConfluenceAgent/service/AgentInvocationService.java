package com.example.ConfluenceAgent.service;

import com.example.ConfluenceAgent.config.ConfluenceAgentProperties;
import com.example.ConfluenceAgent.model.InvocationOutcome;
import com.example.ConfluenceAgent.model.InvocationRequest;
import com.example.ConfluenceAgent.model.InvocationSession;
import com.example.ConfluenceAgent.model.InvocationState;
import com.example.ConfluenceAgent.model.StreamEvent;
import com.example.ConfluenceAgent.stream.StreamingChannel;
import com.example.ConfluenceAgent.tools.ToolProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;

import java.util.List;

/**
 * Entry point for agent invocations.
 *
 * Each call gets its own {@link StreamingChannel}; the orchestrator runs on the agent task
 * executor while the caller consumes the returned stream.
 */
@Service
public class AgentInvocationService {

    private static final Logger log = LoggerFactory.getLogger(AgentInvocationService.class);

    static final ToolProfile DEFAULT_TOOL_PROFILE = ToolProfile.FULL;

    private final AgentOrchestrator orchestrator;
    private final RedisChatMemoryService chatMemoryService;
    private final InvocationLogService invocationLogService;
    private final TaskExecutor taskExecutor;
    private final String defaultUserId;

    public AgentInvocationService(AgentOrchestrator orchestrator,
                                  RedisChatMemoryService chatMemoryService,
                                  InvocationLogService invocationLogService,
                                  @Qualifier("agentTaskExecutor") TaskExecutor taskExecutor,
                                  ConfluenceAgentProperties properties) {
        this.orchestrator = orchestrator;
        this.chatMemoryService = chatMemoryService;
        this.invocationLogService = invocationLogService;
        this.taskExecutor = taskExecutor;
        this.defaultUserId = properties.authorization().defaultUserId();
    }

    /**
     * Start an invocation and return its event stream.
     * The stream always completes: with the result, or with an error event.
     */
    public Flux<StreamEvent> invoke(InvocationRequest request) {
        InvocationSession session = request.resolveSession(DEFAULT_TOOL_PROFILE, defaultUserId);
        String prompt = request.resolvePrompt();
        StreamingChannel channel = new StreamingChannel();

        try {
            taskExecutor.execute(() -> runInvocation(prompt, session, channel));
        } catch (TaskRejectedException e) {
            log.error("Agent executor rejected invocation for session={}", session.id(), e);
            channel.put(StreamEvent.error("Error: agent is busy, please retry later"));
            channel.finish();
        }

        return channel.stream();
    }

    private void runInvocation(String prompt, InvocationSession session, StreamingChannel channel) {
        String taskInput;
        try {
            List<RedisChatMemoryService.StoredMessage> history = chatMemoryService.loadHistory(session.id());
            taskInput = chatMemoryService.buildTaskInput(prompt, history);
        } catch (RuntimeException e) {
            log.warn("Running session={} without chat memory: {}", session.id(), e.getMessage());
            taskInput = prompt;
        }

        // Never throws; the channel is finished when this returns
        InvocationOutcome outcome = orchestrator.run(taskInput, session, channel);
        log.info("Invocation for session={} finished: state={}, attempts={}, reauthenticated={}",
                session.id(), outcome.finalState(), outcome.attempts(), outcome.reauthenticated());

        try {
            if (outcome.hasResult() && outcome.finalState() == InvocationState.SUCCESS) {
                chatMemoryService.appendTurn(session.id(), prompt, outcome.result().content(), session.temporary());
            }
            invocationLogService.recordInvocation(session, prompt, outcome);
        } catch (RuntimeException e) {
            log.warn("Post-invocation bookkeeping failed for session={}", session.id(), e);
        }
    }
}
