package com.example.ConfluenceAgent.service;

import com.example.ConfluenceAgent.model.InvocationLog;
import com.example.ConfluenceAgent.model.InvocationOutcome;
import com.example.ConfluenceAgent.model.InvocationSession;
import com.example.ConfluenceAgent.repository.InvocationLogRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class InvocationLogService {

    private static final Logger log = LoggerFactory.getLogger(InvocationLogService.class);

    private static final int MAX_ERROR_LENGTH = 2000;

    private final InvocationLogRepository invocationLogRepository;

    public void recordInvocation(InvocationSession session, String prompt, InvocationOutcome outcome) {
        InvocationLog entry = new InvocationLog();
        entry.setSessionId(session.id());
        entry.setModel(session.model());
        entry.setPrompt(prompt);
        entry.setAnswer(outcome.hasResult() ? outcome.result().content() : null);
        entry.setFinalState(outcome.finalState());
        entry.setAttempts(outcome.attempts());
        entry.setReauthenticated(outcome.reauthenticated());
        entry.setErrorMessage(truncate(outcome.errorMessage()));

        try {
            invocationLogRepository.save(entry);
        } catch (DataAccessException e) {
            log.warn("Failed to record invocation log for session={}", session.id(), e);
        }
    }

    private static String truncate(String value) {
        if (value == null || value.length() <= MAX_ERROR_LENGTH) {
            return value;
        }
        return value.substring(0, MAX_ERROR_LENGTH);
    }
}
