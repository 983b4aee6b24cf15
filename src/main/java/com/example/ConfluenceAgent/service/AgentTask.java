package com.example.ConfluenceAgent.service;

import com.example.ConfluenceAgent.model.AgentResult;
import com.example.ConfluenceAgent.model.InvocationSession;

/**
 * The long-running unit of work whose output is checked for authorization failures.
 * Failures are signalled by throwing.
 */
public interface AgentTask {

    AgentResult invoke(String prompt, InvocationSession session);
}
