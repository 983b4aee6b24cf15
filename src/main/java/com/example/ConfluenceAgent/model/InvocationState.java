package com.example.ConfluenceAgent.model;

/**
 * States an agent invocation moves through before its stream is closed.
 */
public enum InvocationState {
    INIT,
    EXECUTING,
    NEEDS_AUTH,
    AUTHENTICATING,
    RETRYING,
    SUCCESS,
    /** The retried result still looked like an authorization failure. */
    FAILURE,
    AUTH_FAILED,
    /** An exception escaped the task or the authentication gate. */
    ERROR,
    CLOSED
}
