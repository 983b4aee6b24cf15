package com.example.ConfluenceAgent.tools;

/**
 * Groups of tools that can be enabled for a single invocation.
 */
public enum ToolProfile {
    /** Search and read pages only. */
    READ_ONLY,
    /** Search, read and create pages. */
    FULL
}
