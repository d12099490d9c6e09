package com.dcruver.gitpet.domain;

import lombok.Value;

/**
 * A TODO, FIXME or leftover debug statement found in tracked files.
 */
@Value
public class CodeIssue {
    static final int MAX_CONTENT_LENGTH = 60;

    Type type;
    String file;
    int line;

    // Trimmed source line, cut to 60 characters
    String content;

    public enum Type {
        TODO,
        FIXME,
        DEBUG_OUTPUT
    }
}
