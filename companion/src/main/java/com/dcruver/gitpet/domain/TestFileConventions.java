package com.dcruver.gitpet.domain;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Path conventions that mark a tracked file as a test.
 */
final class TestFileConventions {

    private static final List<Pattern> PATTERNS = List.of(
        // app.test.ts, app.spec.js
        Pattern.compile("\\.(test|spec)\\."),
        Pattern.compile("(^|/)__tests__/"),
        // test/ or tests/ directories holding source files
        Pattern.compile("(^|/)tests?/.*\\.(js|ts|jsx|tsx|py|rb|java|kt|go|rs|cs|php)$"),
        Pattern.compile("(^|/)src/test/"),
        Pattern.compile("(Test|Tests)\\.(java|kt|scala|groovy)$"),
        Pattern.compile("_test\\.go$"),
        Pattern.compile("(^|/)test_[^/]*\\.py$")
    );

    private TestFileConventions() {
    }

    static boolean isTestFile(String path) {
        if (path == null || path.isBlank()) {
            return false;
        }
        for (Pattern pattern : PATTERNS) {
            if (pattern.matcher(path).find()) {
                return true;
            }
        }
        return false;
    }
}
