package com.di.skyflow.collaborator;

import java.util.List;

/**
 * Exit code and captured output lines of an external tool run.
 */
public record ToolOutput(int exitCode, List<String> lines) {

    /** Last non-blank output line, or null. */
    public String lastLine() {
        for (int i = lines.size() - 1; i >= 0; i--) {
            String line = lines.get(i).trim();
            if (!line.isEmpty()) {
                return line;
            }
        }
        return null;
    }

    public String tail(int n) {
        int from = Math.max(0, lines.size() - n);
        return String.join("\n", lines.subList(from, lines.size()));
    }
}
