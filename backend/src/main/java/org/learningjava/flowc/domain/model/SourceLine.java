package org.learningjava.flowc.domain.model;

public record SourceLine(
        String raw,         // line as written, without the line terminator
        int indent,         // count of leading whitespace characters
        String content      // trimmed text
) {

    public static SourceLine of(String raw) {
        String text = raw == null ? "" : raw;
        String content = text.strip();
        int indent = content.isEmpty() ? 0 : text.length() - text.stripLeading().length();
        return new SourceLine(text, indent, content);
    }

    /** Blank lines and comment lines never reach the rule dispatch. */
    public boolean isSkippable() {
        return content.isEmpty() || content.startsWith("//") || content.startsWith("#");
    }
}
