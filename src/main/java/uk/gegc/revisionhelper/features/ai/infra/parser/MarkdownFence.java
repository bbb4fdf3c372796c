package uk.gegc.revisionhelper.features.ai.infra.parser;

/**
 * Removes a surrounding markdown code fence such as {@code ```json ... ```}.
 */
final class MarkdownFence {

    private static final String FENCE = "```";

    private MarkdownFence() {
    }

    static String strip(String text) {
        if (text == null) {
            return "";
        }
        String trimmed = text.trim();
        if (!trimmed.startsWith(FENCE)) {
            return trimmed;
        }

        int firstNewline = trimmed.indexOf('\n');
        if (firstNewline < 0) {
            // single line: ```{...}```
            String inner = trimmed.substring(FENCE.length());
            if (inner.endsWith(FENCE)) {
                inner = inner.substring(0, inner.length() - FENCE.length());
            }
            if (inner.startsWith("json")) {
                inner = inner.substring("json".length());
            }
            return inner.trim();
        }

        String body = trimmed.substring(firstNewline + 1);
        int lastNewline = body.lastIndexOf('\n');
        String lastLine = lastNewline < 0 ? body : body.substring(lastNewline + 1);
        if (lastLine.trim().startsWith(FENCE)) {
            body = lastNewline < 0 ? "" : body.substring(0, lastNewline);
        }
        return body.trim();
    }
}
