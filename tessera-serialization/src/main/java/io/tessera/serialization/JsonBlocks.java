package io.tessera.serialization;

import java.util.Objects;

/// Locates the JSON object inside free-form agent output.
///
/// Agents wrap their answer in prose or markdown fences. Lookup order:
/// 1. a ```` ```json ```` fenced block
/// 2. a generic ```` ``` ```` fenced block
/// 3. the text between the first `{` and the last `}`
public final class JsonBlocks {

    private JsonBlocks() {}

    /// Extracts the JSON object text.
    ///
    /// @param content raw agent output, not null
    /// @return candidate JSON text, or null when no object-like text is present
    public static String extractObject(String content) {
        Objects.requireNonNull(content, "content must not be null");
        String fenced = fenced(content, "```json");
        if (fenced == null) {
            fenced = fenced(content, "```");
        }
        String candidate = fenced != null ? fenced : content;

        int start = candidate.indexOf('{');
        int end = candidate.lastIndexOf('}');
        if (start >= 0 && end > start) {
            return candidate.substring(start, end + 1);
        }
        return null;
    }

    private static String fenced(String content, String opener) {
        int start = content.indexOf(opener);
        if (start < 0) {
            return null;
        }
        int bodyStart = content.indexOf('\n', start);
        if (bodyStart < 0) {
            return null;
        }
        int end = content.indexOf("```", bodyStart + 1);
        return end > bodyStart ? content.substring(bodyStart + 1, end).trim() : null;
    }
}
