package com.chatroom.sync.common.text;

import com.chatroom.sync.common.config.ChatRoomProperties;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Removes every HTML tag from user supplied text and escapes what is left, so stored values
 * are safe to render as markup. Names are additionally trimmed and fall back to
 * {@link #DEFAULT_NAME} when nothing is left.
 */
@Component
public class TextSanitizer {

    public static final String DEFAULT_NAME = "Anonymous";

    // Content of these elements is never text.
    private static final Pattern NON_TEXT_BLOCK =
            Pattern.compile("(?is)<(script|style|textarea|noscript)\\b[^>]*>.*?(</\\1\\s*>|$)");
    private static final Pattern COMMENT = Pattern.compile("(?s)<!--.*?(-->|$)");
    private static final Pattern TAG = Pattern.compile("</?[a-zA-Z!/?][^>]*>");

    private final int maxNameLength;
    private final int maxTextLength;

    public TextSanitizer(ChatRoomProperties props) {
        this.maxNameLength = props.maxNameLength();
        this.maxTextLength = props.maxTextLength();
    }

    public String cleanName(String raw) {
        if (raw == null) return DEFAULT_NAME;
        var cleaned = stripTags(truncate(raw.trim(), maxNameLength)).trim();
        return cleaned.isBlank() ? DEFAULT_NAME : cleaned;
    }

    public String cleanText(String raw) {
        if (raw == null) return "";
        return stripTags(truncate(raw, maxTextLength));
    }

    static String stripTags(String s) {
        if (s.isEmpty()) return s;
        var x = NON_TEXT_BLOCK.matcher(s).replaceAll("");
        x = COMMENT.matcher(x).replaceAll("");
        x = TAG.matcher(x).replaceAll("");
        return escapeHtml(x);
    }

    private static String escapeHtml(String s) {
        return s
                .replace("&", "&amp;")
                .replace("<", "&lt;")
                .replace(">", "&gt;")
                .replace("\"", "&quot;");
    }

    private static String truncate(String s, int max) {
        return s.length() > max ? s.substring(0, max) : s;
    }
}
