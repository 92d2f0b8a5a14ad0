package com.airgate.autoreply.buffer;

/**
 * Replaces the body of a metadata-prefixed turn with a media description
 * while keeping the {@code [time: ...] [sender: ...]} prefix.
 */
public final class MediaSplice {

    private MediaSplice() {
    }

    /**
     * Keep everything up to the end of the second bracketed segment plus any
     * whitespace after it, then append {@code description}. Content without
     * two bracketed segments is replaced by the description.
     */
    public static String apply(String content, String description) {
        if (description == null) {
            return content;
        }
        if (content == null) {
            return description;
        }
        int end = -1;
        int from = 0;
        for (int segment = 0; segment < 2; segment++) {
            int open = content.indexOf('[', from);
            if (open < 0) {
                return description;
            }
            int close = content.indexOf(']', open + 1);
            if (close < 0) {
                return description;
            }
            end = close + 1;
            from = end;
        }
        while (end < content.length() && Character.isWhitespace(content.charAt(end))) {
            end++;
        }
        return content.substring(0, end) + description;
    }
}
