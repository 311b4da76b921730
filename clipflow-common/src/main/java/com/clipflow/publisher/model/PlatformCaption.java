package com.clipflow.publisher.model;

import java.util.List;

public record PlatformCaption(String caption, List<String> hashtags, int charCount) {

    public PlatformCaption {
        hashtags = hashtags == null ? List.of() : List.copyOf(hashtags);
    }

    /**
     * Builds a caption whose character count covers the text plus the space-joined hashtags and
     * the blank line that separates them.
     */
    public static PlatformCaption of(String caption, List<String> hashtags) {
        String text = caption == null ? "" : caption;
        List<String> tags = hashtags == null ? List.of() : hashtags;
        return new PlatformCaption(text, tags, countCharacters(text, tags));
    }

    public static int countCharacters(String caption, List<String> hashtags) {
        int count = caption == null ? 0 : caption.length();
        if (hashtags != null && !hashtags.isEmpty()) {
            count += String.join(" ", hashtags).length() + 2;
        }
        return count;
    }

    /** Caption text followed by the hashtags, as it is sent to a platform. */
    public String fullText() {
        if (hashtags.isEmpty()) {
            return caption;
        }
        return caption + "\n\n" + String.join(" ", hashtags);
    }
}
