package com.clipflow.publisher.service;

import com.clipflow.publisher.model.PlatformCaption;

import java.util.ArrayList;
import java.util.List;

/**
 * Fits a caption and its hashtags into a platform's character limit. Whole sentences are kept
 * where possible, then the text is cut at a word boundary with an ellipsis, and as a last resort
 * cut mid-word. A configured call-to-action is moved to the end of a shortened caption.
 */
public final class CaptionTruncator {

    static final String ELLIPSIS = "…";
    private static final String CTA_SEPARATOR = "\n\n";
    // Below this the call-to-action is dropped in favour of the caption body
    private static final int MIN_BODY_LENGTH = 20;

    private CaptionTruncator() {}

    public static PlatformCaption fit(String caption, List<String> hashtags, int maxLength, String callToAction) {
        String text = caption == null ? "" : caption.trim();
        List<String> tags = limitHashtags(hashtags, maxLength / 2);
        int available = maxLength - hashtagLength(tags);
        if (text.length() <= available) {
            return PlatformCaption.of(text, tags);
        }

        String body = text;
        String suffix = "";
        if (callToAction != null && !callToAction.isBlank()) {
            String cta = callToAction.trim();
            body = text.replace(cta, "").trim();
            suffix = CTA_SEPARATOR + cta;
            if (available - suffix.length() < MIN_BODY_LENGTH) {
                suffix = "";
            }
        }

        String shortened = shorten(body, available - suffix.length()) + suffix;
        return PlatformCaption.of(shortened, tags);
    }

    static String shorten(String text, int limit) {
        if (text.length() <= limit) {
            return text;
        }

        String bySentence = wholeSentences(text, limit);
        if (!bySentence.isEmpty()) {
            return bySentence;
        }

        int cut = limit - ELLIPSIS.length();
        if (cut <= 0) {
            return prefix(text, Math.max(limit, 0));
        }
        int lastSpace = text.lastIndexOf(' ', cut);
        if (lastSpace > cut / 2) {
            return text.substring(0, lastSpace).trim() + ELLIPSIS;
        }
        return prefix(text, cut) + ELLIPSIS;
    }

    // Never ends between the two halves of a surrogate pair
    private static String prefix(String text, int end) {
        if (end > 0 && Character.isHighSurrogate(text.charAt(end - 1))) {
            end--;
        }
        return text.substring(0, end);
    }

    private static String wholeSentences(String text, int limit) {
        StringBuilder kept = new StringBuilder();
        for (String sentence : text.split("(?<=[.!?])\\s+")) {
            int next = kept.length() + (kept.length() > 0 ? 1 : 0) + sentence.length();
            if (next > limit) {
                break;
            }
            if (kept.length() > 0) {
                kept.append(' ');
            }
            kept.append(sentence);
        }
        String result = kept.toString();
        // A single unterminated fragment is not a sentence
        return result.matches("(?s).*[.!?]$") ? result : "";
    }

    private static List<String> limitHashtags(List<String> hashtags, int budget) {
        List<String> kept = new ArrayList<>();
        if (hashtags == null) {
            return kept;
        }
        for (String tag : hashtags) {
            kept.add(tag);
            if (hashtagLength(kept) > budget) {
                kept.remove(kept.size() - 1);
                break;
            }
        }
        return kept;
    }

    private static int hashtagLength(List<String> hashtags) {
        return PlatformCaption.countCharacters("", hashtags);
    }
}
