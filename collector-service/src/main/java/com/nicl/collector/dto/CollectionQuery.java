package com.nicl.collector.dto;

import java.util.Locale;

/**
 * What to collect: either a keyword, or the {@link #latest()} sentinel meaning
 * "newest items, no keyword filtering".
 */
public record CollectionQuery(String keyword) {

    public static final String LATEST_TAG = "latest";

    private static final CollectionQuery LATEST = new CollectionQuery(null);

    public CollectionQuery {
        if (keyword != null) {
            keyword = keyword.trim();
            if (keyword.isEmpty()) {
                throw new IllegalArgumentException("keyword must not be blank");
            }
        }
    }

    public static CollectionQuery latest() {
        return LATEST;
    }

    public static CollectionQuery keyword(String keyword) {
        if (keyword == null) {
            throw new IllegalArgumentException("keyword must not be null");
        }
        return new CollectionQuery(keyword);
    }

    /**
     * Parses user input: null, blank or "latest" (any case) mean {@link #latest()}.
     */
    public static CollectionQuery of(String raw) {
        if (raw == null || raw.isBlank() || LATEST_TAG.equalsIgnoreCase(raw.trim())) {
            return LATEST;
        }
        return new CollectionQuery(raw);
    }

    public boolean isLatest() {
        return keyword == null;
    }

    /**
     * Keyword, or "latest" for the sentinel. Stored as the article/log keyword.
     */
    public String tag() {
        return isLatest() ? LATEST_TAG : keyword;
    }

    /**
     * Case-insensitive substring match against any of the given texts.
     * Always true for {@link #latest()}.
     */
    public boolean matches(String... texts) {
        if (isLatest()) {
            return true;
        }
        String needle = keyword.toLowerCase(Locale.ROOT);
        for (String text : texts) {
            if (text != null && text.toLowerCase(Locale.ROOT).contains(needle)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return tag();
    }
}
