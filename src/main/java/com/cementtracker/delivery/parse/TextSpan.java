package com.cementtracker.delivery.parse;

/**
 * Half-open range {@code [start, end)} of a report body, tagged with the layout that produced it.
 */
public record TextSpan(String source, int start, int end, Layout layout) {

    public enum Layout {
        DAILY_MONTHLY_MARKERS,
        REPEATED_HEADER,
        SIDE_BY_SIDE_HEADER,
        DAILY_MARKER_ONLY,
        WHOLE_BODY
    }

    public TextSpan {
        source = source == null ? "" : source;
        if (start < 0 || end < start || end > source.length()) {
            throw new IllegalArgumentException("invalid span [" + start + ", " + end + ") for length " + source.length());
        }
    }

    public static TextSpan whole(String source) {
        String text = source == null ? "" : source;
        return new TextSpan(text, 0, text.length(), Layout.WHOLE_BODY);
    }

    public String text() {
        return source.substring(start, end);
    }

    /**
     * Everything before the end of this span; for two-section layouts this stops at the monthly part.
     */
    public String textUpToEnd() {
        return source.substring(0, end);
    }

    public int length() {
        return end - start;
    }
}
