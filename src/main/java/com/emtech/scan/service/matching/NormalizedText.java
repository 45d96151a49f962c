package com.emtech.scan.service.matching;

/**
 * Text with whitespace runs collapsed to single spaces, optionally lowercased, that remembers
 * where each character came from in the source so matches can be reported against the source.
 */
final class NormalizedText {

    private final String text;
    private final int[] sourceOffsets;

    private NormalizedText(String text, int[] sourceOffsets) {
        this.text = text;
        this.sourceOffsets = sourceOffsets;
    }

    static NormalizedText of(String source, boolean lowercase) {
        StringBuilder builder = new StringBuilder(source.length());
        int[] offsets = new int[source.length()];
        int length = 0;
        boolean pendingSpace = false;
        for (int i = 0; i < source.length(); i++) {
            char c = source.charAt(i);
            if (Character.isWhitespace(c)) {
                pendingSpace = length > 0;
                continue;
            }
            if (pendingSpace) {
                builder.append(' ');
                offsets[length++] = i - 1;
                pendingSpace = false;
            }
            builder.append(lowercase ? Character.toLowerCase(c) : c);
            offsets[length++] = i;
        }
        int[] trimmed = new int[length];
        System.arraycopy(offsets, 0, trimmed, 0, length);
        return new NormalizedText(builder.toString(), trimmed);
    }

    /**
     * Collapses whitespace without tracking offsets; used for term strings.
     */
    static String collapse(String value, boolean lowercase) {
        return of(value, lowercase).text();
    }

    String text() {
        return text;
    }

    int length() {
        return text.length();
    }

    int sourceStart(int start) {
        return sourceOffsets[start];
    }

    int sourceEnd(int end) {
        return sourceOffsets[end - 1] + 1;
    }

    boolean isWordChar(int index) {
        return index >= 0 && index < text.length() && Character.isLetterOrDigit(text.charAt(index));
    }
}
