package com.emtech.scan.service.matching;

/**
 * Character-level Levenshtein distance.
 */
final class EditDistance {

    private EditDistance() {
    }

    static int between(CharSequence a, CharSequence b) {
        if (a.length() < b.length()) {
            CharSequence swap = a;
            a = b;
            b = swap;
        }
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            current[0] = i;
            char ca = a.charAt(i - 1);
            for (int j = 1; j <= b.length(); j++) {
                int substitution = previous[j - 1] + (ca == b.charAt(j - 1) ? 0 : 1);
                current[j] = Math.min(substitution, Math.min(previous[j] + 1, current[j - 1] + 1));
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }
}
