package com.emtech.scan.service.consensus;

import com.emtech.scan.model.OcrToken;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Aligns two token sequences with a Levenshtein alignment over whole tokens. Tokens compare equal
 * ignoring case. Ties in the backtrace prefer a substitution, then a token only the first
 * sequence has, then a token only the second has, so the result is a pure function of the input.
 */
final class TokenAligner {

    private TokenAligner() {
    }

    /**
     * One column of the alignment. At most one side is {@code null}.
     */
    record Column(OcrToken first, OcrToken second) {

        boolean isPaired() {
            return first != null && second != null;
        }

        boolean isAgreement() {
            return isPaired() && sameToken(first, second);
        }
    }

    static List<Column> align(List<OcrToken> first, List<OcrToken> second) {
        int n = first.size();
        int m = second.size();
        int[][] cost = new int[n + 1][m + 1];
        for (int i = 0; i <= n; i++) {
            cost[i][0] = i;
        }
        for (int j = 0; j <= m; j++) {
            cost[0][j] = j;
        }
        for (int i = 1; i <= n; i++) {
            for (int j = 1; j <= m; j++) {
                int substitution = cost[i - 1][j - 1] + (sameToken(first.get(i - 1), second.get(j - 1)) ? 0 : 1);
                int deletion = cost[i - 1][j] + 1;
                int insertion = cost[i][j - 1] + 1;
                cost[i][j] = Math.min(substitution, Math.min(deletion, insertion));
            }
        }

        List<Column> columns = new ArrayList<>(Math.max(n, m));
        int i = n;
        int j = m;
        while (i > 0 || j > 0) {
            if (i > 0 && j > 0) {
                int step = sameToken(first.get(i - 1), second.get(j - 1)) ? 0 : 1;
                if (cost[i][j] == cost[i - 1][j - 1] + step) {
                    columns.add(new Column(first.get(i - 1), second.get(j - 1)));
                    i--;
                    j--;
                    continue;
                }
            }
            if (i > 0 && cost[i][j] == cost[i - 1][j] + 1) {
                columns.add(new Column(first.get(i - 1), null));
                i--;
            } else {
                columns.add(new Column(null, second.get(j - 1)));
                j--;
            }
        }
        Collections.reverse(columns);
        return columns;
    }

    static boolean sameToken(OcrToken a, OcrToken b) {
        return a.text().toLowerCase(Locale.ROOT).equals(b.text().toLowerCase(Locale.ROOT));
    }
}
