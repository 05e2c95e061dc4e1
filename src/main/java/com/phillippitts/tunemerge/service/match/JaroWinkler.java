package com.phillippitts.tunemerge.service.match;

/**
 * Jaro-Winkler string similarity in [0,1].
 *
 * <p>Winkler's prefix boost uses scale 0.1 over a common prefix of at most 4 characters.
 * Equal strings score 1; a comparison against an empty string scores 0.
 */
final class JaroWinkler {

    static final double PREFIX_SCALE = 0.1;
    static final int MAX_PREFIX = 4;

    private JaroWinkler() {
    }

    static double similarity(String s1, String s2) {
        double jaro = jaro(s1, s2);
        int prefix = 0;
        int limit = Math.min(MAX_PREFIX, Math.min(s1.length(), s2.length()));
        while (prefix < limit && s1.charAt(prefix) == s2.charAt(prefix)) {
            prefix++;
        }
        return jaro + prefix * PREFIX_SCALE * (1.0 - jaro);
    }

    static double jaro(String s1, String s2) {
        if (s1.equals(s2)) {
            return 1.0;
        }
        if (s1.isEmpty() || s2.isEmpty()) {
            return 0.0;
        }

        int matchDistance = Math.max(0, Math.max(s1.length(), s2.length()) / 2 - 1);
        boolean[] s1Matches = new boolean[s1.length()];
        boolean[] s2Matches = new boolean[s2.length()];

        int matches = 0;
        for (int i = 0; i < s1.length(); i++) {
            int start = Math.max(0, i - matchDistance);
            int end = Math.min(i + matchDistance + 1, s2.length());
            for (int j = start; j < end; j++) {
                if (s2Matches[j] || s1.charAt(i) != s2.charAt(j)) {
                    continue;
                }
                s1Matches[i] = true;
                s2Matches[j] = true;
                matches++;
                break;
            }
        }
        if (matches == 0) {
            return 0.0;
        }

        int transpositions = 0;
        int k = 0;
        for (int i = 0; i < s1.length(); i++) {
            if (!s1Matches[i]) {
                continue;
            }
            while (!s2Matches[k]) {
                k++;
            }
            if (s1.charAt(i) != s2.charAt(k)) {
                transpositions++;
            }
            k++;
        }

        double m = matches;
        return (m / s1.length() + m / s2.length() + (m - transpositions / 2.0) / m) / 3.0;
    }
}
