package com.phillippitts.tunemerge.service.match;

import com.phillippitts.tunemerge.domain.NormalizedRelease;
import com.phillippitts.tunemerge.domain.ReleaseArtist;

import java.text.Normalizer;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * String normalization and exact-match fingerprints for releases.
 *
 * <p>Normalization rules:
 * <ul>
 *   <li>Lower-case, decompose (NFD) and drop combining marks: "Début" becomes "debut"</li>
 *   <li>Drop everything that is not a letter, digit or whitespace</li>
 *   <li>Collapse whitespace and trim</li>
 * </ul>
 *
 * <p>Artist names additionally fold {@code &} into the conjunction {@code and} and drop a
 * leading "the", so "The Beatles" and "Beatles" or "Simon & Garfunkel" and
 * "Simon and Garfunkel" normalize identically.
 *
 * <p>Fingerprint format: {@code artist::title::year}, with {@code x} for an unknown year.
 */
public final class Fingerprints {

    static final String UNKNOWN_YEAR = "x";
    static final String CREDIT_JOINER = " & ";

    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}\\s]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern LEADING_THE = Pattern.compile("^the\\s+");

    private Fingerprints() {
        // Utility class - prevent instantiation
    }

    /**
     * Generates the exact-match key for a release.
     *
     * @param artist artist credit (null treated as empty)
     * @param title  release title (null treated as empty)
     * @param year   release year, or null when unknown
     * @return fingerprint such as {@code "beatles::abbey road::1969"}
     */
    public static String generate(String artist, String title, Integer year) {
        return normalizeArtist(artist) + "::" + normalize(title) + "::"
                + (year == null ? UNKNOWN_YEAR : year.toString());
    }

    public static String generate(String artist, String title) {
        return generate(artist, title, null);
    }

    /**
     * Fingerprint of a release using its full artist credit.
     */
    public static String of(NormalizedRelease release) {
        return generate(artistCredit(release.artists()), release.title(), release.year());
    }

    /**
     * Joins all credited artist names; a single artist yields its name unchanged.
     */
    public static String artistCredit(List<ReleaseArtist> artists) {
        if (artists == null || artists.isEmpty()) {
            return "";
        }
        if (artists.size() == 1) {
            return artists.get(0).name();
        }
        return artists.stream().map(ReleaseArtist::name).collect(Collectors.joining(CREDIT_JOINER));
    }

    public static String normalize(String s) {
        if (s == null || s.isEmpty()) {
            return "";
        }
        String decomposed = Normalizer.normalize(s.toLowerCase(Locale.ROOT), Normalizer.Form.NFD);
        String stripped = COMBINING_MARKS.matcher(decomposed).replaceAll("");
        String words = NON_WORD.matcher(stripped).replaceAll("");
        return WHITESPACE.matcher(words).replaceAll(" ").trim();
    }

    public static String normalizeArtist(String s) {
        if (s == null || s.isEmpty()) {
            return "";
        }
        // '&' must become a word before punctuation is stripped
        String n = normalize(s.replace("&", " and "));
        return LEADING_THE.matcher(n).replaceFirst("");
    }
}
