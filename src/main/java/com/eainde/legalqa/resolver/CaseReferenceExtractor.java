package com.eainde.legalqa.resolver;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds explicit case references in free text.
 *
 * <p>Two shapes are recognised: court case numbers such as {@code C.P. 123/2021 Civil (SC)} or
 * {@code W 45/2019 Writ}, and party titles such as {@code Ahmed vs State}.</p>
 */
public final class CaseReferenceExtractor {

    /** Letter(s), optional dot, digits/digits, a word, optional bracketed abbreviation. */
    static final Pattern CASE_NUMBER = Pattern.compile(
            "\\b(?!No\\b)([A-Z](?:\\.?[A-Z])?[a-z]{0,3}\\.?\\s*\\d+/\\d+\\s+[A-Za-z]+(?:\\s*\\([A-Z]+\\))?)");

    /** "Case No. 12/2020" style references. */
    private static final Pattern CASE_NO = Pattern.compile(
            "\\bcase\\s+no\\.?\\s*\\d+/\\d+", Pattern.CASE_INSENSITIVE);

    /** "Party vs Party" titles, capitalised words either side. */
    private static final Pattern CASE_TITLE = Pattern.compile(
            "([A-Z][\\w.&'-]*(?:\\s+[A-Z][\\w.&'-]*){0,5})\\s+(?:vs\\.?|v\\.|versus)\\s+"
                    + "([A-Z][\\w.&'-]*(?:\\s+[A-Z][\\w.&'-]*){0,5})");

    private CaseReferenceExtractor() {
    }

    /**
     * Returns the first case number in {@code text}, if any.
     */
    public static Optional<String> findCaseNumber(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        Matcher m = CASE_NUMBER.matcher(text);
        if (m.find()) {
            return Optional.of(m.group(1).trim());
        }
        return Optional.empty();
    }

    /**
     * Returns the first "X vs Y" title in {@code text}, if any.
     */
    public static Optional<String> findCaseTitle(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        Matcher m = CASE_TITLE.matcher(text);
        if (m.find()) {
            return Optional.of(m.group(1).trim() + " vs " + m.group(2).trim());
        }
        return Optional.empty();
    }

    /**
     * Case number if present, else case title.
     */
    public static Optional<String> findReference(String text) {
        Optional<String> number = findCaseNumber(text);
        return number.isPresent() ? number : findCaseTitle(text);
    }

    /**
     * All case numbers in {@code text}, in order of appearance.
     */
    public static List<String> findAllCaseNumbers(String text) {
        List<String> found = new ArrayList<>();
        if (text == null) {
            return found;
        }
        Matcher m = CASE_NUMBER.matcher(text);
        while (m.find()) {
            found.add(m.group(1).trim());
        }
        return found;
    }

    /**
     * Whether {@code text} carries any case-number-like token, including "Case No. N/N".
     */
    public static boolean containsCaseNumber(String text) {
        if (text == null || text.isBlank()) {
            return false;
        }
        return CASE_NUMBER.matcher(text).find() || CASE_NO.matcher(text).find();
    }

    /**
     * Lower-cased, whitespace-collapsed form used to compare references.
     */
    public static String normalize(String reference) {
        if (reference == null) {
            return "";
        }
        return reference.toLowerCase(Locale.ROOT).replaceAll("[.\\s]+", " ").trim();
    }
}
