package br.edu.ifba.graphsync.naming;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Turns free-form type names into canonical graph identifiers.
 *
 * <p>Labels are PascalCase ({@code research_paper → ResearchPaper}), relationship types are
 * UPPER_SNAKE_CASE ({@code works-at → WORKS_AT}). Spelling variants of the same name
 * converge on one identifier, and normalizing an identifier again returns it unchanged.</p>
 *
 * <p>The default instance title-cases every token, so {@code ML-Model}, {@code ml_model}
 * and {@code MlModel} all become {@code MlModel}. {@link #preservingAcronyms()} keeps
 * all-uppercase tokens of up to four letters ({@code MLModel → MLModel}); that mode is
 * deterministic but no longer merges acronym and lower-case spellings.</p>
 */
public final class IdentifierNormalizer {

    public static final String DEFAULT_LABEL = "Entity";
    public static final String DEFAULT_RELATIONSHIP_TYPE = "RELATED_TO";

    private static final int MAX_ACRONYM_LENGTH = 4;

    private static final Pattern SEPARATORS = Pattern.compile("[^A-Za-z0-9]+");

    // lower/digit -> Upper, and the last capital of an acronym run before a capitalized word
    private static final Pattern CASE_BOUNDARY =
        Pattern.compile("(?<=[a-z0-9])(?=[A-Z])|(?<=[A-Z])(?=[A-Z][a-z])");

    private static final IdentifierNormalizer CANONICAL = new IdentifierNormalizer(false);
    private static final IdentifierNormalizer PRESERVING_ACRONYMS = new IdentifierNormalizer(true);

    private final boolean preserveAcronyms;

    private IdentifierNormalizer(boolean preserveAcronyms) {
        this.preserveAcronyms = preserveAcronyms;
    }

    /** The default normalizer. */
    @NotNull
    public static IdentifierNormalizer canonical() {
        return CANONICAL;
    }

    /** A normalizer that keeps short all-uppercase tokens as written. */
    @NotNull
    public static IdentifierNormalizer preservingAcronyms() {
        return PRESERVING_ACRONYMS;
    }

    /**
     * Normalizes a raw entity type with the default normalizer.
     *
     * @param raw the raw type name (may be null or blank)
     * @return the canonical label, never empty
     */
    @NotNull
    public static String normalizeLabel(@Nullable String raw) {
        return CANONICAL.label(raw);
    }

    /**
     * Normalizes a raw relationship type with the default normalizer.
     *
     * @param raw the raw type name (may be null or blank)
     * @return the canonical relationship type, never empty
     */
    @NotNull
    public static String normalizeRelationshipType(@Nullable String raw) {
        return CANONICAL.relationshipType(raw);
    }

    /**
     * Returns the PascalCase label for a raw entity type.
     *
     * @param raw the raw type name
     * @return the label; {@value #DEFAULT_LABEL} when nothing usable remains, prefixed with it
     *         when the result would start with a digit
     */
    @NotNull
    public String label(@Nullable String raw) {
        StringBuilder label = new StringBuilder();
        for (String token : tokens(raw)) {
            label.append(caseToken(token));
        }
        if (label.length() == 0) {
            return DEFAULT_LABEL;
        }
        if (Character.isDigit(label.charAt(0))) {
            label.insert(0, DEFAULT_LABEL);
        }
        return label.toString();
    }

    /**
     * Returns the UPPER_SNAKE_CASE relationship type for a raw type name.
     *
     * @param raw the raw type name
     * @return the relationship type; {@value #DEFAULT_RELATIONSHIP_TYPE} when nothing usable
     *         remains, prefixed with it when the result would start with a digit
     */
    @NotNull
    public String relationshipType(@Nullable String raw) {
        List<String> tokens = tokens(raw);
        if (tokens.isEmpty()) {
            return DEFAULT_RELATIONSHIP_TYPE;
        }
        List<String> upper = new ArrayList<>(tokens.size());
        for (String token : tokens) {
            upper.add(token.toUpperCase(Locale.ROOT));
        }
        String type = String.join("_", upper);
        if (Character.isDigit(type.charAt(0))) {
            return DEFAULT_RELATIONSHIP_TYPE + "_" + type;
        }
        return type;
    }

    /**
     * Splits a raw name into word tokens.
     *
     * <p>Adjacent single-letter tokens are joined ({@code a-b-c → abc}); otherwise
     * {@code A B} would become {@code AB}, which splits back into one token instead of two.</p>
     */
    @NotNull
    static List<String> tokens(@Nullable String raw) {
        List<String> tokens = new ArrayList<>();
        if (raw == null || raw.isBlank()) {
            return tokens;
        }
        for (String part : SEPARATORS.split(raw)) {
            if (part.isEmpty()) {
                continue;
            }
            for (String token : CASE_BOUNDARY.split(part)) {
                if (!token.isEmpty()) {
                    tokens.add(token);
                }
            }
        }
        return mergeSingleLetters(tokens);
    }

    private static List<String> mergeSingleLetters(List<String> tokens) {
        List<String> merged = new ArrayList<>(tokens.size());
        StringBuilder run = new StringBuilder();
        for (String token : tokens) {
            if (token.length() == 1 && Character.isLetter(token.charAt(0))) {
                run.append(token);
                continue;
            }
            if (run.length() > 0) {
                merged.add(run.toString());
                run.setLength(0);
            }
            merged.add(token);
        }
        if (run.length() > 0) {
            merged.add(run.toString());
        }
        return merged;
    }

    private String caseToken(String token) {
        if (preserveAcronyms && token.length() <= MAX_ACRONYM_LENGTH && isAcronym(token)) {
            return token;
        }
        return Character.toUpperCase(token.charAt(0)) + token.substring(1).toLowerCase(Locale.ROOT);
    }

    private static boolean isAcronym(String token) {
        boolean hasLetter = false;
        for (int i = 0; i < token.length(); i++) {
            char c = token.charAt(i);
            if (Character.isLowerCase(c)) {
                return false;
            }
            hasLetter |= Character.isLetter(c);
        }
        return hasLetter && token.length() > 1;
    }
}
