package br.edu.ifba.graphsync.core;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * The portion of the record store an export or verification covers.
 *
 * <p>Either the whole store or the records of one source document. Every exported node and
 * relationship carries the tag of the document it came from ({@link #tagFor(String)}),
 * whichever scope exported it. A file scope matches elements carrying its own key;
 * {@link #ALL} matches every tagged element.</p>
 *
 * @param sourceFileId the source document, or null for the whole store
 */
public record SyncScope(@Nullable String sourceFileId) {

    public static final String ALL_KEY = "all";
    private static final String FILE_PREFIX = "file:";

    public static final SyncScope ALL = new SyncScope(null);

    public SyncScope {
        if (sourceFileId != null && sourceFileId.isBlank()) {
            throw new IllegalArgumentException("sourceFileId cannot be blank");
        }
    }

    /**
     * Scope covering the records extracted from one source document.
     */
    @NotNull
    public static SyncScope file(@NotNull String sourceFileId) {
        return new SyncScope(Objects.requireNonNull(sourceFileId, "sourceFileId must not be null"));
    }

    /**
     * Parses a scope key as returned by {@link #key()}.
     *
     * @param key {@code all} or {@code file:<id>}
     * @return the scope
     * @throws IllegalArgumentException if the key is malformed
     */
    @NotNull
    public static SyncScope parse(@NotNull String key) {
        if (ALL_KEY.equals(key)) {
            return ALL;
        }
        if (key.startsWith(FILE_PREFIX) && key.length() > FILE_PREFIX.length()) {
            return file(key.substring(FILE_PREFIX.length()));
        }
        throw new IllegalArgumentException("Invalid sync scope: " + key);
    }

    /**
     * Tag stored on a graph element extracted from the given document.
     *
     * @param sourceFileId the record's source document, may be null
     * @return {@code file:<id>}, or {@code all} for records without a document
     */
    @NotNull
    public static String tagFor(@Nullable String sourceFileId) {
        return sourceFileId == null ? ALL_KEY : FILE_PREFIX + sourceFileId;
    }

    /**
     * Whether an element carrying {@code tag} belongs to this scope.
     */
    public boolean covers(@Nullable String tag) {
        return isAll() ? tag != null : key().equals(tag);
    }

    public boolean isAll() {
        return sourceFileId == null;
    }

    /** Stable key; for a file scope it equals the tag its elements carry. */
    @NotNull
    public String key() {
        return isAll() ? ALL_KEY : FILE_PREFIX + sourceFileId;
    }

    @Override
    public String toString() {
        return key();
    }
}
