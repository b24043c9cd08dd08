package br.edu.ifba.graphsync.codec;

import org.jetbrains.annotations.NotNull;

import java.util.Locale;

/**
 * Relational dialects the record store can run on.
 */
public enum SqlDialect {

    /** Snowflake, semi-structured columns typed {@code VARIANT}. */
    SNOWFLAKE("PARSE_JSON", "RANDOM()", "snowflake"),

    /** SQLite, semi-structured columns stored as JSON text. */
    SQLITE("json", "RANDOM()", "sqlite");

    private final String parseFunction;
    private final String randomFunction;
    private final String migrationFolder;

    SqlDialect(String parseFunction, String randomFunction, String migrationFolder) {
        this.parseFunction = parseFunction;
        this.randomFunction = randomFunction;
        this.migrationFolder = migrationFolder;
    }

    /** Function that turns JSON text into a semi-structured value. */
    @NotNull
    public String parseFunction() {
        return parseFunction;
    }

    /** Expression used in {@code ORDER BY} for random sampling. */
    @NotNull
    public String randomFunction() {
        return randomFunction;
    }

    /** Classpath folder holding this dialect's migration scripts. */
    @NotNull
    public String migrationPath() {
        return "/db/migrations/" + migrationFolder + "/";
    }

    /**
     * Creates the write-statement interceptor for this dialect.
     */
    @NotNull
    public WriteStatementInterceptor writeInterceptor() {
        return new InsertSelectRewriter(parseFunction);
    }

    /**
     * Resolves a dialect from its configured name, ignoring case.
     *
     * @param name dialect name, e.g. {@code snowflake}
     * @return the dialect
     * @throws IllegalArgumentException if the name is unknown
     */
    @NotNull
    public static SqlDialect fromName(@NotNull String name) {
        for (SqlDialect dialect : values()) {
            if (dialect.name().equalsIgnoreCase(name.trim())) {
                return dialect;
            }
        }
        throw new IllegalArgumentException("Unknown SQL dialect: " + name
            + " (expected one of snowflake, sqlite)");
    }

    @Override
    public String toString() {
        return name().toLowerCase(Locale.ROOT);
    }
}
