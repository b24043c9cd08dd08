package br.edu.ifba.graphsync.config;

import br.edu.ifba.graphsync.codec.SqlDialect;
import br.edu.ifba.graphsync.export.ExportSettings;
import br.edu.ifba.graphsync.naming.IdentifierNormalizer;
import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.time.Duration;
import java.util.Optional;

/**
 * Configuration of the relational-to-graph synchronization.
 *
 * All properties are read from application.properties with the prefix "graphsync".
 */
@ConfigMapping(prefix = "graphsync")
public interface GraphSyncConfig {

    /**
     * Relational dialect: {@code snowflake} or {@code sqlite}.
     */
    @WithDefault("snowflake")
    String dialect();

    /**
     * Records per page and per graph transaction.
     */
    @WithDefault("1000")
    int batchSize();

    /**
     * Maximum duration of one page transaction.
     */
    @WithDefault("PT30S")
    Duration batchTimeout();

    /**
     * Number of labels whose nodes are exported concurrently.
     */
    @WithDefault("1")
    int nodeExportParallelism();

    /**
     * How long an export waits for another export of the same scope to finish.
     */
    @WithDefault("PT5S")
    Duration lockTimeout();

    /**
     * JDBC query timeout for every relational read and write.
     */
    @WithDefault("30")
    int readTimeoutSeconds();

    /**
     * Apply the record store migrations at startup.
     */
    @WithDefault("true")
    boolean migrateSchema();

    /**
     * Keep short all-uppercase tokens when deriving labels and types.
     */
    @WithDefault("false")
    boolean preserveAcronyms();

    Verify verify();

    Neo4j neo4j();

    /**
     * Verification settings.
     */
    interface Verify {

        @WithDefault("20")
        int sampleSize();
    }

    /**
     * Neo4j connection settings.
     */
    interface Neo4j {

        @WithDefault("bolt://localhost:7687")
        String uri();

        @WithDefault("neo4j")
        String username();

        Optional<String> password();

        /**
         * Target database; the server default when absent.
         */
        Optional<String> database();

        @WithDefault("PT10S")
        Duration connectionTimeout();

        /**
         * Timeout of reads, index creation and scope clearing.
         */
        @WithDefault("PT30S")
        Duration operationTimeout();
    }

    default SqlDialect sqlDialect() {
        return SqlDialect.fromName(dialect());
    }

    default IdentifierNormalizer normalizer() {
        return preserveAcronyms() ? IdentifierNormalizer.preservingAcronyms() : IdentifierNormalizer.canonical();
    }

    default ExportSettings exportSettings() {
        return new ExportSettings(batchTimeout(), nodeExportParallelism(), lockTimeout());
    }
}
