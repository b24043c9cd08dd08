package br.edu.ifba.graphsync.config;

import br.edu.ifba.graphsync.codec.SemiStructuredCodec;
import br.edu.ifba.graphsync.export.GraphExportOrchestrator;
import br.edu.ifba.graphsync.graph.GraphPropertyMapper;
import br.edu.ifba.graphsync.graph.GraphSink;
import br.edu.ifba.graphsync.graph.GraphStoreUnavailableException;
import br.edu.ifba.graphsync.graph.impl.Neo4jGraphSink;
import br.edu.ifba.graphsync.source.impl.JdbcConnectionProvider;
import br.edu.ifba.graphsync.source.impl.JdbcRecordRepository;
import br.edu.ifba.graphsync.verify.SyncVerifier;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.neo4j.driver.AuthToken;
import org.neo4j.driver.AuthTokens;
import org.neo4j.driver.Config;
import org.neo4j.driver.Driver;
import org.neo4j.driver.GraphDatabase;
import org.neo4j.driver.exceptions.Neo4jException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.util.concurrent.TimeUnit;

/**
 * CDI producers wiring the synchronization components from {@link GraphSyncConfig}.
 *
 * <p>The host application provides the {@link DataSource} of the record store.</p>
 */
@ApplicationScoped
public class GraphSyncProducers {

    private static final Logger logger = LoggerFactory.getLogger(GraphSyncProducers.class);

    @Inject
    GraphSyncConfig config;

    @Inject
    DataSource dataSource;

    @Produces
    @ApplicationScoped
    public SemiStructuredCodec semiStructuredCodec() {
        return new SemiStructuredCodec();
    }

    @Produces
    @ApplicationScoped
    public GraphPropertyMapper graphPropertyMapper(SemiStructuredCodec codec) {
        return new GraphPropertyMapper(codec, config.normalizer());
    }

    @Produces
    @ApplicationScoped
    public JdbcRecordRepository recordRepository(SemiStructuredCodec codec) {
        JdbcRecordRepository repository = new JdbcRecordRepository(
            new JdbcConnectionProvider(dataSource), config.sqlDialect(), codec, config.readTimeoutSeconds());
        if (config.migrateSchema()) {
            repository.initialize();
        }
        logger.info("Record store ready ({} dialect)", config.sqlDialect());
        return repository;
    }

    /**
     * Opens the Neo4j driver and checks that the server answers.
     */
    @Produces
    @ApplicationScoped
    public GraphSink graphSink() {
        GraphSyncConfig.Neo4j neo4j = config.neo4j();
        AuthToken auth = neo4j.password()
            .map(password -> AuthTokens.basic(neo4j.username(), password))
            .orElseGet(AuthTokens::none);
        Config driverConfig = Config.builder()
            .withConnectionTimeout(neo4j.connectionTimeout().toMillis(), TimeUnit.MILLISECONDS)
            .build();

        logger.info("Connecting to Neo4j at {}", neo4j.uri());
        Driver driver = GraphDatabase.driver(neo4j.uri(), auth, driverConfig);
        try {
            driver.verifyConnectivity();
        } catch (Neo4jException e) {
            driver.close();
            logger.error("Neo4j at {} is not reachable: {}", neo4j.uri(), e.getMessage());
            throw new GraphStoreUnavailableException(e.getMessage(), "connect", e);
        }
        return new Neo4jGraphSink(driver, neo4j.database().orElse(null), neo4j.operationTimeout());
    }

    void closeGraphSink(@Disposes GraphSink sink) {
        sink.close();
    }

    @Produces
    @ApplicationScoped
    public GraphExportOrchestrator exportOrchestrator(
            JdbcRecordRepository repository, GraphSink sink, GraphPropertyMapper mapper) {
        return new GraphExportOrchestrator(repository, sink, mapper, config.exportSettings());
    }

    @Produces
    @ApplicationScoped
    public SyncVerifier syncVerifier(
            JdbcRecordRepository repository, GraphSink sink, GraphPropertyMapper mapper, SemiStructuredCodec codec) {
        return new SyncVerifier(repository, sink, mapper, codec);
    }
}
