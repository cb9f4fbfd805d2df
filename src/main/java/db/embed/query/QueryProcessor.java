package db.embed.query;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import db.embed.catalog.CatalogManager;
import db.embed.catalog.CatalogSnapshot;
import db.embed.config.EngineConfig;
import db.embed.storage.StorageManager;

/**
 * Engine entry point shared by all front-ends. {@link #submit(String)} lexes and parses outside
 * the lock, then executes under the shared lock (SELECT) or the exclusive lock (CREATE, INSERT).
 * Safe for concurrent callers.
 */
public class QueryProcessor {
    private static final Logger logger = LoggerFactory.getLogger(QueryProcessor.class);

    private final QueryParser parser = new QueryParser();
    private final CatalogManager catalog;
    private final QueryExecutor executor;
    private final StatementLock lock;

    public QueryProcessor(CatalogManager catalog, StorageManager storage) {
        this(catalog, storage, new StatementLock());
    }

    public QueryProcessor(CatalogManager catalog, StorageManager storage, StatementLock lock) {
        this.catalog = catalog;
        this.executor = new QueryExecutor(catalog, storage);
        this.lock = lock;
    }

    /**
     * Loads the database named by the config. A corrupt file fails here with FORMAT_ERROR
     * rather than silently starting empty.
     */
    public static QueryProcessor open(EngineConfig config) {
        StorageManager storage = new StorageManager(config);
        CatalogManager catalog = storage.load();
        logger.info("Engine ready ({})", config);
        return new QueryProcessor(catalog, storage);
    }

    /**
     * Unified execution entry point: one statement in, one result out.
     * Failures surface as {@link db.embed.error.DbException} and leave the catalog unchanged.
     */
    public ExecResult submit(String sql) {
        Statement statement = parser.parse(sql);
        logger.debug("Executing {}", statement);
        if (statement.mutates()) {
            return lock.write(() -> executor.execute(statement));
        }
        return lock.read(() -> executor.execute(statement));
    }

    /** Read-only copy of all schemas and rows, taken under the shared lock. */
    public CatalogSnapshot snapshot() {
        return lock.read(catalog::snapshot);
    }

    public StatementLock lock() {
        return lock;
    }
}
