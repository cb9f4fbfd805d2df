package db.embed.query;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import db.embed.catalog.CatalogManager;
import db.embed.catalog.ColumnSchema;
import db.embed.catalog.TableSchema;
import db.embed.error.DbException;
import db.embed.exec.Operator;
import db.embed.exec.Row;
import db.embed.storage.Record;
import db.embed.storage.StorageManager;
import db.embed.storage.Table;
import db.embed.storage.Value;

/**
 * Interprets statements against the catalog. Mutations are validated first, applied in memory,
 * then persisted; a failed write undoes the in-memory change before the error propagates.
 * Callers are responsible for holding the appropriate lock.
 */
public class QueryExecutor {
    private static final Logger logger = LoggerFactory.getLogger(QueryExecutor.class);

    private final CatalogManager catalog;
    private final StorageManager storage;
    private final QueryPlanner planner;

    public QueryExecutor(CatalogManager catalog, StorageManager storage) {
        this.catalog = catalog;
        this.storage = storage;
        this.planner = new QueryPlanner(catalog);
    }

    public ExecResult execute(Statement statement) {
        if (statement instanceof CreateTableStatement create) return createTable(create);
        if (statement instanceof InsertQuery insert) return insert(insert);
        if (statement instanceof SelectQuery select) return select(select);
        throw new IllegalArgumentException("Unsupported statement: " + statement);
    }

    private ExecResult createTable(CreateTableStatement stmt) {
        TableSchema schema = stmt.toSchema();
        schema.validate();
        catalog.defineTable(schema);
        boolean saved = false;
        try {
            storage.save(catalog);
            saved = true;
        } finally {
            if (!saved) {
                catalog.removeTable(schema.name());
                logger.warn("Rolled back CREATE TABLE {} after failed write", schema.name());
            }
        }
        logger.info("Created table '{}'", schema.name());
        return new ExecResult.TableCreated(schema.name());
    }

    private ExecResult insert(InsertQuery stmt) {
        Table table = catalog.table(stmt.tableName());
        List<ColumnSchema> cols = table.schema().columns();
        List<Value> values = stmt.values();
        if (values.size() != cols.size()) {
            throw DbException.arityMismatch(table.name(), cols.size(), values.size());
        }
        for (int i = 0; i < cols.size(); i++) {
            if (values.get(i).type() != cols.get(i).type()) {
                throw DbException.typeMismatch(cols.get(i).name(), cols.get(i).type(), values.get(i).type());
            }
        }
        Record record = new Record(values);
        table.insert(record);
        boolean saved = false;
        try {
            storage.save(catalog);
            saved = true;
        } finally {
            if (!saved) {
                table.rollbackInsert(record);
                logger.warn("Rolled back INSERT into {} after failed write", table.name());
            }
        }
        return new ExecResult.RowInserted(table.name());
    }

    private ExecResult select(SelectQuery query) {
        Operator physical = planner.plan(query);
        List<Record> rows = new ArrayList<>();
        for (Row r : stream(physical)) rows.add(r.record());
        return new ExecResult.RowSet(physical.columns(), rows);
    }

    /**
     * Streaming interface: returns an Iterable that opens the operator on first iteration
     * and closes it when exhausted.
     */
    public Iterable<Row> stream(Operator op) {
        return () -> new Iterator<Row>() {
            private boolean opened = false;
            private Row next = null;
            private boolean finished = false;

            private void ensureOpen() {
                if (!opened) {
                    op.open();
                    opened = true;
                    advance();
                }
            }

            private void advance() {
                if (finished) return;
                next = op.next();
                if (next == null) {
                    finished = true;
                    op.close();
                }
            }

            @Override
            public boolean hasNext() {
                ensureOpen();
                return !finished;
            }

            @Override
            public Row next() {
                if (!hasNext()) throw new NoSuchElementException();
                Row current = next;
                advance();
                return current;
            }
        };
    }
}
