package db.embed.catalog;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import db.embed.error.DbException;
import db.embed.storage.Table;

/**
 * Root of the in-memory state: table name to {@link Table}, in creation order.
 * Not thread-safe on its own; callers go through the statement lock.
 */
public class CatalogManager {
    private static final Logger logger = LoggerFactory.getLogger(CatalogManager.class);

    private final Map<String, Table> tables = new LinkedHashMap<>();

    public Table defineTable(TableSchema schema) {
        if (tables.containsKey(schema.name())) throw DbException.duplicateTable(schema.name());
        Table table = new Table(schema);
        tables.put(schema.name(), table);
        logger.debug("Defined table '{}' with {} column(s)", schema.name(), schema.columns().size());
        return table;
    }

    public Table table(String name) {
        Table t = tables.get(name);
        if (t == null) throw DbException.unknownTable(name);
        return t;
    }

    public Optional<Table> findTable(String name) {
        return Optional.ofNullable(tables.get(name));
    }

    public TableSchema getTableSchema(String name) {
        return table(name).schema();
    }

    public Collection<Table> tables() {
        return Collections.unmodifiableCollection(tables.values());
    }

    /** Only used to undo a CREATE TABLE whose persistence write failed. */
    public void removeTable(String name) {
        tables.remove(name);
    }

    /** Deep copy of schemas and rows; safe to hand out after the read lock is released. */
    public CatalogSnapshot snapshot() {
        List<CatalogSnapshot.TableSnapshot> out = new ArrayList<>(tables.size());
        for (Table t : tables.values()) {
            out.add(new CatalogSnapshot.TableSnapshot(t.schema(), List.copyOf(t.rows())));
        }
        return new CatalogSnapshot(out);
    }
}
