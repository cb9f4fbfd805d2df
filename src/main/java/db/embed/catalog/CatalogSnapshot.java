package db.embed.catalog;

import java.util.List;
import java.util.Optional;

import db.embed.storage.Record;

/**
 * Read-only copy of the catalog for dashboards and other observers. Records are immutable,
 * so copying the row lists is enough to detach the view from later mutations.
 */
public record CatalogSnapshot(List<TableSnapshot> tables) {

    public CatalogSnapshot {
        tables = List.copyOf(tables);
    }

    public Optional<TableSnapshot> table(String name) {
        return tables.stream().filter(t -> t.schema().name().equals(name)).findFirst();
    }

    public List<String> tableNames() {
        return tables.stream().map(t -> t.schema().name()).toList();
    }

    public record TableSnapshot(TableSchema schema, List<Record> rows) {
        public TableSnapshot {
            rows = List.copyOf(rows);
        }
    }
}
