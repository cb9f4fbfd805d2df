package db.embed.storage;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;

import db.embed.catalog.CatalogManager;
import db.embed.catalog.ColumnSchema;
import db.embed.catalog.DataType;
import db.embed.catalog.TableSchema;
import db.embed.error.DbException;
import db.embed.error.ErrorKind;

public class StorageManagerTest {

    @TempDir
    Path dir;

    private CatalogManager seeded() {
        CatalogManager catalog = new CatalogManager();
        Table teams = catalog.defineTable(new TableSchema("teams", List.of(
            new ColumnSchema("id", DataType.INT, true, false),
            new ColumnSchema("name", DataType.TEXT, false, true))));
        teams.insert(Record.of(Value.of(1), Value.of("Engineering")));
        teams.insert(Record.of(Value.of(2), Value.of("Ops \"east\" é")));
        Table devs = catalog.defineTable(new TableSchema("devs", List.of(
            new ColumnSchema("id", DataType.INT, true, false),
            ColumnSchema.of("name", DataType.TEXT),
            ColumnSchema.of("team_id", DataType.INT))));
        devs.insert(Record.of(Value.of(101), Value.of("Alice"), Value.of(1)));
        devs.insert(Record.of(Value.of(Long.MIN_VALUE), Value.of("Bob"), Value.of(1)));
        return catalog;
    }

    @Test
    void missingFileLoadsEmptyCatalog() {
        StorageManager sm = new StorageManager(dir.resolve("none.json"), false, false);
        assertTrue(sm.load().tables().isEmpty());
    }

    @Test
    void roundTripRebuildsIndexesFromRows() {
        Path file = dir.resolve("db.json");
        StorageManager sm = new StorageManager(file, true, false);
        CatalogManager original = seeded();
        sm.save(original);

        CatalogManager loaded = sm.load();
        assertEquals(List.of("teams", "devs"), loaded.tables().stream().map(Table::name).toList());
        Table teams = loaded.table("teams");
        assertEquals(original.table("teams").rows(), teams.rows());
        assertEquals(original.table("devs").rows(), loaded.table("devs").rows());
        assertEquals(Set.of(Value.of(1), Value.of(2)), teams.indexes().get(0).values());
        assertEquals(Set.of(Value.of("Engineering"), Value.of("Ops \"east\" é")), teams.indexes().get(1).values());
    }

    @Test
    void repeatedSaveLoadIsIdempotent() throws Exception {
        Path file = dir.resolve("db.json");
        StorageManager sm = new StorageManager(file, false, true);
        sm.save(seeded());
        String first = Files.readString(file);
        CatalogManager c = sm.load();
        for (int i = 0; i < 3; i++) {
            sm.save(c);
            c = sm.load();
        }
        assertEquals(first, Files.readString(file));
        assertEquals(Set.of(Value.of(101), Value.of(Long.MIN_VALUE)), c.table("devs").indexes().get(0).values());
    }

    @Test
    void documentHoldsNoIndexes() throws Exception {
        Path file = dir.resolve("db.json");
        new StorageManager(file, false, false).save(seeded());
        JsonObject root = JsonParser.parseString(Files.readString(file)).getAsJsonObject();
        assertEquals("embed-db", root.get("format").getAsString());
        JsonObject table = root.getAsJsonArray("tables").get(0).getAsJsonObject();
        assertEquals(Set.of("name", "columns", "rows"), table.keySet());
    }

    @Test
    void loadedTableStillEnforcesUniqueness() {
        Path file = dir.resolve("db.json");
        StorageManager sm = new StorageManager(file, false, false);
        sm.save(seeded());
        Table teams = sm.load().table("teams");
        assertThrows(DbException.class, () -> teams.insert(Record.of(Value.of(1), Value.of("Other"))));
    }

    @Test
    void truncatedFileIsFormatError() throws Exception {
        Path file = dir.resolve("db.json");
        StorageManager sm = new StorageManager(file, false, false);
        sm.save(seeded());
        String full = Files.readString(file);
        Files.writeString(file, full.substring(0, full.length() / 2));
        DbException ex = assertThrows(DbException.class, sm::load);
        assertEquals(ErrorKind.FORMAT_ERROR, ex.kind());
    }

    @Test
    void emptyFileIsFormatError() throws Exception {
        Path file = dir.resolve("db.json");
        Files.writeString(file, "");
        DbException ex = assertThrows(DbException.class, () -> new StorageManager(file, false, false).load());
        assertEquals(ErrorKind.FORMAT_ERROR, ex.kind());
    }

    @Test
    void editedRowFailsChecksum() throws Exception {
        Path file = dir.resolve("db.json");
        StorageManager sm = new StorageManager(file, false, false);
        sm.save(seeded());
        String edited = Files.readString(file).replace("\"Alice\"", "\"Mallory\"");
        Files.writeString(file, edited);
        DbException ex = assertThrows(DbException.class, sm::load);
        assertEquals(ErrorKind.FORMAT_ERROR, ex.kind());
        assertTrue(ex.getMessage().contains("Checksum"), ex.getMessage());
    }

    @Test
    void duplicateKeyInDocumentIsRejected() throws Exception {
        Path file = dir.resolve("db.json");
        String tables = "[{\"name\":\"t\",\"columns\":[{\"name\":\"id\",\"type\":\"INT\",\"primaryKey\":true,\"unique\":false}],"
            + "\"rows\":[[1],[1]]}]";
        writeDocument(file, tables);
        DbException ex = assertThrows(DbException.class, () -> new StorageManager(file, false, false).load());
        assertEquals(ErrorKind.FORMAT_ERROR, ex.kind());
    }

    @Test
    void valueOfWrongKindIsRejected() throws Exception {
        Path file = dir.resolve("db.json");
        String tables = "[{\"name\":\"t\",\"columns\":[{\"name\":\"id\",\"type\":\"INT\",\"primaryKey\":false,\"unique\":false}],"
            + "\"rows\":[[\"one\"]]}]";
        writeDocument(file, tables);
        DbException ex = assertThrows(DbException.class, () -> new StorageManager(file, false, false).load());
        assertEquals(ErrorKind.FORMAT_ERROR, ex.kind());
    }

    @Test
    void unknownVersionIsRejected() throws Exception {
        Path file = dir.resolve("db.json");
        Files.writeString(file, "{\"format\":\"embed-db\",\"version\":99,\"checksum\":\"0\",\"tables\":[]}");
        DbException ex = assertThrows(DbException.class, () -> new StorageManager(file, false, false).load());
        assertEquals(ErrorKind.FORMAT_ERROR, ex.kind());
    }

    @Test
    void validHandWrittenDocumentLoads() throws Exception {
        Path file = dir.resolve("db.json");
        String tables = "[{\"name\":\"t\",\"columns\":[{\"name\":\"id\",\"type\":\"INT\",\"primaryKey\":true,\"unique\":false},"
            + "{\"name\":\"label\",\"type\":\"TEXT\",\"primaryKey\":false,\"unique\":false}],\"rows\":[[1,\"a\"],[2,\"a\"]]}]";
        writeDocument(file, tables);
        Table t = new StorageManager(file, false, false).load().table("t");
        assertEquals(2, t.rowCount());
        assertEquals(Set.of(Value.of(1), Value.of(2)), t.indexes().get(0).values());
    }

    private static void writeDocument(Path file, String tablesJson) throws Exception {
        String checksum = StorageManager.checksum(JsonParser.parseString(tablesJson).getAsJsonArray());
        String doc = "{\"format\":\"embed-db\",\"version\":1,\"checksum\":\"" + checksum + "\",\"tables\":" + tablesJson + "}";
        Files.write(file, doc.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void unencodableTextFailsSaveAndKeepsPreviousFile() throws Exception {
        Path file = dir.resolve("db.json");
        StorageManager sm = new StorageManager(file, false, false);
        CatalogManager catalog = seeded();
        sm.save(catalog);
        String before = Files.readString(file, StandardCharsets.UTF_8);

        catalog.table("teams").insert(Record.of(Value.of(3), Value.of("a\uD800")));
        DbException ex = assertThrows(DbException.class, () -> sm.save(catalog));
        assertEquals(ErrorKind.IO_ERROR, ex.kind());
        assertEquals(before, Files.readString(file, StandardCharsets.UTF_8));
        assertEquals(2, sm.load().table("teams").rowCount());
    }
}
