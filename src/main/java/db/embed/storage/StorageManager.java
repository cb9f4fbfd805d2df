package db.embed.storage;

import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.lang.reflect.Type;
import java.nio.charset.CharsetEncoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.CRC32;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonIOException;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import com.google.gson.reflect.TypeToken;

import db.embed.catalog.CatalogManager;
import db.embed.catalog.ColumnSchema;
import db.embed.catalog.TableSchema;
import db.embed.config.EngineConfig;
import db.embed.error.DbException;
import db.embed.error.ErrorKind;

/**
 * Persists the catalog (schemas and rows, never indexes) as a single JSON document and
 * loads it back, rebuilding each table's unique indexes from the loaded rows.
 *
 * Document layout:
 * <pre>
 * {"format":"embed-db","version":1,"checksum":"&lt;crc32 of tables&gt;","tables":[
 *   {"name":"t","columns":[{"name":"id","type":"INT","primaryKey":true,"unique":false}],"rows":[[1,"x"]]}]}
 * </pre>
 * The checksum covers the compact rendering of the {@code tables} array so a truncated or
 * hand-edited file is rejected instead of being partially loaded.
 */
public class StorageManager {
    private static final Logger logger = LoggerFactory.getLogger(StorageManager.class);

    public static final String FORMAT = "embed-db";
    public static final int VERSION = 1;

    private static final Type COLUMNS_TYPE = new TypeToken<List<ColumnSchema>>(){}.getType();

    private final Path file;
    private final boolean syncWrites;
    private final Gson gson;

    public StorageManager(Path file, boolean syncWrites, boolean prettyPrint) {
        this.file = file;
        this.syncWrites = syncWrites;
        GsonBuilder builder = new GsonBuilder()
            .disableHtmlEscaping()
            .registerTypeHierarchyAdapter(Value.class, new ValueAdapter().nullSafe());
        if (prettyPrint) builder.setPrettyPrinting();
        this.gson = builder.create();
    }

    public StorageManager(EngineConfig config) {
        this(config.dataFile, config.syncWrites, config.prettyJson);
    }

    public Path file() { return file; }

    /**
     * Writes the whole catalog. The target file is replaced atomically, so a crash mid-write
     * leaves the previous document intact.
     */
    public void save(CatalogManager catalog) {
        JsonArray tables = new JsonArray();
        for (Table table : catalog.tables()) {
            tables.add(encodeTable(table));
        }
        JsonObject root = new JsonObject();
        root.addProperty("format", FORMAT);
        root.addProperty("version", VERSION);
        root.addProperty("checksum", checksum(tables));
        root.add("tables", tables);

        Path dir = file.toAbsolutePath().getParent();
        Path tmp = null;
        try {
            Files.createDirectories(dir);
            tmp = Files.createTempFile(dir, file.getFileName().toString(), ".tmp");
            try (FileOutputStream fos = new FileOutputStream(tmp.toFile());
                 Writer writer = new OutputStreamWriter(fos, strictUtf8())) {
                gson.toJson(root, writer);
                writer.flush();
                if (syncWrites) fos.getChannel().force(true);
            }
            moveIntoPlace(tmp);
            tmp = null;
        } catch (IOException e) {
            throw DbException.io("Failed saving database file: " + file, e);
        } catch (JsonIOException e) {
            // Gson wraps writer failures, including unencodable text
            throw DbException.io("Failed saving database file: " + file + ": " + e.getMessage(), e);
        } finally {
            if (tmp != null) deleteQuietly(tmp);
        }
        logger.debug("Saved {} table(s) to {}", tables.size(), file);
    }

    /**
     * Reads the document, or returns an empty catalog when no file exists yet. Any structural
     * problem is reported as a FORMAT_ERROR; nothing is partially loaded.
     */
    public CatalogManager load() {
        CatalogManager catalog = new CatalogManager();
        if (!Files.exists(file)) {
            logger.info("No database file at {}, starting empty", file);
            return catalog;
        }
        String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw DbException.io("Failed reading database file: " + file, e);
        }

        JsonObject root;
        try {
            JsonElement parsed = JsonParser.parseString(content);
            if (!parsed.isJsonObject()) throw DbException.format("Database file is not a JSON object: " + file);
            root = parsed.getAsJsonObject();
        } catch (JsonParseException e) {
            throw DbException.format("Malformed database file " + file + ": " + e.getMessage(), e);
        }

        String format = stringField(root, "format");
        if (!FORMAT.equals(format)) throw DbException.format("Unknown format '" + format + "' in " + file);
        int version = intField(root, "version");
        if (version != VERSION) throw DbException.format("Unsupported version " + version + " in " + file);
        JsonArray tables = arrayField(root, "tables");
        String expected = stringField(root, "checksum");
        String actual = checksum(tables);
        if (!expected.equalsIgnoreCase(actual)) {
            throw DbException.format("Checksum mismatch in " + file + " (expected " + expected + ", computed " + actual + ")");
        }

        int rowTotal = 0;
        for (JsonElement el : tables) {
            if (!el.isJsonObject()) throw DbException.format("Table entry is not an object");
            rowTotal += decodeTable(el.getAsJsonObject(), catalog);
        }
        logger.info("Loaded {} table(s), {} row(s) from {}", catalog.tables().size(), rowTotal, file);
        return catalog;
    }

    private JsonObject encodeTable(Table table) {
        JsonObject obj = new JsonObject();
        obj.addProperty("name", table.name());
        obj.add("columns", gson.toJsonTree(table.schema().columns(), COLUMNS_TYPE));
        JsonArray rows = new JsonArray();
        for (Record r : table.rows()) {
            JsonArray row = new JsonArray();
            for (Value v : r.getValues()) row.add(gson.toJsonTree(v, Value.class));
            rows.add(row);
        }
        obj.add("rows", rows);
        return obj;
    }

    private int decodeTable(JsonObject obj, CatalogManager catalog) {
        String name = stringField(obj, "name");
        Table table;
        try {
            List<ColumnSchema> columns = gson.fromJson(arrayField(obj, "columns"), COLUMNS_TYPE);
            for (ColumnSchema c : columns) {
                if (c == null || c.name() == null || c.type() == null) {
                    throw DbException.format("Incomplete column definition in table '" + name + "'");
                }
            }
            TableSchema schema = new TableSchema(name, columns);
            schema.validate();
            table = catalog.defineTable(schema);

            JsonArray rows = arrayField(obj, "rows");
            for (JsonElement rowEl : rows) {
                if (!rowEl.isJsonArray()) throw DbException.format("Row in table '" + name + "' is not an array");
                List<Value> values = new ArrayList<>();
                for (JsonElement v : rowEl.getAsJsonArray()) {
                    Value value = gson.fromJson(v, Value.class);
                    if (value == null) throw DbException.format("Null value in table '" + name + "'");
                    values.add(value);
                }
                table.loadRow(new Record(values));
            }
            table.rebuildIndexes();
        } catch (JsonParseException | IllegalArgumentException e) {
            throw DbException.format("Invalid table '" + name + "': " + e.getMessage(), e);
        } catch (DbException e) {
            if (e.kind() == ErrorKind.FORMAT_ERROR) throw e;
            throw DbException.format("Invalid table '" + name + "': " + e.getMessage(), e);
        }
        return table.rowCount();
    }

    private void moveIntoPlace(Path tmp) throws IOException {
        try {
            Files.move(tmp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            logger.debug("Atomic move not supported for {}, falling back to replace", file);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void deleteQuietly(Path tmp) {
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            logger.warn("Could not delete temporary file {}", tmp, e);
        }
    }

    // Fails on malformed UTF-16 instead of writing '?' in its place.
    private static CharsetEncoder strictUtf8() {
        return StandardCharsets.UTF_8.newEncoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
    }

    static String checksum(JsonArray tables) {
        CRC32 crc = new CRC32();
        crc.update(tables.toString().getBytes(StandardCharsets.UTF_8));
        return Long.toHexString(crc.getValue());
    }

    private static JsonElement field(JsonObject obj, String name) {
        JsonElement el = obj.get(name);
        if (el == null || el.isJsonNull()) throw DbException.format("Missing field '" + name + "'");
        return el;
    }

    private static String stringField(JsonObject obj, String name) {
        JsonElement el = field(obj, name);
        if (!(el instanceof JsonPrimitive p) || !p.isString()) throw DbException.format("Field '" + name + "' must be a string");
        return p.getAsString();
    }

    private static int intField(JsonObject obj, String name) {
        JsonElement el = field(obj, name);
        if (!(el instanceof JsonPrimitive p) || !p.isNumber()) throw DbException.format("Field '" + name + "' must be a number");
        return p.getAsInt();
    }

    private static JsonArray arrayField(JsonObject obj, String name) {
        JsonElement el = field(obj, name);
        if (!el.isJsonArray()) throw DbException.format("Field '" + name + "' must be an array");
        return el.getAsJsonArray();
    }
}
