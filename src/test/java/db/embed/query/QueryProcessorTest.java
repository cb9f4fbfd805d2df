package db.embed.query;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import db.embed.catalog.CatalogManager;
import db.embed.catalog.CatalogSnapshot;
import db.embed.config.EngineConfig;
import db.embed.error.ConstraintViolationException;
import db.embed.error.DbException;
import db.embed.error.ErrorKind;
import db.embed.error.LexException;
import db.embed.error.ParseException;
import db.embed.storage.FailingStorageManager;
import db.embed.storage.Record;
import db.embed.storage.Value;

public class QueryProcessorTest {

    @TempDir
    Path dir;

    private FailingStorageManager storage;
    private QueryProcessor qp;

    @BeforeEach
    void setUp() {
        storage = new FailingStorageManager(dir.resolve("db.json"));
        qp = new QueryProcessor(new CatalogManager(), storage);
    }

    private void scenarioA() {
        assertInstanceOf(ExecResult.TableCreated.class, qp.submit("CREATE TABLE teams (id INT PRIMARY, name TEXT UNIQUE)"));
        assertInstanceOf(ExecResult.RowInserted.class, qp.submit("INSERT INTO teams VALUES (1,'Engineering')"));
    }

    private void scenarioB() {
        qp.submit("CREATE TABLE devs (id INT PRIMARY, name TEXT, team_id INT)");
        qp.submit("INSERT INTO devs VALUES (101,'Alice',1)");
    }

    private ExecResult.RowSet select(String sql) {
        return assertInstanceOf(ExecResult.RowSet.class, qp.submit(sql));
    }

    private static final Record ALICE_ENGINEERING =
        Record.of(Value.of(101), Value.of("Alice"), Value.of(1), Value.of(1), Value.of("Engineering"));

    @Test
    void duplicatePrimaryKeyIsRejected() {
        scenarioA();
        ConstraintViolationException ex = assertThrows(ConstraintViolationException.class,
            () -> qp.submit("INSERT INTO teams VALUES (1,'Ops')"));
        assertEquals("id", ex.column());
        assertEquals(Value.of(1), ex.value());
        assertEquals(1, select("SELECT * FROM teams").size());
    }

    @Test
    void joinReturnsMatchingRow() {
        scenarioA();
        scenarioB();
        ExecResult.RowSet rs = select("SELECT * FROM devs JOIN teams ON team_id = id");
        assertEquals(List.of(ALICE_ENGINEERING), rs.rows());
        assertEquals(List.of("devs.id", "devs.name", "devs.team_id", "teams.id", "teams.name"), rs.columns());
    }

    @Test
    void unmatchedLeftRowIsExcluded() {
        scenarioA();
        scenarioB();
        qp.submit("INSERT INTO devs VALUES (102,'Bob',2)");
        assertEquals(List.of(ALICE_ENGINEERING), select("SELECT * FROM devs JOIN teams ON team_id = id").rows());
        assertEquals(2, select("SELECT * FROM devs").size());
    }

    @Test
    void selectStarKeepsInsertionOrderAndSchemaOrder() {
        qp.submit("CREATE TABLE t (b TEXT, a INT)");
        qp.submit("INSERT INTO t VALUES ('z', 3)");
        qp.submit("INSERT INTO t VALUES ('a', 1)");
        ExecResult.RowSet rs = select("SELECT * FROM t");
        assertEquals(List.of("b", "a"), rs.columns());
        assertEquals(List.of(Record.of(Value.of("z"), Value.of(3)), Record.of(Value.of("a"), Value.of(1))), rs.rows());
    }

    @Test
    void projectionOverJoin() {
        scenarioA();
        scenarioB();
        ExecResult.RowSet rs = select("SELECT devs.name, teams.name FROM devs JOIN teams ON team_id = id");
        assertEquals(List.of("devs.name", "teams.name"), rs.columns());
        assertEquals(List.of(Record.of(Value.of("Alice"), Value.of("Engineering"))), rs.rows());
        DbException ex = assertThrows(DbException.class, () -> qp.submit("SELECT name FROM devs JOIN teams ON team_id = id"));
        assertEquals(ErrorKind.UNKNOWN_COLUMN, ex.kind());
    }

    @Test
    void joinOnMismatchedKindsIsEmptyNotAnError() {
        scenarioA();
        qp.submit("CREATE TABLE labels (code TEXT)");
        qp.submit("INSERT INTO labels VALUES ('1')");
        assertEquals(0, select("SELECT * FROM teams JOIN labels ON id = code").size());
    }

    @Test
    void structuralErrors() {
        scenarioA();
        assertEquals(ErrorKind.UNKNOWN_TABLE, assertThrows(DbException.class, () -> qp.submit("SELECT * FROM ghosts")).kind());
        assertEquals(ErrorKind.UNKNOWN_TABLE, assertThrows(DbException.class, () -> qp.submit("INSERT INTO ghosts VALUES (1)")).kind());
        assertEquals(ErrorKind.UNKNOWN_TABLE,
            assertThrows(DbException.class, () -> qp.submit("SELECT * FROM teams JOIN ghosts ON id = id")).kind());
        assertEquals(ErrorKind.UNKNOWN_COLUMN,
            assertThrows(DbException.class, () -> qp.submit("SELECT * FROM teams JOIN teams ON nope = id")).kind());
        assertEquals(ErrorKind.UNKNOWN_COLUMN,
            assertThrows(DbException.class, () -> qp.submit("SELECT * FROM teams JOIN teams ON id = nope")).kind());
        assertEquals(ErrorKind.ARITY_MISMATCH, assertThrows(DbException.class, () -> qp.submit("INSERT INTO teams VALUES (2)")).kind());
        assertEquals(ErrorKind.TYPE_MISMATCH,
            assertThrows(DbException.class, () -> qp.submit("INSERT INTO teams VALUES ('2', 'Ops')")).kind());
        assertEquals(ErrorKind.DUPLICATE_TABLE,
            assertThrows(DbException.class, () -> qp.submit("CREATE TABLE teams (id INT)")).kind());
        assertEquals(ErrorKind.DUPLICATE_COLUMN,
            assertThrows(DbException.class, () -> qp.submit("CREATE TABLE x (a INT, a TEXT)")).kind());
        assertEquals(ErrorKind.MULTIPLE_PRIMARY_KEYS,
            assertThrows(DbException.class, () -> qp.submit("CREATE TABLE y (a INT PRIMARY, b INT PRIMARY)")).kind());
        assertThrows(ParseException.class, () -> qp.submit("CREATE TBL x (id INT)"));
        assertThrows(LexException.class, () -> qp.submit("SELECT * FROM teams;"));

        assertEquals(List.of("teams"), qp.snapshot().tableNames());
        assertEquals(1, select("SELECT * FROM teams").size());
    }

    @Test
    void failedStatementsDoNotWrite() {
        scenarioA();
        int saves = storage.saves();
        assertThrows(DbException.class, () -> qp.submit("INSERT INTO teams VALUES (1,'Ops')"));
        assertThrows(DbException.class, () -> qp.submit("INSERT INTO teams VALUES (2)"));
        assertThrows(DbException.class, () -> qp.submit("CREATE TABLE teams (id INT)"));
        qp.submit("SELECT * FROM teams");
        assertEquals(saves, storage.saves());
    }

    @Test
    void failedWriteRollsBackInsert() {
        scenarioA();
        storage.setFailing(true);
        DbException ex = assertThrows(DbException.class, () -> qp.submit("INSERT INTO teams VALUES (2,'Ops')"));
        assertEquals(ErrorKind.IO_ERROR, ex.kind());
        assertEquals(1, select("SELECT * FROM teams").size());

        storage.setFailing(false);
        // index entries for 2/'Ops' were rolled back too, so the retry succeeds
        qp.submit("INSERT INTO teams VALUES (2,'Ops')");
        assertEquals(2, select("SELECT * FROM teams").size());
    }

    @Test
    void failedWriteRollsBackCreateTable() {
        storage.setFailing(true);
        assertThrows(DbException.class, () -> qp.submit("CREATE TABLE teams (id INT PRIMARY)"));
        assertEquals(ErrorKind.UNKNOWN_TABLE, assertThrows(DbException.class, () -> qp.submit("SELECT * FROM teams")).kind());
        storage.setFailing(false);
        qp.submit("CREATE TABLE teams (id INT PRIMARY)");
        assertEquals(List.of("teams"), qp.snapshot().tableNames());
    }

    @Test
    void stateSurvivesReopen() {
        Path file = dir.resolve("reopen.json");
        EngineConfig config = new EngineConfig(file, false, false);
        QueryProcessor first = QueryProcessor.open(config);
        first.submit("CREATE TABLE teams (id INT PRIMARY, name TEXT UNIQUE)");
        first.submit("INSERT INTO teams VALUES (1,'Engineering')");
        assertTrue(Files.exists(file));

        QueryProcessor second = QueryProcessor.open(config);
        assertEquals(1, ((ExecResult.RowSet) second.submit("SELECT * FROM teams")).size());
        ConstraintViolationException ex = assertThrows(ConstraintViolationException.class,
            () -> second.submit("INSERT INTO teams VALUES (2,'Engineering')"));
        assertEquals("name", ex.column());
    }

    @Test
    void corruptFileIsFatalToOpen() throws Exception {
        Path file = dir.resolve("corrupt.json");
        Files.writeString(file, "{\"format\":\"embed-db\",\"version\":1,\"tab");
        DbException ex = assertThrows(DbException.class, () -> QueryProcessor.open(new EngineConfig(file, false, false)));
        assertEquals(ErrorKind.FORMAT_ERROR, ex.kind());
    }

    @Test
    void snapshotReflectsCommittedState() {
        scenarioA();
        CatalogSnapshot snap = qp.snapshot();
        qp.submit("INSERT INTO teams VALUES (2,'Ops')");
        assertEquals(1, snap.table("teams").orElseThrow().rows().size());
        assertEquals(2, qp.snapshot().table("teams").orElseThrow().rows().size());
    }

    @Test
    void resultMessages() {
        assertEquals("Table 'teams' created", qp.submit("CREATE TABLE teams (id INT PRIMARY)").message());
        assertEquals("1 row inserted.", qp.submit("INSERT INTO teams VALUES (7)").message());
        assertEquals("(1 row(s))", qp.submit("SELECT * FROM teams").message());
    }

    @Test
    void errorDuringWriteStillRollsBack() {
        scenarioA();
        storage.setError(new OutOfMemoryError("simulated"));
        assertThrows(OutOfMemoryError.class, () -> qp.submit("INSERT INTO teams VALUES (2,'Ops')"));
        assertThrows(OutOfMemoryError.class, () -> qp.submit("CREATE TABLE devs (id INT)"));
        storage.setError(null);

        assertEquals(List.of("teams"), qp.snapshot().tableNames());
        assertEquals(1, select("SELECT * FROM teams").size());
        qp.submit("INSERT INTO teams VALUES (2,'Ops')");
        assertEquals(2, select("SELECT * FROM teams").size());
    }

    @Test
    void unpairedSurrogateNeverReachesMemoryOrDisk() {
        Path file = dir.resolve("text.json");
        EngineConfig config = new EngineConfig(file, false, false);
        QueryProcessor first = QueryProcessor.open(config);
        first.submit("CREATE TABLE t (name TEXT UNIQUE)");
        first.submit("INSERT INTO t VALUES ('a?')");
        DbException ex = assertThrows(DbException.class, () -> first.submit("INSERT INTO t VALUES ('a\uD800')"));
        assertEquals(ErrorKind.LEX_ERROR, ex.kind());
        assertEquals(1, ((ExecResult.RowSet) first.submit("SELECT * FROM t")).size());

        QueryProcessor second = QueryProcessor.open(config);
        ExecResult.RowSet rows = (ExecResult.RowSet) second.submit("SELECT * FROM t");
        assertEquals(List.of(Record.of(Value.of("a?"))), rows.rows());
    }

    @Test
    void unencodableTextFromApiIsRolledBack() {
        CatalogManager catalog = new CatalogManager();
        FailingStorageManager sm = new FailingStorageManager(dir.resolve("api.json"));
        QueryExecutor executor = new QueryExecutor(catalog, sm);
        executor.execute(new QueryParser().parse("CREATE TABLE t (name TEXT UNIQUE)"));

        DbException ex = assertThrows(DbException.class,
            () -> executor.execute(new InsertQuery("t", List.of(Value.of("a\uD800")))));
        assertEquals(ErrorKind.IO_ERROR, ex.kind());
        assertEquals(0, catalog.table("t").rowCount());
        assertFalse(catalog.table("t").indexes().get(0).contains(Value.of("a\uD800")));
    }

    @Test
    void missingStatementTextIsLexError() {
        DbException ex = assertThrows(DbException.class, () -> qp.submit(null));
        assertEquals(ErrorKind.LEX_ERROR, ex.kind());
    }
}
