package db.embed.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Engine settings. Defaults come from {@code embed-db.properties} on the classpath, system
 * properties with the same keys override them, and {@link #fromArgs(String[])} applies
 * command-line flags last.
 */
public class EngineConfig {
    private static final Logger logger = LoggerFactory.getLogger(EngineConfig.class);

    public static final String RESOURCE = "embed-db.properties";
    public static final String KEY_DATA_FILE = "embeddb.data.file";
    public static final String KEY_SYNC_WRITES = "embeddb.sync.writes";
    public static final String KEY_PRETTY_JSON = "embeddb.pretty.json";

    static final String DEFAULT_DATA_FILE = "data/embeddb.json";

    public final Path dataFile;
    public final boolean syncWrites;
    public final boolean prettyJson;

    public EngineConfig(Path dataFile, boolean syncWrites, boolean prettyJson) {
        this.dataFile = dataFile;
        this.syncWrites = syncWrites;
        this.prettyJson = prettyJson;
    }

    public static EngineConfig defaultConfig() {
        Properties props = new Properties();
        try (InputStream in = EngineConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) props.load(in);
        } catch (IOException e) {
            logger.warn("Could not read {}, using built-in defaults", RESOURCE, e);
        }
        for (String key : new String[] { KEY_DATA_FILE, KEY_SYNC_WRITES, KEY_PRETTY_JSON }) {
            String sys = System.getProperty(key);
            if (sys != null) props.setProperty(key, sys);
        }
        return fromProperties(props);
    }

    public static EngineConfig fromProperties(Properties props) {
        Path dataFile = Path.of(props.getProperty(KEY_DATA_FILE, DEFAULT_DATA_FILE).trim());
        boolean sync = Boolean.parseBoolean(props.getProperty(KEY_SYNC_WRITES, "true").trim());
        boolean pretty = Boolean.parseBoolean(props.getProperty(KEY_PRETTY_JSON, "false").trim());
        return new EngineConfig(dataFile, sync, pretty);
    }

    public static EngineConfig fromArgs(String[] args) {
        EngineConfig base = defaultConfig();
        Path dataFile = base.dataFile;
        boolean sync = base.syncWrites;
        boolean pretty = base.prettyJson;

        for (String a : args) {
            if (a == null) continue;
            String s = a.trim();
            if (s.startsWith("--data=")) {
                dataFile = Path.of(s.substring("--data=".length()));
            } else if (s.equals("--no-sync")) {
                sync = false;
            } else if (s.equals("--pretty")) {
                pretty = true;
            } else {
                logger.warn("Ignoring unknown argument: {}", s);
            }
        }
        return new EngineConfig(dataFile, sync, pretty);
    }

    @Override
    public String toString() {
        return "EngineConfig[dataFile=" + dataFile + ", syncWrites=" + syncWrites + ", prettyJson=" + prettyJson + "]";
    }
}
