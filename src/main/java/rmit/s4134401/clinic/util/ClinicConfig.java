package rmit.s4134401.clinic.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * Settings from {@code clinic.properties} on the classpath, overlaid by a {@code clinic.properties}
 * in the working directory, overlaid by {@code -Dclinic.*} system properties.
 */
public class ClinicConfig {
    private static final Logger log = LoggerFactory.getLogger(ClinicConfig.class);

    public static final String FILE_NAME = "clinic.properties";
    public static final String DATA_DIR = "clinic.data.dir";
    public static final String DB_FILE = "clinic.db.file";
    public static final String DB_POOL_SIZE = "clinic.db.pool.size";
    public static final String STORE = "clinic.store";

    private final Properties props = new Properties();

    public ClinicConfig(){ this(Paths.get(FILE_NAME)); }

    public ClinicConfig(Path overrideFile){
        try (InputStream is = getClass().getResourceAsStream("/" + FILE_NAME)) {
            if (is != null) props.load(is);
        } catch (IOException e) {
            log.warn("Could not read classpath {}: {}", FILE_NAME, e.getMessage());
        }
        if (overrideFile != null && Files.isRegularFile(overrideFile)) {
            try (Reader r = Files.newBufferedReader(overrideFile, StandardCharsets.UTF_8)) {
                props.load(r);
            } catch (IOException e) {
                log.warn("Could not read {}: {}", overrideFile, e.getMessage());
            }
        }
        for (String key : System.getProperties().stringPropertyNames()) {
            if (key.startsWith("clinic.")) props.setProperty(key, System.getProperty(key));
        }
    }

    public String get(String key, String defaultValue){
        String v = props.getProperty(key);
        return v == null || v.isBlank() ? defaultValue : v.trim();
    }

    public int getInt(String key, int defaultValue){
        String v = props.getProperty(key);
        if (v == null || v.isBlank()) return defaultValue;
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            log.warn("{}='{}' is not a number, using {}", key, v, defaultValue);
            return defaultValue;
        }
    }

    public Path dataDir(){ return Paths.get(get(DATA_DIR, "data")); }
    public String dbFile(){ return get(DB_FILE, "clinic.db"); }
    public int dbPoolSize(){ return getInt(DB_POOL_SIZE, 4); }
    public boolean useJdbcStore(){ return "jdbc".equalsIgnoreCase(get(STORE, "file")); }
}
