package rmit.s4134401.clinic.util;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;

/** Process-wide SQLite pool. One database at a time; {@link #shutdown()} before opening another. */
public final class DB {
    private static final Logger log = LoggerFactory.getLogger(DB.class);
    private static HikariDataSource ds;

    private DB(){}

    public static void init(String sqliteFilePath){ init(sqliteFilePath, 4); }

    public static void init(ClinicConfig config){ init(config.dbFile(), config.dbPoolSize()); }

    public static synchronized void init(String sqliteFilePath, int poolSize){
        if (ds != null) {
            log.debug("Pool already open, ignoring init({})", sqliteFilePath);
            return;
        }
        if (poolSize < 1) throw new IllegalArgumentException("pool size must be >= 1: " + poolSize);
        HikariConfig cfg = new HikariConfig();
        cfg.setJdbcUrl("jdbc:sqlite:" + sqliteFilePath);
        cfg.setMaximumPoolSize(poolSize);
        cfg.setAutoCommit(true);
        cfg.setPoolName("clinic-db");
        // pooled writers wait up to 5s on a locked database
        cfg.addDataSourceProperty("busy_timeout", "5000");
        ds = new HikariDataSource(cfg);
        log.info("SQLite pool open on {} ({} connections max)", sqliteFilePath, poolSize);
    }

    public static Connection get() throws SQLException {
        if (ds == null) throw new IllegalStateException("DB not initialised. Call DB.init().");
        return ds.getConnection();
    }

    public static synchronized void shutdown(){
        if (ds != null) {
            ds.close();
            ds = null;
            log.info("SQLite pool closed");
        }
    }
}
