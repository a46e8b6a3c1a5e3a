package rmit.s4134401.clinic.repo.jdbc;

import rmit.s4134401.clinic.ActionLog;
import rmit.s4134401.clinic.ActionType;
import rmit.s4134401.clinic.repo.AuditRepository;
import rmit.s4134401.clinic.util.DB;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

public final class JdbcAuditRepository implements AuditRepository {

    public JdbcAuditRepository() {
        ensureTable();
    }

    private void ensureTable() {
        try (Connection c = DB.get(); Statement st = c.createStatement()) {
            st.execute("""
                CREATE TABLE IF NOT EXISTS audit(
                  id INTEGER PRIMARY KEY AUTOINCREMENT,
                  when_ts TEXT NOT NULL,
                  actor TEXT NOT NULL,
                  type TEXT NOT NULL,
                  details TEXT NOT NULL
                )
            """);
        } catch (SQLException e) {
            throw new RuntimeException("ensureTable failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void log(Instant when, String actor, ActionType type, String details) {
        try (Connection c = DB.get();
             PreparedStatement ps = c.prepareStatement(
                     "INSERT INTO audit(when_ts, actor, type, details) VALUES(?,?,?,?)")) {
            ps.setString(1, when.toString());
            ps.setString(2, actor);
            ps.setString(3, type.name());
            ps.setString(4, details);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("audit log failed: " + e.getMessage(), e);
        }
    }

    @Override
    public List<ActionLog> findAll() {
        List<ActionLog> out = new ArrayList<ActionLog>();
        try (Connection c = DB.get();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT when_ts, actor, type, details FROM audit ORDER BY id");
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(new ActionLog(Instant.parse(rs.getString(1)), rs.getString(2),
                        ActionType.valueOf(rs.getString(3)), rs.getString(4)));
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("audit findAll failed: " + e.getMessage(), e);
        }
    }
}
