package rmit.s4134401.clinic.repo.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import rmit.s4134401.clinic.NotFoundException;
import rmit.s4134401.clinic.RecordStoreException;
import rmit.s4134401.clinic.codec.JsonRecords;
import rmit.s4134401.clinic.repo.RecordStore;
import rmit.s4134401.clinic.util.DB;

import java.sql.*;
import java.time.OffsetDateTime;

public class JdbcRecordStore implements RecordStore {

    public void write(JsonNode record, String destination) {
        try (Connection c = DB.get();
             PreparedStatement ps = c.prepareStatement(
                     "INSERT INTO records(name,body,updated_ts) VALUES(?,?,?) " +
                     "ON CONFLICT(name) DO UPDATE SET body=excluded.body, updated_ts=excluded.updated_ts")) {
            ps.setString(1, destination);
            ps.setString(2, JsonRecords.mapper().writeValueAsString(record));
            ps.setString(3, OffsetDateTime.now().toString());
            ps.executeUpdate();
        } catch (SQLException | JsonProcessingException e) {
            throw new RecordStoreException("write record failed: " + e.getMessage(), e);
        }
    }

    public JsonNode read(String source) {
        try (Connection c = DB.get();
             PreparedStatement ps = c.prepareStatement("SELECT body FROM records WHERE name=?")) {
            ps.setString(1, source);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) throw new NotFoundException("No record at " + source);
                return JsonRecords.mapper().readTree(rs.getString(1));
            }
        } catch (SQLException | JsonProcessingException e) {
            throw new RecordStoreException("read record failed: " + e.getMessage(), e);
        }
    }

    public boolean exists(String source) {
        try (Connection c = DB.get();
             PreparedStatement ps = c.prepareStatement("SELECT 1 FROM records WHERE name=?")) {
            ps.setString(1, source);
            try (ResultSet rs = ps.executeQuery()) { return rs.next(); }
        } catch (SQLException e) {
            throw new RecordStoreException("exists failed: " + e.getMessage(), e);
        }
    }
}
