package rmit.s4134401.clinic.util;

import java.sql.Connection;
import java.sql.Statement;

public final class SchemaMigrator {
    private SchemaMigrator(){}

    public static void ensure(){
        try (Connection c = DB.get(); Statement s = c.createStatement()) {
            s.execute("CREATE TABLE IF NOT EXISTS records(" +
                    "name TEXT PRIMARY KEY, body TEXT NOT NULL, updated_ts TEXT NOT NULL)");

            s.execute("CREATE TABLE IF NOT EXISTS audit(" +
                    "id INTEGER PRIMARY KEY AUTOINCREMENT, when_ts TEXT NOT NULL, actor TEXT NOT NULL, type TEXT NOT NULL, details TEXT NOT NULL)");
        } catch (Exception e){
            throw new RuntimeException("Schema ensure failed: " + e.getMessage(), e);
        }
    }
}
