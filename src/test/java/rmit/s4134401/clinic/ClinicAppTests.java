package rmit.s4134401.clinic;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import rmit.s4134401.clinic.repo.AuditRepository;
import rmit.s4134401.clinic.repo.file.JsonFileRecordStore;
import rmit.s4134401.clinic.repo.jdbc.JdbcAuditRepository;
import rmit.s4134401.clinic.service.ClinicService;
import rmit.s4134401.clinic.util.ClinicConfig;
import rmit.s4134401.clinic.util.DB;
import rmit.s4134401.clinic.util.LoggingNotifier;
import rmit.s4134401.clinic.util.SchemaMigrator;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.util.Locale;
import java.util.Scanner;

import static org.junit.jupiter.api.Assertions.*;

class ClinicAppTests {

    @TempDir Path tmp;

    ClinicApp app;
    AuditRepository auditRepo;

    @BeforeEach
    void setup() {
        DB.shutdown();
        DB.init(tmp.resolve("app_" + System.nanoTime() + ".db").toString());
        SchemaMigrator.ensure();
        auditRepo = new JdbcAuditRepository();
        Notifier notifier = new LoggingNotifier();
        ClinicService svc = new ClinicService(new Clinic(), new JsonFileRecordStore(tmp.resolve("data")), auditRepo, notifier);
        app = new ClinicApp(svc, auditRepo, notifier);
    }

    @AfterEach
    void tearDown() { DB.shutdown(); }

    private String runScript(String script) {
        PrintStream old = System.out;
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        System.setOut(new PrintStream(buf, true, StandardCharsets.UTF_8));
        try {
            app.run(new Scanner(new ByteArrayInputStream(script.getBytes(StandardCharsets.UTF_8)), StandardCharsets.UTF_8));
        } finally {
            System.setOut(old);
        }
        return buf.toString(StandardCharsets.UTF_8);
    }

    @Test
    void testMenuSession() {
        String out = runScript(
                "1\nadultpatient\nA1\nIvan Petrov\n35\nm\nAllergy\nProgrammer\n"
              + "7\nAP1\nA1\nDr Ivanov\n2024-03-01\nFlu\nRest\nTherapist\nivanov@example.com\n"
              + "8\nAP1\nConsultation\n1500\n"
              + "13\nAP1\nNurse\nminor change\n"
              + "13\nAP1\nDoctor\nminor change: cold\n"
              + "12\nAP1\n"
              + "16\nAP1\n"
              + "99\n0\n");

        assertTrue(out.contains("Registered: Patient: Ivan Petrov"));
        assertTrue(out.contains("Booked AP1"));
        assertTrue(out.contains("Total: 1500"));
        assertTrue(out.contains("[ERROR] PermissionDeniedException"));
        assertTrue(out.contains("Result: approved by Doctor. Diagnosis now: minor change: cold"));
        assertTrue(out.contains("Total cost: 1500"));
        assertTrue(out.contains("Saved appointment-AP1.json"));
        assertTrue(out.contains("Unknown option"));
        assertTrue(out.endsWith("Bye." + System.lineSeparator()));
        assertTrue(Files.exists(tmp.resolve("data").resolve("appointment-AP1.json")));
    }

    @Test
    void testErrorsDoNotEndSession() {
        String out = runScript("3\nmissing\n1\nalienpatient\n0\n");
        assertTrue(out.contains("[ERROR] NotFoundException: Patient not found: missing"));
        assertTrue(out.contains("[ERROR] UnknownPatientTypeException"));
        assertTrue(out.contains("Bye."));
    }

    @Test
    void testGenderInputIsUpperCasedUnderAnyDefaultLocale() {
        Locale old = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
        String out;
        try {
            out = runScript("1\nadultpatient\nA7\nIrina\n40\nm\n\nTeacher\n"
                    + "2\nA7\n\nf\n\n0\n");
        } finally {
            Locale.setDefault(old);
        }
        assertTrue(out.contains("Registered: Patient: Irina, occupation: Teacher, age: 40, gender: M"));
        assertTrue(out.contains("Now: Patient: Irina, occupation: Teacher, age: 40, gender: F"));
    }

    private ClinicConfig configIn(Path dir, String dbFile) throws Exception {
        Path props = dir.resolve("clinic.properties");
        Files.write(props, ("clinic.db.file=" + dbFile.replace("\\", "/") + "\n"
                + "clinic.data.dir=" + dir.resolve("records").toString().replace("\\", "/") + "\n").getBytes(StandardCharsets.UTF_8));
        return new ClinicConfig(props);
    }

    @Test
    void testStartClosesPoolAfterSession() throws Exception {
        DB.shutdown();
        Path dir = Files.createDirectory(tmp.resolve("run"));
        ClinicConfig cfg = configIn(dir, dir.resolve("run.db").toString());

        PrintStream old = System.out;
        System.setOut(new PrintStream(new ByteArrayOutputStream(), true, StandardCharsets.UTF_8));
        try {
            ClinicApp.start(cfg, new Scanner(new ByteArrayInputStream("0\n".getBytes(StandardCharsets.UTF_8)), StandardCharsets.UTF_8));
        } finally {
            System.setOut(old);
        }
        assertThrows(IllegalStateException.class, DB::get);
        assertTrue(Files.exists(dir.resolve("run.db")));
    }

    @Test
    void testStartClosesPoolWhenSchemaSetupFails() throws Exception {
        DB.shutdown();
        Path dir = Files.createDirectory(tmp.resolve("broken"));
        // a directory cannot be opened as a database file
        ClinicConfig cfg = configIn(dir, dir.toString());

        assertThrows(RuntimeException.class,
                () -> ClinicApp.start(cfg, new Scanner(new ByteArrayInputStream("0\n".getBytes(StandardCharsets.UTF_8)))));
        assertThrows(IllegalStateException.class, DB::get);

        DB.init(tmp.resolve("after.db").toString());
        try (Connection c = DB.get()) {
            assertTrue(c.isValid(1));
        }
    }
}
