package rmit.s4134401.clinic.repo.file;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import rmit.s4134401.clinic.NotFoundException;
import rmit.s4134401.clinic.RecordStoreException;
import rmit.s4134401.clinic.codec.JsonRecords;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class JsonFileRecordStoreTests {

    @TempDir Path tmp;

    JsonFileRecordStore store;

    @BeforeEach
    void setup() {
        store = new JsonFileRecordStore(tmp.resolve("data"));
    }

    @Test
    void testWriteThenReadBack() throws Exception {
        ObjectNode r = JsonRecords.newRecord();
        r.put("name", "Ivan Petrov");
        r.put("history", "Аллергия на пыльцу");
        store.write(r, "patient-A123.json");

        assertTrue(store.exists("patient-A123.json"));
        Path file = tmp.resolve("data").resolve("patient-A123.json");
        String text = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
        assertTrue(text.contains("Аллергия на пыльцу"));
        assertTrue(text.contains("\n"));

        JsonNode back = store.read("patient-A123.json");
        assertEquals(r, back);
    }

    @Test
    void testWriteOverwrites() {
        ObjectNode r = JsonRecords.newRecord();
        r.put("v", 1);
        store.write(r, "x.json");
        r.put("v", 2);
        store.write(r, "x.json");
        assertEquals(2, store.read("x.json").get("v").intValue());
    }

    @Test
    void testMissingFileIsNotFound() {
        assertFalse(store.exists("nope.json"));
        assertThrows(NotFoundException.class, () -> store.read("nope.json"));
    }

    @Test
    void testMalformedFileIsStoreError() throws Exception {
        Files.createDirectories(tmp.resolve("data"));
        Files.write(tmp.resolve("data").resolve("bad.json"), "{not json".getBytes(StandardCharsets.UTF_8));
        assertThrows(RecordStoreException.class, () -> store.read("bad.json"));
    }

    @Test
    void testNameCannotLeaveBaseDir() {
        assertThrows(IllegalArgumentException.class, () -> store.read("../outside.json"));
        assertThrows(IllegalArgumentException.class, () -> store.exists(" "));
    }
}
