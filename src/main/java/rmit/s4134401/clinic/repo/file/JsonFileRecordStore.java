package rmit.s4134401.clinic.repo.file;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import rmit.s4134401.clinic.NotFoundException;
import rmit.s4134401.clinic.RecordStoreException;
import rmit.s4134401.clinic.codec.JsonRecords;
import rmit.s4134401.clinic.repo.RecordStore;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/** One pretty-printed UTF-8 JSON file per record under a base directory. */
public class JsonFileRecordStore implements RecordStore {
    private static final Logger log = LoggerFactory.getLogger(JsonFileRecordStore.class);

    private final Path baseDir;

    public JsonFileRecordStore(Path baseDir){
        if (baseDir == null) throw new IllegalArgumentException("null base dir");
        this.baseDir = baseDir;
    }

    public void write(JsonNode record, String destination) {
        Path file = resolve(destination);
        try {
            Files.createDirectories(file.getParent());
            String json = JsonRecords.mapper().writeValueAsString(record);
            Files.write(file, json.getBytes(StandardCharsets.UTF_8));
            log.debug("Wrote record to {}", file);
        } catch (IOException e) {
            throw new RecordStoreException("write " + destination + " failed: " + e.getMessage(), e);
        }
    }

    public JsonNode read(String source) {
        Path file = resolve(source);
        if (!Files.exists(file)) throw new NotFoundException("No record at " + source);
        try {
            String json = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
            return JsonRecords.mapper().readTree(json);
        } catch (JsonProcessingException e) {
            throw new RecordStoreException("malformed record in " + source + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new RecordStoreException("read " + source + " failed: " + e.getMessage(), e);
        }
    }

    public boolean exists(String source) { return Files.exists(resolve(source)); }

    private Path resolve(String name){
        if (name == null || name.isBlank()) throw new IllegalArgumentException("record name required");
        Path p = baseDir.resolve(name).normalize();
        if (!p.startsWith(baseDir.normalize())) throw new IllegalArgumentException("record name escapes store: " + name);
        return p;
    }
}
