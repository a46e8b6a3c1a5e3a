package rmit.s4134401.clinic.repo;

import com.fasterxml.jackson.databind.JsonNode;

/** Byte sink/source for single records. Callers hand over and receive records, never raw bytes. */
public interface RecordStore {
    void write(JsonNode record, String destination);
    JsonNode read(String source);
    boolean exists(String source);
}
