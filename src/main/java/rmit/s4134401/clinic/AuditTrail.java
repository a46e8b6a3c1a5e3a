package rmit.s4134401.clinic;

/** Fire-and-forget sink for audit events. Callers must not depend on it succeeding. */
public interface AuditTrail {
    void record(String eventText);
}
