package rmit.s4134401.clinic.repo;

import rmit.s4134401.clinic.ActionLog;
import rmit.s4134401.clinic.ActionType;
import rmit.s4134401.clinic.AuditTrail;

import java.time.Instant;
import java.util.List;

public interface AuditRepository extends AuditTrail {
    void log(Instant when, String actor, ActionType type, String details);
    List<ActionLog> findAll();

    @Override
    default void record(String eventText){ log(Instant.now(), "system", ActionType.EVENT, eventText); }
}
