package rmit.s4134401.clinic.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import rmit.s4134401.clinic.AuditTrail;

public class Slf4jAuditTrail implements AuditTrail {
    private static final Logger audit = LoggerFactory.getLogger("clinic.audit");

    @Override public void record(String eventText){ audit.info("Action: {}", eventText); }
}
