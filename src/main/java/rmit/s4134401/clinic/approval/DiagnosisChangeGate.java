package rmit.s4134401.clinic.approval;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import rmit.s4134401.clinic.Appointment;
import rmit.s4134401.clinic.PermissionDeniedException;

import java.util.Arrays;
import java.util.stream.Collectors;

public final class DiagnosisChangeGate {
    private static final Logger log = LoggerFactory.getLogger(DiagnosisChangeGate.class);

    private DiagnosisChangeGate(){}

    /**
     * Runs {@code chain} only if {@code requesterRole} is one of the role codes. Which handler
     * ends up approving does not depend on the requester's role.
     */
    public static ApprovalResult changeDiagnosis(String requesterRole, Appointment appointment,
                                                 String newDiagnosis, DiagnosisChangeHandler chain){
        if (Role.fromCode(requesterRole).isEmpty()) {
            String allowed = Arrays.stream(Role.values()).map(Role::code).collect(Collectors.joining(", "));
            throw new PermissionDeniedException(requesterRole, "One of the roles is required: " + allowed);
        }
        if (appointment == null || chain == null) throw new IllegalArgumentException("null appointment or chain");
        log.info("Request to change diagnosis to '{}'", newDiagnosis);
        return chain.handleRequest(appointment, newDiagnosis);
    }
}
