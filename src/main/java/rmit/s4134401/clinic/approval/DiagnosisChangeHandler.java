package rmit.s4134401.clinic.approval;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import rmit.s4134401.clinic.Appointment;

import java.util.Locale;
import java.util.Optional;

/**
 * One link of the diagnosis-change approval chain. A handler either approves the change, in which
 * case the appointment's diagnosis is overwritten with the submitted text, or passes it to its
 * successor. The last handler without a match rejects.
 */
public abstract class DiagnosisChangeHandler {
    private static final Logger log = LoggerFactory.getLogger(DiagnosisChangeHandler.class);

    private DiagnosisChangeHandler successor;

    protected DiagnosisChangeHandler(){}

    protected DiagnosisChangeHandler(DiagnosisChangeHandler successor){ setSuccessor(successor); }

    /** Doctor, then department head, then chief physician. Returns the head. */
    public static DiagnosisChangeHandler standardChain(){
        DiagnosisChangeHandler doctor = new DoctorApprover();
        doctor.setSuccessor(new DepartmentHeadApprover())
              .setSuccessor(new ChiefPhysicianApprover());
        return doctor;
    }

    public abstract Role role();

    protected abstract boolean approves(String newDiagnosis);

    /** Links {@code next} after this handler and returns it. */
    public DiagnosisChangeHandler setSuccessor(DiagnosisChangeHandler next){
        for (DiagnosisChangeHandler h = next; h != null; h = h.successor) {
            if (h == this) throw new IllegalArgumentException("approval chain would loop at " + role());
        }
        this.successor = next;
        return next;
    }

    public Optional<DiagnosisChangeHandler> getSuccessor(){ return Optional.ofNullable(successor); }

    public ApprovalResult handleRequest(Appointment appointment, String newDiagnosis){
        if (approves(newDiagnosis)) {
            log.info("{} approved diagnosis change for appointment {}", role().title(), appointment.getAppointmentId());
            appointment.setDiagnosis(newDiagnosis);
            return ApprovalResult.approvedBy(role());
        }
        if (successor != null) {
            log.info("{} forwarded diagnosis change to {}", role().title(), successor.role().title());
            return successor.handleRequest(appointment, newDiagnosis);
        }
        log.info("Diagnosis change for appointment {} cannot be approved", appointment.getAppointmentId());
        return ApprovalResult.notApproved();
    }

    static boolean mentions(String text, String phrase){
        return text != null && text.toLowerCase(Locale.ROOT).contains(phrase);
    }
}
