package rmit.s4134401.clinic.scheduling;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import rmit.s4134401.clinic.Notifier;

/**
 * Booking steps in a fixed order: availability check, booking, confirmation. The first step
 * that throws stops the sequence.
 */
public abstract class AppointmentProcess implements Schedulable {
    private static final Logger log = LoggerFactory.getLogger(AppointmentProcess.class);

    protected final Notifier notifier;

    protected AppointmentProcess(Notifier notifier){
        if (notifier == null) throw new IllegalArgumentException("null notifier");
        this.notifier = notifier;
    }

    @Override
    public final boolean scheduleAppointment(){
        try {
            checkDoctorAvailability();
            makeAppointment();
            confirmAppointment();
            return true;
        } catch (RuntimeException e) {
            log.error("Appointment booking failed: {}", e.getMessage(), e);
            return false;
        }
    }

    protected abstract void checkDoctorAvailability();
    protected abstract void makeAppointment();
    protected abstract void confirmAppointment();
}
