package rmit.s4134401.clinic.scheduling;

public interface Schedulable {
    boolean scheduleAppointment();
}
