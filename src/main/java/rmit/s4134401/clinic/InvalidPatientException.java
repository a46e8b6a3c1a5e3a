package rmit.s4134401.clinic;

public class InvalidPatientException extends ClinicException {
    public InvalidPatientException(String message){ super(message); }
}
