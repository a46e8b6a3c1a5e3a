package rmit.s4134401.clinic;

public class NotFoundException extends ClinicException {
    public NotFoundException(String message){ super(message); }
}
