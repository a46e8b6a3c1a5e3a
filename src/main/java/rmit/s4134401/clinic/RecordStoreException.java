package rmit.s4134401.clinic;

public class RecordStoreException extends ClinicException {
    public RecordStoreException(String message, Throwable cause){ super(message, cause); }
}
