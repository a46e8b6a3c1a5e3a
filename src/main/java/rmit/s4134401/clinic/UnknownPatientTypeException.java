package rmit.s4134401.clinic;

public class UnknownPatientTypeException extends ClinicException {
    private final String tag;

    public UnknownPatientTypeException(String tag){
        super("Unknown patient type: " + tag);
        this.tag = tag;
    }

    public String getTag(){ return tag; }
}
