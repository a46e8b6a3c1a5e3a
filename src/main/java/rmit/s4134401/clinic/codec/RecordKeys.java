package rmit.s4134401.clinic.codec;

/** Field names of the persisted record layout. Lowercase, stable. */
public final class RecordKeys {
    private RecordKeys(){}

    public static final String PATIENT_ID = "patient_id";
    public static final String NAME = "name";
    public static final String AGE = "age";
    public static final String GENDER = "gender";
    public static final String MEDICAL_HISTORY = "medical_history";
    public static final String TYPE = "type";

    public static final String OCCUPATION = "occupation";
    public static final String GUARDIAN = "guardian";
    public static final String CHRONIC_CONDITIONS = "chronic_conditions";

    public static final String APPOINTMENT_ID = "appointment_id";
    public static final String PATIENT = "patient";
    public static final String DOCTOR = "doctor";
    public static final String DATE = "date";
    public static final String DIAGNOSIS = "diagnosis";
    public static final String PRESCRIPTION = "prescription";
    public static final String DOCTOR_INFO = "doctor_info";
    public static final String SPECIALTY = "specialty";
    public static final String CONTACT_INFO = "contact_info";
    public static final String SERVICES = "services";
    public static final String PRICE = "price";
}
