package rmit.s4134401.clinic;

import java.util.Locale;

public enum PatientType {
    ADULT("adultpatient"),
    CHILD("childpatient"),
    SENIOR("seniorpatient");

    private final String tag;

    PatientType(String tag){ this.tag = tag; }

    /** Lowercase tag used by the registry and written as the record's {@code type}. */
    public String tag(){ return tag; }

    public static PatientType fromTag(String tag){
        if (tag == null) throw new UnknownPatientTypeException(null);
        String key = tag.toLowerCase(Locale.ROOT);
        for (PatientType t : values()) if (t.tag.equals(key)) return t;
        throw new UnknownPatientTypeException(tag);
    }
}
