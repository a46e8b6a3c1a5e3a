package rmit.s4134401.clinic;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class PatientFactory {
    private static final Logger log = LoggerFactory.getLogger(PatientFactory.class);

    private PatientFactory(){}

    /** Age and gender are taken as given; only the setters range-check them. */
    public static Patient createPatient(String tag, PatientDetails details, String variantField){
        Patient p = PatientRegistry.resolve(tag).create(details, variantField);
        log.debug("Created {} {}", p.type(), p.getPatientId());
        return p;
    }

    public static AdultPatient adult(PatientDetails details, String occupation){
        return (AdultPatient) createPatient(PatientType.ADULT.tag(), details, occupation);
    }

    public static ChildPatient child(PatientDetails details, String guardian){
        return (ChildPatient) createPatient(PatientType.CHILD.tag(), details, guardian);
    }

    public static SeniorPatient senior(PatientDetails details, String chronicConditions){
        return (SeniorPatient) createPatient(PatientType.SENIOR.tag(), details, chronicConditions);
    }
}
