package rmit.s4134401.clinic.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import rmit.s4134401.clinic.Patient;
import rmit.s4134401.clinic.PatientDetails;
import rmit.s4134401.clinic.PatientRegistry;
import rmit.s4134401.clinic.PatientType;
import rmit.s4134401.clinic.UnknownPatientTypeException;

import static rmit.s4134401.clinic.codec.RecordKeys.*;

public final class PatientRecordCodec {
    private PatientRecordCodec(){}

    public static ObjectNode toRecord(Patient p){
        if (p == null) throw new IllegalArgumentException("null patient");
        ObjectNode r = JsonRecords.newRecord();
        r.put(PATIENT_ID, p.getPatientId());
        r.put(NAME, p.getName());
        r.put(AGE, p.getAge());
        r.put(GENDER, p.getGender());
        r.put(MEDICAL_HISTORY, p.getMedicalHistory() == null ? "" : p.getMedicalHistory());
        r.put(TYPE, p.type().tag());
        r.put(variantKey(p.type()), p.variantField());
        return r;
    }

    /**
     * Builds the patient through the registry. Age and gender are passed through as the record
     * holds them, absent ones stay null.
     */
    public static Patient fromRecord(JsonNode record){
        if (record == null || !record.isObject()) throw new IllegalArgumentException("patient record must be an object");
        String tag = JsonRecords.text(record, TYPE);
        PatientRegistry.PatientConstructor constructor = PatientRegistry.resolve(tag);
        String variant = JsonRecords.textOr(record, variantKey(recordVariant(tag)), "");

        PatientDetails details = new PatientDetails(
                JsonRecords.text(record, PATIENT_ID),
                JsonRecords.text(record, NAME),
                JsonRecords.integer(record, AGE),
                JsonRecords.text(record, GENDER),
                JsonRecords.textOr(record, MEDICAL_HISTORY, ""));
        return constructor.create(details, variant);
    }

    // registered tags outside PatientType can be constructed but have no record key
    private static PatientType recordVariant(String tag){
        try {
            return PatientType.fromTag(tag);
        } catch (UnknownPatientTypeException e) {
            throw new IllegalArgumentException("unsupported record variant: " + tag, e);
        }
    }

    public static String variantKey(PatientType type){
        switch (type) {
            case ADULT: return OCCUPATION;
            case CHILD: return GUARDIAN;
            case SENIOR: return CHRONIC_CONDITIONS;
            default: throw new IllegalStateException("no record key for " + type);
        }
    }
}
