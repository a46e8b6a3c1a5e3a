package rmit.s4134401.clinic;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.Objects;

/**
 * Base of the three patient variants.
 *
 * <p>Setters reject an out-of-range age or an unrecognised gender code and keep the previous
 * value; they never throw. Construction does not apply those checks, so a patient built from a
 * record carries whatever the record held.
 *
 * <p>Ordering and equality only look at age and medical-history length. Two different patients
 * with the same age and the same history length are equal.
 */
public abstract class Patient implements Comparable<Patient> {
    private static final Logger log = LoggerFactory.getLogger(Patient.class);

    public static final int MIN_AGE_EXCLUSIVE = 1;
    public static final int MAX_AGE_EXCLUSIVE = 110;

    private static final Comparator<Patient> ORDER =
            Comparator.comparing(Patient::getAge, Comparator.nullsFirst(Comparator.<Integer>naturalOrder()))
                    .thenComparingInt(Patient::historyLength);

    private String patientId;
    private String name;
    private Integer age;
    private String gender;
    private String medicalHistory;
    private Notifier notifier;

    protected Patient(PatientDetails details){
        if (details == null) throw new IllegalArgumentException("null patient details");
        this.patientId = details.patientId();
        this.name = details.name();
        this.age = details.age();
        this.gender = details.gender();
        this.medicalHistory = details.medicalHistory();
    }

    public abstract PatientType type();

    /** Current value of the field that distinguishes this variant. */
    public abstract String variantField();

    public abstract String renderHistory();

    public abstract String describe();

    public String getPatientId(){ return patientId; }
    public String getName(){ return name; }
    public Integer getAge(){ return age; }
    public String getGender(){ return gender; }
    public String getMedicalHistory(){ return medicalHistory; }

    public void setPatientId(String patientId){ this.patientId = patientId; }
    public void setName(String name){ this.name = name; }
    public void setMedicalHistory(String medicalHistory){ this.medicalHistory = medicalHistory; }

    public void setAge(int age){
        if (age > MIN_AGE_EXCLUSIVE && age < MAX_AGE_EXCLUSIVE) {
            this.age = age;
        } else {
            log.warn("Rejected age {} for patient {}, keeping {}", age, patientId, this.age);
        }
    }

    public void setGender(String gender){
        if (Gender.isRecognised(gender)) {
            this.gender = gender;
        } else {
            log.warn("Rejected gender '{}' for patient {}, keeping {}", gender, patientId, this.gender);
        }
    }

    public void setNotifier(Notifier notifier){ this.notifier = notifier; }

    public void requestAppointment(String date){
        if (notifier == null) return;
        try {
            notifier.send("Appointment request for " + date + " sent");
        } catch (RuntimeException e) {
            log.warn("Notification for patient {} failed: {}", patientId, e.getMessage());
        }
    }

    protected String historyText(){ return medicalHistory == null ? "" : medicalHistory; }

    int historyLength(){ return historyText().length(); }

    public boolean isYoungerThan(Patient other){ return compareTo(other) < 0; }
    public boolean isOlderThan(Patient other){ return compareTo(other) > 0; }

    @Override public int compareTo(Patient other){ return ORDER.compare(this, other); }

    @Override public boolean equals(Object o){
        if (this == o) return true;
        if (!(o instanceof Patient)) return false;
        Patient other = (Patient) o;
        return Objects.equals(age, other.age) && historyLength() == other.historyLength();
    }

    @Override public int hashCode(){ return Objects.hash(age, historyLength()); }

    @Override public String toString(){ return describe(); }
}
