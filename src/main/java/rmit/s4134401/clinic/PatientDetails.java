package rmit.s4134401.clinic;

/**
 * Fields shared by every patient variant. Age and gender may be null when a record omits them;
 * they are not range-checked here.
 */
public final class PatientDetails {
    private final String patientId;
    private final String name;
    private final Integer age;
    private final String gender;
    private final String medicalHistory;

    public PatientDetails(String patientId, String name, Integer age, String gender, String medicalHistory){
        this.patientId = patientId;
        this.name = name;
        this.age = age;
        this.gender = gender;
        this.medicalHistory = medicalHistory;
    }

    public String patientId(){ return patientId; }
    public String name(){ return name; }
    public Integer age(){ return age; }
    public String gender(){ return gender; }
    public String medicalHistory(){ return medicalHistory; }

    @Override public String toString(){
        return patientId + " " + name + " (" + age + ", " + gender + ")";
    }
}
