package rmit.s4134401.clinic;

public class SeniorPatient extends Patient {
    private String chronicConditions;

    public SeniorPatient(PatientDetails details, String chronicConditions){
        super(details);
        this.chronicConditions = chronicConditions;
    }

    public String getChronicConditions(){ return chronicConditions; }
    public void setChronicConditions(String chronicConditions){ this.chronicConditions = chronicConditions; }

    @Override public PatientType type(){ return PatientType.SENIOR; }
    @Override public String variantField(){ return chronicConditions; }

    @Override public String renderHistory(){
        return "Senior patient [" + getName() + "], chronic conditions: " + chronicConditions + "\n" + historyText();
    }

    @Override public String describe(){
        return "Patient: " + getName() + ", chronic conditions: " + chronicConditions + ", age: " + getAge();
    }
}
