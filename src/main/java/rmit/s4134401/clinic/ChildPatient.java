package rmit.s4134401.clinic;

public class ChildPatient extends Patient {
    private String guardian;

    public ChildPatient(PatientDetails details, String guardian){
        super(details);
        this.guardian = guardian;
    }

    public String getGuardian(){ return guardian; }
    public void setGuardian(String guardian){ this.guardian = guardian; }

    @Override public PatientType type(){ return PatientType.CHILD; }
    @Override public String variantField(){ return guardian; }

    @Override public String renderHistory(){
        return "Child [" + getName() + "], guardian: " + guardian + "\n" + historyText();
    }

    @Override public String describe(){
        return "Patient: " + getName() + ", guardian: " + guardian + ", age: " + getAge();
    }
}
