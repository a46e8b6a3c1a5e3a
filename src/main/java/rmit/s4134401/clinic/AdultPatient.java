package rmit.s4134401.clinic;

public class AdultPatient extends Patient {
    private String occupation;

    public AdultPatient(PatientDetails details, String occupation){
        super(details);
        this.occupation = occupation;
    }

    public String getOccupation(){ return occupation; }
    public void setOccupation(String occupation){ this.occupation = occupation; }

    @Override public PatientType type(){ return PatientType.ADULT; }
    @Override public String variantField(){ return occupation; }

    @Override public String renderHistory(){
        return "Adult patient [" + getName() + "], occupation: " + occupation + "\n" + historyText();
    }

    @Override public String describe(){
        return "Patient: " + getName() + ", occupation: " + occupation + ", age: " + getAge() + ", gender: " + getGender();
    }
}
