package rmit.s4134401.clinic;

public class DoctorInfo {
    private final String name;
    private final String specialty;
    private final String contactInfo;

    public DoctorInfo(String name, String specialty, String contactInfo){
        this.name = name; this.specialty = specialty; this.contactInfo = contactInfo;
    }

    public String name(){ return name; }
    public String specialty(){ return specialty; }
    public String contactInfo(){ return contactInfo; }

    @Override public String toString(){ return name + " (" + specialty + ", " + contactInfo + ")"; }
}
