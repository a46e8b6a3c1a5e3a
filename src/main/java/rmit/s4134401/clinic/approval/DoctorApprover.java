package rmit.s4134401.clinic.approval;

public class DoctorApprover extends DiagnosisChangeHandler {
    public static final String MARKER = "minor change";

    public DoctorApprover(){}
    public DoctorApprover(DiagnosisChangeHandler successor){ super(successor); }

    @Override public Role role(){ return Role.DOCTOR; }
    @Override protected boolean approves(String newDiagnosis){ return mentions(newDiagnosis, MARKER); }
}
