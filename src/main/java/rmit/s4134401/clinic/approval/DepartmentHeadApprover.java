package rmit.s4134401.clinic.approval;

public class DepartmentHeadApprover extends DiagnosisChangeHandler {
    public static final String MARKER = "treatment revision";

    public DepartmentHeadApprover(){}
    public DepartmentHeadApprover(DiagnosisChangeHandler successor){ super(successor); }

    @Override public Role role(){ return Role.DEPARTMENT_HEAD; }
    @Override protected boolean approves(String newDiagnosis){ return mentions(newDiagnosis, MARKER); }
}
