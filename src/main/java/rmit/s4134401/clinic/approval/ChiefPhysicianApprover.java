package rmit.s4134401.clinic.approval;

public class ChiefPhysicianApprover extends DiagnosisChangeHandler {
    @Override public Role role(){ return Role.CHIEF_PHYSICIAN; }
    @Override protected boolean approves(String newDiagnosis){ return true; }
}
