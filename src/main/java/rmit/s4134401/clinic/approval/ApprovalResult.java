package rmit.s4134401.clinic.approval;

import java.util.Optional;

public final class ApprovalResult {
    private static final ApprovalResult NOT_APPROVED = new ApprovalResult(null);

    private final Role approvedBy;

    private ApprovalResult(Role approvedBy){ this.approvedBy = approvedBy; }

    public static ApprovalResult approvedBy(Role role){
        if (role == null) throw new IllegalArgumentException("null role");
        return new ApprovalResult(role);
    }

    public static ApprovalResult notApproved(){ return NOT_APPROVED; }

    public boolean isApproved(){ return approvedBy != null; }
    public Optional<Role> approvedBy(){ return Optional.ofNullable(approvedBy); }

    @Override public String toString(){
        return approvedBy == null ? "not approved" : "approved by " + approvedBy.title();
    }
}
