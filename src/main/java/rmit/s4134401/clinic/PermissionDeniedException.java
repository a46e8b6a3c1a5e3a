package rmit.s4134401.clinic;

public class PermissionDeniedException extends ClinicException {
    private final String role;

    public PermissionDeniedException(String role, String message){
        super(message);
        this.role = role;
    }

    public String getRole(){ return role; }
}
