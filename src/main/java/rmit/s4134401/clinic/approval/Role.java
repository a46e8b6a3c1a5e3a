package rmit.s4134401.clinic.approval;

import java.util.Optional;

/** Roles allowed to request a diagnosis change; also names the level that approved one. */
public enum Role {
    DOCTOR("Doctor", "Doctor"),
    DEPARTMENT_HEAD("Department_head", "Department head"),
    CHIEF_PHYSICIAN("Chief_physician", "Chief physician");

    private final String code;
    private final String title;

    Role(String code, String title){ this.code = code; this.title = title; }

    public String code(){ return code; }
    public String title(){ return title; }

    /** Exact, case-sensitive match on {@link #code()}. */
    public static Optional<Role> fromCode(String code){
        for (Role r : values()) if (r.code.equals(code)) return Optional.of(r);
        return Optional.empty();
    }
}
