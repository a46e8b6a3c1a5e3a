package rmit.s4134401.clinic;

public enum ActionType {
    PATIENT_ADD, PATIENT_REMOVE,
    DIAGNOSIS_CHANGE, DIAGNOSIS_REJECTED, PERMISSION_DENIED,
    RECORD_SAVE, RECORD_LOAD,
    EVENT
}
