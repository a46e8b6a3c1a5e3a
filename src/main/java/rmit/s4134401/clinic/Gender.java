package rmit.s4134401.clinic;

public enum Gender {
    M, F;

    public static boolean isRecognised(String code){
        if (code == null) return false;
        for (Gender g : values()) if (g.name().equals(code)) return true;
        return false;
    }
}
