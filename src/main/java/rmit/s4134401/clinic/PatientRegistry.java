package rmit.s4134401.clinic;

import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Process-wide table from a case-insensitive type tag to the constructor of that variant.
 * Filled once at class initialisation; later registrations publish a fresh read-only copy.
 */
public final class PatientRegistry {

    @FunctionalInterface
    public interface PatientConstructor {
        Patient create(PatientDetails details, String variantField);
    }

    private static volatile Map<String, PatientConstructor> table;

    static {
        Map<String, PatientConstructor> m = new HashMap<String, PatientConstructor>();
        m.put(PatientType.ADULT.tag(), AdultPatient::new);
        m.put(PatientType.CHILD.tag(), ChildPatient::new);
        m.put(PatientType.SENIOR.tag(), SeniorPatient::new);
        table = Collections.unmodifiableMap(m);
    }

    private PatientRegistry(){}

    public static PatientConstructor resolve(String tag){
        if (tag == null) throw new UnknownPatientTypeException(null);
        PatientConstructor c = table.get(tag.toLowerCase(Locale.ROOT));
        if (c == null) throw new UnknownPatientTypeException(tag);
        return c;
    }

    public static boolean isRegistered(String tag){
        return tag != null && table.containsKey(tag.toLowerCase(Locale.ROOT));
    }

    public static Set<String> tags(){ return table.keySet(); }

    public static synchronized void register(String tag, PatientConstructor constructor){
        if (tag == null || constructor == null) throw new IllegalArgumentException("null registration");
        String key = tag.toLowerCase(Locale.ROOT);
        if (table.containsKey(key)) throw new IllegalArgumentException("patient type already registered: " + tag);
        Map<String, PatientConstructor> next = new HashMap<String, PatientConstructor>(table);
        next.put(key, constructor);
        table = Collections.unmodifiableMap(next);
    }
}
