package rmit.s4134401.clinic;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

public class Clinic {
    private static final Logger log = LoggerFactory.getLogger(Clinic.class);

    private final List<Patient> patients = new ArrayList<Patient>();

    public void addPatient(Patient p){
        if (p == null) {
            log.error("Rejected patient: not a patient entity");
            throw new InvalidPatientException("not a patient entity");
        }
        if (indexOf(p.getPatientId()) >= 0) {
            log.error("Rejected patient: id {} already in clinic", p.getPatientId());
            throw new InvalidPatientException("patient id exists: " + p.getPatientId());
        }
        patients.add(p);
        log.info("Patient {} added to clinic", p.getName());
    }

    public Patient removePatient(String patientId){
        int i = indexOf(patientId);
        if (i < 0) {
            log.error("Patient {} not found", patientId);
            throw new NotFoundException("Patient not found: " + patientId);
        }
        Patient removed = patients.remove(i);
        log.info("Patient with id {} removed from clinic", patientId);
        return removed;
    }

    public Patient findPatient(String patientId){
        int i = indexOf(patientId);
        if (i < 0) throw new NotFoundException("Patient not found: " + patientId);
        return patients.get(i);
    }

    public List<Patient> getAllPatients(){ return Collections.unmodifiableList(patients); }

    public List<Patient> searchByName(String text){
        List<Patient> out = new ArrayList<Patient>();
        if (text == null) return out;
        String needle = text.toLowerCase(Locale.ROOT);
        for (Patient p : patients) {
            if (p.getName() != null && p.getName().toLowerCase(Locale.ROOT).contains(needle)) out.add(p);
        }
        return out;
    }

    public int size(){ return patients.size(); }

    private int indexOf(String patientId){
        for (int i=0; i<patients.size(); i++){
            String id = patients.get(i).getPatientId();
            if (id != null && id.equals(patientId)) return i;
        }
        return -1;
    }
}
