package rmit.s4134401.clinic;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

public class Appointment implements Reportable {
    private static final Logger log = LoggerFactory.getLogger(Appointment.class);

    private String appointmentId;
    private Patient patient;
    private String doctor;
    private String date;
    private String diagnosis;
    private String prescription;
    private DoctorInfo doctorInfo;
    private final List<Service> services = new ArrayList<Service>();

    private final AuditTrail audit;
    private final Notifier notifier;

    public Appointment(String appointmentId, Patient patient, String doctor, String date,
                       String diagnosis, String prescription, DoctorInfo doctorInfo){
        this(appointmentId, patient, doctor, date, diagnosis, prescription, doctorInfo, null, null);
    }

    public Appointment(String appointmentId, Patient patient, String doctor, String date,
                       String diagnosis, String prescription, DoctorInfo doctorInfo,
                       AuditTrail audit, Notifier notifier){
        this.appointmentId = appointmentId;
        this.patient = patient;
        this.doctor = doctor;
        this.date = date;
        this.diagnosis = diagnosis;
        this.prescription = prescription;
        this.doctorInfo = doctorInfo;
        this.audit = audit;
        this.notifier = notifier;
    }

    public String getAppointmentId(){ return appointmentId; }
    public Patient getPatient(){ return patient; }
    public String getDoctor(){ return doctor; }
    public String getDate(){ return date; }
    public String getDiagnosis(){ return diagnosis; }
    public String getPrescription(){ return prescription; }
    public DoctorInfo getDoctorInfo(){ return doctorInfo; }
    public List<Service> getServices(){ return Collections.unmodifiableList(services); }

    public void setAppointmentId(String appointmentId){ this.appointmentId = appointmentId; }
    public void setPatient(Patient patient){ this.patient = patient; }
    public void setDoctor(String doctor){ this.doctor = doctor; }
    public void setDate(String date){ this.date = date; }
    public void setDiagnosis(String diagnosis){ this.diagnosis = diagnosis; }
    public void setPrescription(String prescription){ this.prescription = prescription; }
    public void setDoctorInfo(DoctorInfo doctorInfo){ this.doctorInfo = doctorInfo; }

    public void addService(Service service){
        if (service == null) throw new IllegalArgumentException("null service");
        services.add(service);
    }

    /** Removes the first equal service only. */
    public void removeService(Service service){
        if (!services.remove(service))
            throw new NotFoundException("Service not found on appointment " + appointmentId + ": " + service);
    }

    public BigDecimal calculateTotal(){
        BigDecimal total = BigDecimal.ZERO;
        for (Service s : services) total = total.add(s.price());
        return total;
    }

    public void updateDiagnosis(String newDiagnosis){
        this.diagnosis = newDiagnosis;
        record("Appointment " + appointmentId + " diagnosis updated: " + newDiagnosis);
    }

    public void confirm(){
        notify("Your appointment on " + date + " is confirmed.");
        record("Appointment " + appointmentId + " confirmed");
    }

    public void cancel(){
        notify("Appointment " + appointmentId + " cancelled.");
        record("Appointment " + appointmentId + " cancelled");
    }

    @Override public String generateReport(){
        String serviceNames = services.isEmpty() ? "No services"
                : services.stream().map(Service::name).collect(Collectors.joining(", "));
        return "Appointment report:\n"
                + "  Appointment ID: " + appointmentId + "\n"
                + "  Patient: " + patient + "\n"
                + "  Doctor: " + doctor + "\n"
                + "  Date: " + date + "\n"
                + "  Diagnosis: " + diagnosis + "\n"
                + "  Prescription: " + prescription + "\n"
                + "  Doctor info: " + doctorInfo + "\n"
                + "  Services: " + serviceNames + "\n"
                + "  Total cost: " + calculateTotal().toPlainString();
    }

    private void record(String event){
        if (audit == null) return;
        try {
            audit.record(event);
        } catch (RuntimeException e) {
            log.warn("Audit of '{}' failed: {}", event, e.getMessage());
        }
    }

    private void notify(String message){
        if (notifier == null) return;
        try {
            notifier.send(message);
        } catch (RuntimeException e) {
            log.warn("Notification '{}' failed: {}", message, e.getMessage());
        }
    }

    @Override public String toString(){
        return "Appointment " + appointmentId + " [" + date + ", " + doctor + ", " + diagnosis + "]";
    }
}
