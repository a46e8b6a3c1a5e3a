package rmit.s4134401.clinic;

import rmit.s4134401.clinic.approval.ApprovalResult;
import rmit.s4134401.clinic.approval.DiagnosisChangeHandler;
import rmit.s4134401.clinic.repo.AuditRepository;
import rmit.s4134401.clinic.repo.RecordStore;
import rmit.s4134401.clinic.repo.file.JsonFileRecordStore;
import rmit.s4134401.clinic.repo.jdbc.JdbcAuditRepository;
import rmit.s4134401.clinic.repo.jdbc.JdbcRecordStore;
import rmit.s4134401.clinic.scheduling.OfflineAppointmentProcess;
import rmit.s4134401.clinic.scheduling.OnlineAppointmentProcess;
import rmit.s4134401.clinic.service.ClinicService;
import rmit.s4134401.clinic.util.ClinicConfig;
import rmit.s4134401.clinic.util.DB;
import rmit.s4134401.clinic.util.LoggingNotifier;
import rmit.s4134401.clinic.util.SchemaMigrator;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Scanner;

public class ClinicApp {

    private final ClinicService svc;
    private final AuditRepository auditRepo;
    private final Notifier notifier;
    private final DiagnosisChangeHandler chain = DiagnosisChangeHandler.standardChain();
    private final Map<String, Appointment> appointments = new HashMap<String, Appointment>();

    public ClinicApp(ClinicService svc, AuditRepository auditRepo, Notifier notifier){
        this.svc = svc; this.auditRepo = auditRepo; this.notifier = notifier;
    }

    public static void main(String[] args){
        start(new ClinicConfig(), new Scanner(System.in));
    }

    /** Opens the database, runs the menu on {@code sc} and always closes the pool. */
    static void start(ClinicConfig cfg, Scanner sc){
        try {
            DB.init(cfg);
            SchemaMigrator.ensure();
            AuditRepository auditRepo = new JdbcAuditRepository();
            RecordStore store = cfg.useJdbcStore() ? new JdbcRecordStore() : new JsonFileRecordStore(cfg.dataDir());
            Notifier notifier = new LoggingNotifier();
            ClinicService svc = new ClinicService(new Clinic(), store, auditRepo, notifier);
            new ClinicApp(svc, auditRepo, notifier).run(sc);
        } finally {
            DB.shutdown();
        }
    }

    void run(Scanner sc){
        System.out.println("Clinic records. Type number and ENTER.\n");
        boolean running = true;

        while(running){
            System.out.println("\n1) Register patient  2) Edit patient  3) Remove patient");
            System.out.println("4) List patients  5) Search by name  6) Patient history");
            System.out.println("7) Book appointment  8) Add service  9) Remove service");
            System.out.println("10) Confirm appointment  11) Cancel appointment  12) Appointment report");
            System.out.println("13) Change diagnosis  14) Save patient  15) Load patient");
            System.out.println("16) Save appointment  17) Load appointment  18) Compare patients");
            System.out.println("19) Schedule online/offline  20) Request appointment  21) Show audit");
            System.out.println("0) Exit");
            System.out.print("> ");
            String choice = sc.nextLine().trim();
            try{
                if ("1".equals(choice)) {
                    String tag = ask(sc, "Type (adultpatient/childpatient/seniorpatient): ");
                    String variantPrompt = variantPrompt(tag);
                    PatientDetails d = askDetails(sc);
                    String extra = ask(sc, variantPrompt);
                    Patient p = svc.registerPatient("reception", tag, d, extra);
                    System.out.println("Registered: " + p);
                }
                else if ("2".equals(choice)) {
                    Patient p = svc.clinic().findPatient(ask(sc, "Patient id: "));
                    String age = ask(sc, "New age (blank keeps): ");
                    if (!age.isEmpty()) p.setAge(Integer.parseInt(age));
                    String gender = ask(sc, "New gender M/F (blank keeps): ");
                    if (!gender.isEmpty()) p.setGender(gender.toUpperCase(Locale.ROOT));
                    String history = ask(sc, "New medical history (blank keeps): ");
                    if (!history.isEmpty()) p.setMedicalHistory(history);
                    System.out.println("Now: " + p);
                }
                else if ("3".equals(choice)) {
                    svc.dischargePatient("reception", ask(sc, "Patient id: "));
                    System.out.println("Removed.");
                }
                else if ("4".equals(choice)) {
                    printPatients(svc.clinic().getAllPatients());
                }
                else if ("5".equals(choice)) {
                    printPatients(svc.clinic().searchByName(ask(sc, "Name contains: ")));
                }
                else if ("6".equals(choice)) {
                    System.out.println(svc.clinic().findPatient(ask(sc, "Patient id: ")).renderHistory());
                }
                else if ("7".equals(choice)) {
                    String aid = ask(sc, "Appointment id: ");
                    String pid = ask(sc, "Patient id: ");
                    String doctor = ask(sc, "Doctor: ");
                    String date = ask(sc, "Date (blank = today): ");
                    if (date.isEmpty()) date = LocalDate.now().toString();
                    String diagnosis = ask(sc, "Diagnosis: ");
                    String rx = ask(sc, "Prescription: ");
                    DoctorInfo info = new DoctorInfo(doctor, ask(sc, "Specialty: "), ask(sc, "Contact: "));
                    appointments.put(aid, svc.bookAppointment(aid, pid, doctor, date, diagnosis, rx, info));
                    System.out.println("Booked " + aid);
                }
                else if ("8".equals(choice)) {
                    Appointment a = askAppointment(sc);
                    a.addService(new Service(ask(sc, "Service name: "), new BigDecimal(ask(sc, "Price: "))));
                    System.out.println("Total: " + a.calculateTotal().toPlainString());
                }
                else if ("9".equals(choice)) {
                    Appointment a = askAppointment(sc);
                    a.removeService(new Service(ask(sc, "Service name: "), new BigDecimal(ask(sc, "Price: "))));
                    System.out.println("Total: " + a.calculateTotal().toPlainString());
                }
                else if ("10".equals(choice)) {
                    askAppointment(sc).confirm();
                    System.out.println("Confirmed.");
                }
                else if ("11".equals(choice)) {
                    askAppointment(sc).cancel();
                    System.out.println("Cancelled.");
                }
                else if ("12".equals(choice)) {
                    System.out.println(askAppointment(sc).generateReport());
                }
                else if ("13".equals(choice)) {
                    Appointment a = askAppointment(sc);
                    String role = ask(sc, "Your role (Doctor/Department_head/Chief_physician): ");
                    String text = ask(sc, "New diagnosis: ");
                    ApprovalResult r = svc.changeDiagnosis(role, a, text, chain);
                    System.out.println("Result: " + r + ". Diagnosis now: " + a.getDiagnosis());
                }
                else if ("14".equals(choice)) {
                    Patient p = svc.clinic().findPatient(ask(sc, "Patient id: "));
                    svc.savePatient("reception", p);
                    System.out.println("Saved " + ClinicService.patientRecordName(p.getPatientId()));
                }
                else if ("15".equals(choice)) {
                    Patient p = svc.loadPatient("reception", ask(sc, "Patient id: "));
                    System.out.println("Loaded: " + p);
                    if ("y".equalsIgnoreCase(ask(sc, "Add to clinic? (y/n): "))) svc.clinic().addPatient(p);
                }
                else if ("16".equals(choice)) {
                    Appointment a = askAppointment(sc);
                    svc.saveAppointment("reception", a);
                    System.out.println("Saved " + ClinicService.appointmentRecordName(a.getAppointmentId()));
                }
                else if ("17".equals(choice)) {
                    Appointment a = svc.loadAppointment("reception", ask(sc, "Appointment id: "));
                    appointments.put(a.getAppointmentId(), a);
                    System.out.println(a.generateReport());
                }
                else if ("18".equals(choice)) {
                    Patient a = svc.clinic().findPatient(ask(sc, "First patient id: "));
                    Patient b = svc.clinic().findPatient(ask(sc, "Second patient id: "));
                    if (a.equals(b)) System.out.println("Patients are equal.");
                    else if (a.isYoungerThan(b)) System.out.println("First patient ranks below the second.");
                    else System.out.println("First patient ranks above the second.");
                }
                else if ("19".equals(choice)) {
                    boolean online = "o".equalsIgnoreCase(ask(sc, "Online or offline (o/f): "));
                    boolean ok = online ? new OnlineAppointmentProcess(notifier).scheduleAppointment()
                                        : new OfflineAppointmentProcess(notifier).scheduleAppointment();
                    System.out.println(ok ? "Scheduled." : "Scheduling failed.");
                }
                else if ("20".equals(choice)) {
                    Patient p = svc.clinic().findPatient(ask(sc, "Patient id: "));
                    p.requestAppointment(ask(sc, "Date: "));
                }
                else if ("21".equals(choice)) {
                    List<ActionLog> all = auditRepo.findAll();
                    System.out.println("--- Audit log ---");
                    if (all.isEmpty()) System.out.println("(none)");
                    for (int i = 0; i < all.size(); i++) System.out.println((i+1) + ") " + all.get(i));
                }
                else if ("0".equals(choice)) {
                    running = false;
                }
                else {
                    System.out.println("Unknown option");
                }
            } catch (RuntimeException ex){
                System.out.println("[ERROR] " + ex.getClass().getSimpleName() + ": " + ex.getMessage());
            }
        }
        System.out.println("Bye.");
    }

    private static String ask(Scanner sc, String prompt){
        System.out.print(prompt);
        return sc.nextLine().trim();
    }

    private static PatientDetails askDetails(Scanner sc){
        String id = ask(sc, "Patient id: ");
        String name = ask(sc, "Name: ");
        Integer age = Integer.valueOf(ask(sc, "Age: "));
        String gender = ask(sc, "Gender (M/F): ").toUpperCase(Locale.ROOT);
        String history = ask(sc, "Medical history: ");
        return new PatientDetails(id, name, age, gender, history);
    }

    private static String variantPrompt(String tag){
        switch (PatientType.fromTag(tag)) {
            case ADULT: return "Occupation: ";
            case CHILD: return "Guardian: ";
            default: return "Chronic conditions: ";
        }
    }

    private Appointment askAppointment(Scanner sc){
        String id = ask(sc, "Appointment id: ");
        Appointment a = appointments.get(id);
        if (a == null) throw new NotFoundException("Appointment not found: " + id);
        return a;
    }

    private static void printPatients(List<Patient> list){
        System.out.println("--- Patients ---");
        if (list.isEmpty()) { System.out.println("(none)"); return; }
        for (int i = 0; i < list.size(); i++) System.out.println((i+1) + ") " + list.get(i));
    }
}
