package rmit.s4134401.clinic.service;

import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;
import rmit.s4134401.clinic.*;
import rmit.s4134401.clinic.approval.ApprovalResult;
import rmit.s4134401.clinic.approval.DiagnosisChangeHandler;
import rmit.s4134401.clinic.approval.Role;
import rmit.s4134401.clinic.repo.AuditRepository;
import rmit.s4134401.clinic.repo.RecordStore;
import rmit.s4134401.clinic.repo.file.JsonFileRecordStore;
import rmit.s4134401.clinic.repo.jdbc.JdbcAuditRepository;
import rmit.s4134401.clinic.util.DB;
import rmit.s4134401.clinic.util.SchemaMigrator;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@TestInstance(TestInstance.Lifecycle.PER_METHOD)
class ClinicServiceAllTests {

    @TempDir Path tmp;

    ClinicService svc;
    AuditRepository auditRepo;
    Notifier notifier;

    @BeforeEach
    void setup() {
        DB.shutdown();
        DB.init(tmp.resolve("clinic_" + System.nanoTime() + ".db").toString());
        SchemaMigrator.ensure();

        auditRepo = new JdbcAuditRepository();
        notifier = mock(Notifier.class);
        svc = new ClinicService(new Clinic(), new JsonFileRecordStore(tmp.resolve("records")), auditRepo, notifier);

        svc.registerPatient("reception", "adultpatient",
                new PatientDetails("A123", "Ivan Petrov", 35, "M", "Pollen allergy"), "Programmer");
        svc.registerPatient("reception", "CHILDPATIENT",
                new PatientDetails("C456", "Masha Sidorova", 8, "F", "Cold"), "Anna Sidorova");
    }

    @AfterEach
    void tearDown() { DB.shutdown(); }

    private ActionLog last() {
        List<ActionLog> all = auditRepo.findAll();
        return all.get(all.size() - 1);
    }

    @Test
    void testRegisterAndDischarge() {
        assertEquals(2, svc.clinic().size());
        assertEquals(ActionType.PATIENT_ADD, auditRepo.findAll().get(0).type);

        svc.dischargePatient("reception", "C456");
        assertEquals(1, svc.clinic().size());
        assertEquals(ActionType.PATIENT_REMOVE, last().type);
        assertThrows(NotFoundException.class, () -> svc.dischargePatient("reception", "C456"));
    }

    @Test
    void testRegisterUnknownTypeAddsNothing() {
        assertThrows(UnknownPatientTypeException.class, () -> svc.registerPatient("reception", "unknown",
                new PatientDetails("U1", "Nobody", 30, "M", ""), ""));
        assertEquals(2, svc.clinic().size());
    }

    @Test
    void testRegisteredPatientUsesNotifier() {
        svc.clinic().findPatient("A123").requestAppointment("2023-10-15");
        verify(notifier).send("Appointment request for 2023-10-15 sent");
    }

    @Test
    void testBookConfirmCancelAudited() {
        Appointment a = svc.bookAppointment("AP1", "A123", "Dr Ivanov", "2024-03-01", "Flu", "Paracetamol",
                new DoctorInfo("Dr Ivanov", "Therapist", "ivanov@example.com"));
        assertEquals("Appointment AP1 created", last().details);
        assertEquals("system", last().actor);
        assertEquals(ActionType.EVENT, last().type);

        a.confirm();
        assertEquals("Appointment AP1 confirmed", last().details);
        a.cancel();
        assertEquals("Appointment AP1 cancelled", last().details);
        verify(notifier).send("Your appointment on 2024-03-01 is confirmed.");
        verify(notifier).send("Appointment AP1 cancelled.");
    }

    @Test
    void testBookWithoutDoctorStillAudited() {
        int before = auditRepo.findAll().size();
        svc.bookAppointment("AP5", "A123", null, "2024-03-05", "Flu", "Rest", null);
        assertEquals(before + 1, auditRepo.findAll().size());
        assertEquals("Appointment AP5 created", last().details);
        assertEquals("system", last().actor);
    }

    @Test
    void testBookForUnknownPatient() {
        assertThrows(NotFoundException.class,
                () -> svc.bookAppointment("AP9", "ZZZ", "Dr X", "2024-01-01", "", "", null));
    }

    @Test
    void testChangeDiagnosisThroughChain() {
        Appointment a = svc.bookAppointment("AP2", "C456", "Dr Petrova", "2024-03-02", "Cold", "Tea", null);
        ApprovalResult r = svc.changeDiagnosis("Doctor", a, "Treatment revision: flu", DiagnosisChangeHandler.standardChain());
        assertEquals(Role.DEPARTMENT_HEAD, r.approvedBy().orElseThrow());
        assertEquals("Treatment revision: flu", a.getDiagnosis());
        assertEquals(ActionType.DIAGNOSIS_CHANGE, last().type);
    }

    @Test
    void testChangeDiagnosisDeniedIsAudited() {
        Appointment a = svc.bookAppointment("AP3", "C456", "Dr Petrova", "2024-03-02", "Cold", "Tea", null);
        assertThrows(PermissionDeniedException.class,
                () -> svc.changeDiagnosis("Nurse", a, "minor change", DiagnosisChangeHandler.standardChain()));
        assertEquals("Cold", a.getDiagnosis());
        assertEquals(ActionType.PERMISSION_DENIED, last().type);
        assertEquals("Nurse", last().actor);
    }

    @Test
    void testSaveAndLoadPatient() {
        Patient p = svc.clinic().findPatient("C456");
        svc.savePatient("reception", p);
        assertEquals(ActionType.RECORD_SAVE, last().type);

        Patient back = svc.loadPatient("reception", "C456");
        assertTrue(back instanceof ChildPatient);
        assertEquals("Anna Sidorova", back.variantField());
        assertEquals(p, back);
        assertEquals(ActionType.RECORD_LOAD, last().type);
    }

    @Test
    void testLoadMissingPatient() {
        assertThrows(NotFoundException.class, () -> svc.loadPatient("reception", "none"));
    }

    @Test
    void testSaveAndLoadAppointment() {
        Appointment a = svc.bookAppointment("AP4", "A123", "Dr Ivanov", "2024-03-01", "Flu", "Paracetamol",
                new DoctorInfo("Dr Ivanov", "Therapist", "ivanov@example.com"));
        a.addService(new Service("Consultation", 1500));
        a.addService(new Service("Blood test", new BigDecimal("450.50")));
        svc.saveAppointment("reception", a);
        int before = auditRepo.findAll().size();

        Appointment back = svc.loadAppointment("reception", "AP4");
        assertEquals(a.getServices(), back.getServices());
        assertEquals(0, a.calculateTotal().compareTo(back.calculateTotal()));
        assertEquals("Ivan Petrov", back.getPatient().getName());
        // only the RECORD_LOAD entry, no second "created"
        assertEquals(before + 1, auditRepo.findAll().size());

        back.confirm();
        assertEquals("Appointment AP4 confirmed", last().details);
    }

    @Test
    void testAuditFailureDoesNotUndoOperation() {
        AuditRepository broken = mock(AuditRepository.class);
        doThrow(new RuntimeException("db gone")).when(broken).log(any(), any(), any(), any());
        ClinicService s = new ClinicService(new Clinic(), mock(RecordStore.class), broken, notifier);

        assertDoesNotThrow(() -> s.registerPatient("reception", "seniorpatient",
                new PatientDetails("S789", "Petr Ivanov", 70, "M", "Hypertension"), "Diabetes"));
        assertEquals(1, s.clinic().size());
    }

    @Test
    void testRecordNames() {
        assertEquals("patient-A123.json", ClinicService.patientRecordName("A123"));
        assertEquals("appointment-AP1.json", ClinicService.appointmentRecordName("AP1"));
    }
}
