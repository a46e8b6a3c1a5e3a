package rmit.s4134401.clinic.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import rmit.s4134401.clinic.*;
import rmit.s4134401.clinic.approval.ApprovalResult;
import rmit.s4134401.clinic.approval.DiagnosisChangeGate;
import rmit.s4134401.clinic.approval.DiagnosisChangeHandler;
import rmit.s4134401.clinic.codec.AppointmentRecordCodec;
import rmit.s4134401.clinic.codec.PatientRecordCodec;
import rmit.s4134401.clinic.repo.AuditRepository;
import rmit.s4134401.clinic.repo.RecordStore;
import rmit.s4134401.clinic.util.Slf4jAuditTrail;

import java.time.Instant;

public class ClinicService {
	private static final Logger log = LoggerFactory.getLogger(ClinicService.class);

	private final Clinic clinic;
	private final RecordStore store;
	private final AuditRepository auditRepo;
	private final Notifier notifier;
	private final AuditTrail auditLog = new Slf4jAuditTrail();
	// appointment events land in the same repository as the service's own entries
	private final AuditTrail appointmentTrail = event -> audit("system", ActionType.EVENT, event);

	public ClinicService(Clinic clinic, RecordStore store, AuditRepository auditRepo, Notifier notifier) {
		if (clinic == null || store == null || auditRepo == null) throw new IllegalArgumentException("null collaborator");
		this.clinic = clinic;
		this.store = store;
		this.auditRepo = auditRepo;
		this.notifier = notifier;
	}

	public Clinic clinic() { return clinic; }

	public Patient registerPatient(String actor, String tag, PatientDetails details, String variantField) {
		Patient p = PatientFactory.createPatient(tag, details, variantField);
		clinic.addPatient(p);
		p.setNotifier(notifier);
		audit(actor, ActionType.PATIENT_ADD, "added " + p.type().tag() + " " + p.getPatientId() + " " + p.getName());
		return p;
	}

	public void dischargePatient(String actor, String patientId) {
		Patient p = clinic.removePatient(patientId);
		audit(actor, ActionType.PATIENT_REMOVE, "removed " + patientId + " " + p.getName());
	}

	public Appointment bookAppointment(String appointmentId, String patientId, String doctor, String date,
			String diagnosis, String prescription, DoctorInfo doctorInfo) {
		Patient p = clinic.findPatient(patientId);
		Appointment a = new Appointment(appointmentId, p, doctor, date, diagnosis, prescription, doctorInfo, appointmentTrail, notifier);
		appointmentTrail.record("Appointment " + appointmentId + " created");
		return a;
	}

	public ApprovalResult changeDiagnosis(String requesterRole, Appointment appointment, String newDiagnosis,
			DiagnosisChangeHandler chain) {
		ApprovalResult result;
		try {
			result = DiagnosisChangeGate.changeDiagnosis(requesterRole, appointment, newDiagnosis, chain);
		} catch (PermissionDeniedException e) {
			audit(String.valueOf(requesterRole), ActionType.PERMISSION_DENIED,
					"diagnosis change on " + (appointment == null ? null : appointment.getAppointmentId()) + " refused");
			throw e;
		}
		if (result.isApproved()) {
			audit(requesterRole, ActionType.DIAGNOSIS_CHANGE,
					appointment.getAppointmentId() + " -> '" + newDiagnosis + "' " + result);
		} else {
			audit(requesterRole, ActionType.DIAGNOSIS_REJECTED,
					appointment.getAppointmentId() + " -> '" + newDiagnosis + "'");
		}
		return result;
	}

	public void savePatient(String actor, Patient p) {
		String name = patientRecordName(p.getPatientId());
		store.write(PatientRecordCodec.toRecord(p), name);
		audit(actor, ActionType.RECORD_SAVE, name);
	}

	public Patient loadPatient(String actor, String patientId) {
		String name = patientRecordName(patientId);
		Patient p = PatientRecordCodec.fromRecord(store.read(name));
		p.setNotifier(notifier);
		audit(actor, ActionType.RECORD_LOAD, name);
		return p;
	}

	public void saveAppointment(String actor, Appointment a) {
		String name = appointmentRecordName(a.getAppointmentId());
		store.write(AppointmentRecordCodec.toRecord(a), name);
		audit(actor, ActionType.RECORD_SAVE, name);
	}

	public Appointment loadAppointment(String actor, String appointmentId) {
		String name = appointmentRecordName(appointmentId);
		Appointment a = AppointmentRecordCodec.fromRecord(store.read(name), appointmentTrail, notifier);
		audit(actor, ActionType.RECORD_LOAD, name);
		return a;
	}

	public static String patientRecordName(String patientId) { return "patient-" + patientId + ".json"; }
	public static String appointmentRecordName(String appointmentId) { return "appointment-" + appointmentId + ".json"; }

	private void audit(String actor, ActionType type, String details) {
		try {
			auditRepo.log(Instant.now(), actor, type, details);
		} catch (RuntimeException e) {
			log.warn("Audit {} by {} not stored: {}", type, actor, e.getMessage());
		}
		auditLog.record(type + " by " + actor + ": " + details);
	}
}
