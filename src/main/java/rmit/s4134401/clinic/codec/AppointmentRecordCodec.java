package rmit.s4134401.clinic.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import rmit.s4134401.clinic.Appointment;
import rmit.s4134401.clinic.AuditTrail;
import rmit.s4134401.clinic.DoctorInfo;
import rmit.s4134401.clinic.Notifier;
import rmit.s4134401.clinic.Patient;
import rmit.s4134401.clinic.Service;

import java.math.BigDecimal;

import static rmit.s4134401.clinic.codec.RecordKeys.*;

public final class AppointmentRecordCodec {
    private AppointmentRecordCodec(){}

    public static ObjectNode toRecord(Appointment a){
        if (a == null) throw new IllegalArgumentException("null appointment");
        if (a.getPatient() == null) throw new IllegalArgumentException("appointment " + a.getAppointmentId() + " has no patient");
        ObjectNode r = JsonRecords.newRecord();
        r.put(APPOINTMENT_ID, a.getAppointmentId());
        r.set(PATIENT, PatientRecordCodec.toRecord(a.getPatient()));
        r.put(DOCTOR, a.getDoctor());
        r.put(DATE, a.getDate());
        r.put(DIAGNOSIS, a.getDiagnosis());
        r.put(PRESCRIPTION, a.getPrescription());

        DoctorInfo info = a.getDoctorInfo();
        if (info == null) {
            r.putNull(DOCTOR_INFO);
        } else {
            ObjectNode d = r.putObject(DOCTOR_INFO);
            d.put(NAME, info.name());
            d.put(SPECIALTY, info.specialty());
            d.put(CONTACT_INFO, info.contactInfo());
        }

        ArrayNode services = r.putArray(SERVICES);
        for (Service s : a.getServices()) {
            ObjectNode sn = services.addObject();
            sn.put(NAME, s.name());
            sn.put(PRICE, s.price());
        }
        return r;
    }

    public static Appointment fromRecord(JsonNode record){ return fromRecord(record, null, null); }

    /** Restores the patient, then the doctor info, then replays the services in stored order. */
    public static Appointment fromRecord(JsonNode record, AuditTrail audit, Notifier notifier){
        if (record == null || !record.isObject()) throw new IllegalArgumentException("appointment record must be an object");
        JsonNode patientNode = record.get(PATIENT);
        if (patientNode == null || patientNode.isNull())
            throw new IllegalArgumentException("appointment record has no patient");
        Patient patient = PatientRecordCodec.fromRecord(patientNode);

        DoctorInfo info = null;
        JsonNode d = record.get(DOCTOR_INFO);
        if (d != null && d.isObject()) {
            info = new DoctorInfo(JsonRecords.text(d, NAME), JsonRecords.text(d, SPECIALTY), JsonRecords.text(d, CONTACT_INFO));
        }

        Appointment a = new Appointment(
                JsonRecords.text(record, APPOINTMENT_ID),
                patient,
                JsonRecords.text(record, DOCTOR),
                JsonRecords.text(record, DATE),
                JsonRecords.text(record, DIAGNOSIS),
                JsonRecords.text(record, PRESCRIPTION),
                info, audit, notifier);

        JsonNode services = record.get(SERVICES);
        if (services != null && services.isArray()) {
            for (JsonNode sn : services) a.addService(new Service(JsonRecords.text(sn, NAME), price(sn)));
        }
        return a;
    }

    private static BigDecimal price(JsonNode service){
        JsonNode p = service.get(PRICE);
        if (p == null || p.isNull()) throw new IllegalArgumentException("service without price: " + service);
        if (p.isNumber()) return p.decimalValue();
        try {
            return new BigDecimal(p.asText().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("service price is not a number: " + p.asText(), e);
        }
    }
}
