package rmit.s4134401.clinic.scheduling;

import rmit.s4134401.clinic.Notifier;

public class OfflineAppointmentProcess extends AppointmentProcess {
    public OfflineAppointmentProcess(Notifier notifier){ super(notifier); }

    @Override protected void checkDoctorAvailability(){ notifier.send("Checking doctor availability at reception..."); }
    @Override protected void makeAppointment(){ notifier.send("Booking appointment at the front desk..."); }
    @Override protected void confirmAppointment(){ notifier.send("Confirming booking by phone call..."); }
}
