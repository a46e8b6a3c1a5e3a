package rmit.s4134401.clinic.scheduling;

import rmit.s4134401.clinic.Notifier;

public class OnlineAppointmentProcess extends AppointmentProcess {
    public OnlineAppointmentProcess(Notifier notifier){ super(notifier); }

    @Override protected void checkDoctorAvailability(){ notifier.send("Checking doctor availability online..."); }
    @Override protected void makeAppointment(){ notifier.send("Booking appointment through the online system..."); }
    @Override protected void confirmAppointment(){ notifier.send("Confirming booking by SMS or email..."); }
}
