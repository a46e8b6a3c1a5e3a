package rmit.s4134401.clinic.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import rmit.s4134401.clinic.Notifier;

public class LoggingNotifier implements Notifier {
    private static final Logger notify = LoggerFactory.getLogger("clinic.notify");

    @Override public void send(String message){ notify.info("Notification: {}", message); }
}
