package rmit.s4134401.clinic;

public interface Notifier {
    void send(String message);
}
