package rmit.s4134401.clinic;

public interface Reportable {
    String generateReport();
}
