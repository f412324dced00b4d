package diag;

public enum Severity {
    INFO,
    WARNING,
    ERROR
}
