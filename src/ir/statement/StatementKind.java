package ir.statement;

public enum StatementKind {
    ASSIGNMENT,
    PLAIN_CALL,
    PACKET_CONSUMING_CALL
}
