package ir.type;

public enum TypeKind {
    BIT,
    HEADER,
    HEADER_STACK
}
