package ir.type;

/**
 * Type of a value written by a parser statement, as far as the front end reports it.
 */
public abstract class Type {
    private final TypeKind kind;

    protected Type(TypeKind kind) {
        this.kind = kind;
    }

    public TypeKind getKind() {
        return this.kind;
    }

    /** source-level spelling of the type */
    public abstract String getName();

    /* classification helpers */
    public boolean is(TypeKind k) { return kind == k; }
    public boolean isBit() { return is(TypeKind.BIT); }
    public boolean isHeader() { return is(TypeKind.HEADER); }
    public boolean isHeaderStack() { return is(TypeKind.HEADER_STACK); }

    @Override public String toString() { return getName(); }
}
