package ir.type;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import exception.UnrollException;

/**
 * Fixed-capacity array of headers. Extracting into {@code stack.next} once all
 * {@code capacity} slots are filled is a parser error, which is what makes the
 * capacity an exact loop bound.
 */
public final class HeaderStackType extends Type {
    private final HeaderType elementType;
    private final int capacity;

    private static final Map<Key, HeaderStackType> pool =
        new ConcurrentHashMap<>();

    private record Key(HeaderType elementType, int capacity) {}

    private HeaderStackType(HeaderType elementType, int capacity) {
        super(TypeKind.HEADER_STACK);
        this.elementType = elementType;
        this.capacity = capacity;
    }

    public static HeaderStackType get(HeaderType elementType, int capacity) {
        if (capacity <= 0) {
            throw UnrollException.
                unSupported("Header stack capacity must be positive: " + capacity);
        }

        return pool.computeIfAbsent(
            new Key(elementType, capacity),
            k -> new HeaderStackType(k.elementType(), k.capacity())
        );
    }

    public HeaderType getElementType() {
        return elementType;
    }

    public int getCapacity() {
        return capacity;
    }

    @Override
    public String getName() {
        return elementType.getName() + "[" + capacity + "]";
    }
}
