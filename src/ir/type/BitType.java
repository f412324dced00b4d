package ir.type;

import exception.UnrollException;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public final class BitType extends Type {
    private static final Map<Integer, BitType> pool = new ConcurrentHashMap<>();

    private final int width;

    private BitType(int width) {
        super(TypeKind.BIT);
        this.width = width;
    }

    public static BitType get(int width) {
        if (width <= 0) {
            throw UnrollException.unSupported("bit width must be positive: " + width);
        }
        return pool.computeIfAbsent(width, BitType::new);
    }

    public int getWidth() {
        return width;
    }

    @Override
    public String getName() {
        return "bit<" + width + ">";
    }
}
