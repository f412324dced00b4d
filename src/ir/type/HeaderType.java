package ir.type;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public final class HeaderType extends Type {
    private static final Map<String, HeaderType> pool = new ConcurrentHashMap<>();

    private final String name;

    private HeaderType(String name) {
        super(TypeKind.HEADER);
        this.name = name;
    }

    public static HeaderType get(String name) {
        return pool.computeIfAbsent(name, HeaderType::new);
    }

    @Override
    public String getName() {
        return name;
    }
}
