package driver;

import exception.UnrollException;
import ir.ParserGraph;

import java.util.Locale;

/**
 * Options of one unroller run. Immutable; build with {@link #builder()} or read them
 * from system properties with {@link #fromSystemProperties()}.
 */
public final class UnrollOptions {
    private final ValidationMode mode;
    private final Integer defaultBound;
    private final OverflowPolicy overflowPolicy;
    private final String overflowState;
    private final boolean verifyOutput;

    private UnrollOptions(Builder b) {
        this.mode = b.mode;
        this.defaultBound = b.defaultBound;
        this.overflowPolicy = b.overflowPolicy;
        this.overflowState = b.overflowState;
        this.verifyOutput = b.verifyOutput;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static UnrollOptions defaults() {
        return builder().build();
    }

    /**
     * Options from system properties, defaults for absent ones.
     * eg: -Dunroll.mode=lenient -Dunroll.defaultBound=8 -Dunroll.overflow=residual
     *     -Dunroll.overflowState=reject -Dunroll.verify=false
     */
    public static UnrollOptions fromSystemProperties() {
        Builder b = builder();
        String mode = Config.getProperty("unroll.mode");
        if (mode != null) {
            b.mode(parseEnum(ValidationMode.class, "unroll.mode", mode));
        }
        Integer bound = Config.getInt("unroll.defaultBound");
        if (bound != null) {
            b.defaultBound(bound);
        }
        String overflow = Config.getProperty("unroll.overflow");
        if (overflow != null) {
            b.overflowPolicy(parseOverflow(overflow));
        }
        String state = Config.getProperty("unroll.overflowState");
        if (state != null) {
            b.overflowState(state);
        }
        b.verifyOutput(Config.getFlag("unroll.verify", true));
        return b.build();
    }

    private static OverflowPolicy parseOverflow(String raw) {
        // "error" is accepted as a short form
        if (raw.equalsIgnoreCase("error")) {
            return OverflowPolicy.ERROR_ON_OVERFLOW;
        }
        return parseEnum(OverflowPolicy.class, "unroll.overflow", raw);
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String property, String raw) {
        String constant = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        try {
            return Enum.valueOf(type, constant);
        } catch (IllegalArgumentException e) {
            throw UnrollException.invalidOption(property + " = " + raw);
        }
    }

    public ValidationMode getMode() {
        return mode;
    }

    public boolean isStrict() {
        return mode == ValidationMode.STRICT;
    }

    /** null when not configured */
    public Integer getDefaultBound() {
        return defaultBound;
    }

    public OverflowPolicy getOverflowPolicy() {
        return overflowPolicy;
    }

    public String getOverflowState() {
        return overflowState;
    }

    public boolean isVerifyOutput() {
        return verifyOutput;
    }

    @Override
    public String toString() {
        return "UnrollOptions{mode=" + mode + ", defaultBound=" + defaultBound + ", overflowPolicy="
                + overflowPolicy + ", overflowState=" + overflowState + ", verifyOutput=" + verifyOutput + "}";
    }

    public static final class Builder {
        private ValidationMode mode = ValidationMode.STRICT;
        private Integer defaultBound = null;
        private OverflowPolicy overflowPolicy = OverflowPolicy.ERROR_ON_OVERFLOW;
        private String overflowState = ParserGraph.REJECT;
        private boolean verifyOutput = true;

        private Builder() {
        }

        public Builder mode(ValidationMode mode) {
            this.mode = mode;
            return this;
        }

        /**
         * @param bound positive number of copies for loops no header stack bounds, null to unset
         */
        public Builder defaultBound(Integer bound) {
            if (bound != null && bound <= 0) {
                throw UnrollException.invalidOption("defaultBound must be positive, got " + bound);
            }
            this.defaultBound = bound;
            return this;
        }

        public Builder overflowPolicy(OverflowPolicy policy) {
            this.overflowPolicy = policy;
            return this;
        }

        /**
         * State the last copy's back edges go to under {@link OverflowPolicy#ERROR_ON_OVERFLOW}.
         * An existing state of that name is used as is; otherwise a terminal state is created.
         */
        public Builder overflowState(String state) {
            if (state == null || state.isBlank()) {
                throw UnrollException.invalidOption("overflowState must be a state name");
            }
            if (state.equals(ParserGraph.ACCEPT)) {
                throw UnrollException.invalidOption("overflowState cannot be accept");
            }
            this.overflowState = state;
            return this;
        }

        public Builder verifyOutput(boolean verify) {
            this.verifyOutput = verify;
            return this;
        }

        public UnrollOptions build() {
            if (mode == null || overflowPolicy == null) {
                throw UnrollException.invalidOption("mode and overflowPolicy are required");
            }
            return new UnrollOptions(this);
        }
    }
}
