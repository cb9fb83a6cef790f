package se.kth.hayroll.tag;

/** Whether a seed marks a macro expansion or a preprocessor conditional branch. */
public enum SeedType {
    INVOCATION("invocation"),
    CONDITIONAL("conditional"),
    OTHER("");

    private final String wireName;

    SeedType(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    public static SeedType fromWireName(String name) {
        for (SeedType type : values()) {
            if (type != OTHER && type.wireName.equals(name)) {
                return type;
            }
        }
        return OTHER;
    }
}
