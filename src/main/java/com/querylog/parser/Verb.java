package com.querylog.parser;

/**
 * Statement categories that get their own counter. Matching is by prefix of the
 * normalized statement, in declaration order.
 */
public enum Verb {
    SELECT("select", "SELECT"),
    UPDATE("update", "UPDATE"),
    INSERT("insert", "INSERT"),
    ALTER("alter", "ALTER"),
    DELETE("delete", "DELETE"),
    DROP("drop", "DROP"),
    CALL("call", "CALL"),
    OTHER("other", null);

    private final String type;
    private final String prefix;

    Verb(String type, String prefix) {
        this.type = type;
        this.prefix = prefix;
    }

    public String getType() {
        return type;
    }

    public static Verb classify(String normalizedSql) {
        for (Verb verb : values()) {
            if (verb.prefix != null && normalizedSql.startsWith(verb.prefix)) {
                return verb;
            }
        }
        return OTHER;
    }
}
