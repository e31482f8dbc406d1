package org.learningjava.flowc.domain.model;

import java.util.Locale;

public enum FieldType {
    TEXT("std::string"),
    NUMBER("int"),
    DECIMAL("double"),
    BOOLEAN("bool"),
    UNTYPED("std::any");     // needs <any>

    private final String cppType;

    FieldType(String cppType) {
        this.cppType = cppType;
    }

    public String cppType() {
        return cppType;
    }

    public static FieldType fromWord(String word) {
        if (word == null) return UNTYPED;
        return switch (word.toLowerCase(Locale.ROOT)) {
            case "text" -> TEXT;
            case "number" -> NUMBER;
            case "decimal" -> DECIMAL;
            case "boolean" -> BOOLEAN;
            default -> UNTYPED;
        };
    }
}
