package org.learningjava.flowc.domain.model;

import java.util.ArrayList;
import java.util.List;

public record StructDefinition(String name, List<Field> fields) {

    public record Field(String name, FieldType type) {}

    public StructDefinition {
        fields = fields == null ? List.of() : List.copyOf(fields);
    }

    /** C++ lines for this struct, closing delimiter and trailing blank line included. */
    public List<String> render() {
        List<String> lines = new ArrayList<>(fields.size() + 3);
        lines.add("struct " + name + " {");
        for (Field f : fields) {
            lines.add("    " + f.type().cppType() + " " + f.name() + ";");
        }
        lines.add("};");
        lines.add("");
        return lines;
    }
}
