package org.learningjava.flowc.domain.service.translate;

import org.learningjava.flowc.domain.model.FieldType;
import org.learningjava.flowc.domain.model.StructDefinition;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Mutable context of one translation pass. Created per call, never shared.
 * <p>
 * Block structure is tracked with an explicit stack of open blocks. A block is closed
 * when a later line is indented at or left of the block's opening line, or at end of input.
 */
public class TranslationState {

    enum Target { STRUCTS, DECLARATIONS, BODY }

    enum BlockKind { ENTRY, FUNCTION, STRUCT, CONDITIONAL, LOOP }

    record OpenBlock(BlockKind kind, int indent, Target target) {}

    private static final String PAD = "    ";

    private final IncludeSet includes = new IncludeSet();
    private final List<StructDefinition> structs = new ArrayList<>();
    private final List<String> declarations = new ArrayList<>();
    private final List<String> body = new ArrayList<>();
    private final Deque<OpenBlock> blocks = new ArrayDeque<>();
    private final Set<String> functions = new HashSet<>();

    // structs under construction, innermost first; a nested header gets its own draft
    private final Deque<StructDraft> drafts = new ArrayDeque<>();
    private int openFunctions;

    private record StructDraft(String name, List<StructDefinition.Field> fields) {}

    // ---------- queries ----------

    public boolean inFunction() {
        return openFunctions > 0;
    }

    /** True when the innermost open block is a struct, i.e. the line may be a field. */
    boolean directlyInStruct() {
        OpenBlock top = blocks.peek();
        return top != null && top.kind() == BlockKind.STRUCT;
    }

    boolean hasConditionalAt(int indent) {
        OpenBlock top = blocks.peek();
        return top != null && top.kind() == BlockKind.CONDITIONAL && top.indent() == indent;
    }

    boolean isDeclaredFunction(String name) {
        return functions.contains(name);
    }

    public IncludeSet includes() {
        return includes;
    }

    public List<StructDefinition> structs() {
        return Collections.unmodifiableList(structs);
    }

    public List<String> declarations() {
        return Collections.unmodifiableList(declarations);
    }

    public List<String> body() {
        return Collections.unmodifiableList(body);
    }

    // ---------- emission ----------

    void emit(String statement) {
        Target t = currentTarget();
        lines(t).add(pad(t) + statement);
    }

    void openFunction(String name, int indent, String header) {
        if (name != null) functions.add(name);
        declarations.add(pad(Target.DECLARATIONS) + header);
        blocks.push(new OpenBlock(BlockKind.FUNCTION, indent, Target.DECLARATIONS));
        openFunctions++;
    }

    void openEntry(int indent) {
        blocks.push(new OpenBlock(BlockKind.ENTRY, indent, Target.BODY));
    }

    void openBlock(BlockKind kind, int indent, String header) {
        Target t = currentTarget();
        lines(t).add(pad(t) + header);
        blocks.push(new OpenBlock(kind, indent, t));
    }

    void openStruct(String name, int indent) {
        drafts.push(new StructDraft(name, new ArrayList<>()));
        blocks.push(new OpenBlock(BlockKind.STRUCT, indent, Target.STRUCTS));
    }

    void addField(String name, FieldType type) {
        StructDraft draft = drafts.peek();
        if (draft == null) {
            throw new IllegalStateException("field '" + name + "' outside a struct");
        }
        if (type == FieldType.UNTYPED) includes.add("<any>");
        draft.fields().add(new StructDefinition.Field(name, type));
    }

    /** Re-opens the conditional at the same indentation with a branch line such as {@code } else {}. */
    void continueConditional(String branchLine) {
        OpenBlock cond = blocks.pop();
        lines(cond.target()).add(pad(cond.target()) + branchLine);
        blocks.push(cond);
    }

    /**
     * Closes every block opened at or right of {@code indent}. A branch continuation keeps the
     * conditional it continues open.
     */
    void closeBlocksFrom(int indent, boolean continuation) {
        while (!blocks.isEmpty() && blocks.peek().indent() >= indent) {
            OpenBlock top = blocks.peek();
            if (continuation && top.kind() == BlockKind.CONDITIONAL && top.indent() == indent) {
                return;
            }
            close(blocks.pop());
        }
    }

    void closeAll() {
        while (!blocks.isEmpty()) {
            close(blocks.pop());
        }
    }

    private void close(OpenBlock block) {
        switch (block.kind()) {
            case ENTRY -> { }
            case STRUCT -> {
                StructDraft draft = drafts.pop();
                structs.add(new StructDefinition(draft.name(), draft.fields()));
            }
            case FUNCTION -> {
                openFunctions--;
                declarations.add(pad(Target.DECLARATIONS) + "}");
                declarations.add("");
            }
            case CONDITIONAL, LOOP -> lines(block.target()).add(pad(block.target()) + "}");
        }
    }

    private Target currentTarget() {
        return inFunction() ? Target.DECLARATIONS : Target.BODY;
    }

    private List<String> lines(Target target) {
        return switch (target) {
            case DECLARATIONS -> declarations;
            case BODY -> body;
            case STRUCTS -> throw new IllegalStateException("struct lines are rendered from definitions");
        };
    }

    private String pad(Target target) {
        long open = blocks.stream()
                .filter(b -> b.target() == target)
                .filter(b -> b.kind() != BlockKind.ENTRY && b.kind() != BlockKind.STRUCT)
                .count();
        int level = (int) open + (target == Target.BODY ? 1 : 0);
        return PAD.repeat(level);
    }
}
