package org.learningjava.flowc.domain.service.translate;

import org.learningjava.flowc.domain.model.FieldType;
import org.learningjava.flowc.domain.service.translate.TranslationState.BlockKind;

import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import static org.learningjava.flowc.domain.service.translate.PatternRule.guarded;
import static org.learningjava.flowc.domain.service.translate.PatternRule.of;

/**
 * The ordered Flow line rules. Order is significant: the first rule that takes a line wins.
 */
final class FlowRules {

    // block keywords a generic "x is ..." binding must not swallow
    private static final Set<String> BLOCK_WORDS = Set.of("if", "for", "while", "a");

    // right-hand sides owned by the builtin rules further down the table
    private static final Set<String> BUILTIN_VERBS = Set.of("read", "ask", "sqrt", "abs", "pow", "random");

    private static final Set<String> RESERVED = Set.of(
            "is", "becomes", "has", "can", "as", "in", "to", "if", "for", "while", "repeat",
            "say", "print", "write", "return", "otherwise", "skip", "stop", "pause",
            "test", "assert", "try", "catch", "throw", "log"
    );

    private static final Set<String> CONTROL_WORDS = Set.of("skip", "stop", "return", "otherwise");

    private static final Pattern LIST_LITERAL = Pattern.compile("^\\[(.*)\\]$");

    private static final Pattern LEADING_CALL = Pattern.compile("^(\\w+)\\s+(.+)$");

    private FlowRules() {
    }

    static List<PatternRule> ordered(ExpressionRewriter rw) {
        return List.of(
                // ── functions ──
                of(RuleKind.ENTRY_HEADER, "^to\\s+start\\s*:$",
                        (m, line, s) -> s.openEntry(line.indent())),
                of(RuleKind.FUNCTION_HEADER, "^to\\s+(\\w+)\\s*(.*):\\s*$",
                        (m, line, s) -> s.openFunction(m.group(1), line.indent(),
                                "auto " + m.group(1) + "(" + parameters(m.group(2)) + ") {")),

                // ── structs ──
                of(RuleKind.STRUCT_HEADER, "^a\\s+(\\w+)\\s+has\\s*:\\s*$",
                        (m, line, s) -> s.openStruct(m.group(1), line.indent())),
                guarded(RuleKind.STRUCT_FIELD, "^(\\w+)\\s+as\\s+(\\w+)$",
                        (m, s) -> s.directlyInStruct(),
                        (m, line, s) -> s.addField(m.group(1), FieldType.fromWord(m.group(2)))),
                of(RuleKind.STRUCT_METHOD, "^a\\s+(\\w+)\\s+can\\s+(\\w+)\\s*(.*):\\s*$",
                        (m, line, s) -> {
                            String params = parameters(m.group(3));
                            String self = m.group(1) + "& self";
                            s.openFunction(null, line.indent(), "void " + m.group(1) + "_" + m.group(2)
                                    + "(" + (params.isEmpty() ? self : self + ", " + params) + ") {");
                        }),

                // ── output ──
                of(RuleKind.SAY_TEXT, "^say\\s+\"([^\"]*)\"$",
                        (m, line, s) -> s.emit("std::cout << \"" + m.group(1) + "\" << std::endl;")),
                of(RuleKind.SAY_TEXT, "^say\\s+'([^']*)'$",
                        (m, line, s) -> s.emit("std::cout << \"" + quoted(m.group(1)) + "\" << std::endl;")),
                of(RuleKind.SAY_EXPRESSION, "^say\\s+(.+)$",
                        (m, line, s) -> s.emit("std::cout << " + expression(rw, s, m.group(1)) + " << std::endl;")),
                of(RuleKind.PRINT_TEXT, "^print\\s+\"([^\"]*)\"$",
                        (m, line, s) -> s.emit("std::cout << \"" + m.group(1) + "\";")),
                of(RuleKind.PRINT_EXPRESSION, "^print\\s+(.+)$",
                        (m, line, s) -> s.emit("std::cout << " + expression(rw, s, m.group(1)) + ";")),

                // ── bindings ──
                of(RuleKind.TEXT_BINDING, "^(\\w+)\\s+is\\s+\"([^\"]*)\"$",
                        (m, line, s) -> s.emit("const std::string " + m.group(1) + " = \"" + m.group(2) + "\";")),
                of(RuleKind.TEXT_BINDING, "^(\\w+)\\s+is\\s+'([^']*)'$",
                        (m, line, s) -> s.emit("const std::string " + m.group(1) + " = \"" + quoted(m.group(2)) + "\";")),
                of(RuleKind.DECIMAL_BINDING, "^(\\w+)\\s+is\\s+(-?\\d+\\.\\d+)$",
                        (m, line, s) -> s.emit("const double " + m.group(1) + " = " + m.group(2) + ";")),
                of(RuleKind.INTEGER_BINDING, "^(\\w+)\\s+is\\s+(-?\\d+)$",
                        (m, line, s) -> s.emit("const int " + m.group(1) + " = " + m.group(2) + ";")),
                of(RuleKind.BOOLEAN_BINDING, "^(\\w+)\\s+is\\s+(yes|no)$",
                        (m, line, s) -> s.emit("const bool " + m.group(1) + " = "
                                + ("yes".equals(m.group(2)) ? "true" : "false") + ";")),
                of(RuleKind.LIST_BINDING, "^(\\w+)\\s+is\\s+\\[(.*)\\]$",
                        (m, line, s) -> s.emit("const auto " + m.group(1) + " = std::vector<int>{" + m.group(2).trim() + "};")),
                of(RuleKind.MUTABLE_BINDING, "^(\\w+)\\s+is\\s+(.+?),\\s*can\\s+change$",
                        (m, line, s) -> s.emit("auto " + m.group(1) + " = " + mutableValue(rw, s, m.group(2)) + ";")),
                guarded(RuleKind.GENERIC_BINDING, "^(\\w+)\\s+is\\s+(.+)$",
                        (m, s) -> !BLOCK_WORDS.contains(m.group(1)) && !BUILTIN_VERBS.contains(firstWord(m.group(2))),
                        (m, line, s) -> s.emit("const auto " + m.group(1) + " = " + expression(rw, s, m.group(2)) + ";")),

                of(RuleKind.REASSIGNMENT, "^(\\w+)\\s+becomes\\s+(.+)$",
                        (m, line, s) -> s.emit(m.group(1) + " = " + expression(rw, s, m.group(2)) + ";")),

                of(RuleKind.RETURN_VALUE, "^return\\s+(.+)$",
                        (m, line, s) -> s.emit("return " + expression(rw, s, m.group(1)) + ";")),
                of(RuleKind.RETURN, "^return$",
                        (m, line, s) -> s.emit("return;")),

                // ── branches ──
                of(RuleKind.IF, "^if\\s+(.+):\\s*$",
                        (m, line, s) -> s.openBlock(BlockKind.CONDITIONAL, line.indent(),
                                "if (" + rw.rewriteCondition(m.group(1)) + ") {")),
                of(RuleKind.ELSE_IF, "^otherwise\\s+if\\s+(.+):\\s*$",
                        (m, line, s) -> branch(s, line.indent(), line.content(),
                                "} else if (" + rw.rewriteCondition(m.group(1)) + ") {")),
                of(RuleKind.ELSE, "^otherwise\\s*:$",
                        (m, line, s) -> branch(s, line.indent(), line.content(), "} else {")),

                // ── loops ──
                of(RuleKind.FOR_RANGE, "^for\\s+each\\s+(\\w+)\\s+in\\s+(-?\\w+)\\s+to\\s+(-?\\w+)\\s*:\\s*$",
                        (m, line, s) -> s.openBlock(BlockKind.LOOP, line.indent(),
                                "for (int " + m.group(1) + " = " + m.group(2) + "; " + m.group(1) + " <= " + m.group(3)
                                        + "; " + m.group(1) + "++) {")),
                of(RuleKind.FOR_EACH, "^for\\s+each\\s+(\\w+)\\s+in\\s+(\\w+)\\s*:\\s*$",
                        (m, line, s) -> s.openBlock(BlockKind.LOOP, line.indent(),
                                "for (const auto& " + m.group(1) + " : " + m.group(2) + ") {")),
                of(RuleKind.REPEAT, "^repeat\\s+(\\w+)\\s+times\\s*:\\s*$",
                        (m, line, s) -> s.openBlock(BlockKind.LOOP, line.indent(),
                                "for (int _i = 0; _i < " + m.group(1) + "; _i++) {")),
                of(RuleKind.WHILE, "^while\\s+(.+):\\s*$",
                        (m, line, s) -> s.openBlock(BlockKind.LOOP, line.indent(),
                                "while (" + rw.rewriteCondition(m.group(1)) + ") {")),
                of(RuleKind.SKIP, "^skip$", (m, line, s) -> s.emit("continue;")),
                of(RuleKind.STOP, "^stop$", (m, line, s) -> s.emit("break;")),

                // ── builtins ──
                of(RuleKind.PAUSE, "^pause\\s+(\\d+)$",
                        (m, line, s) -> {
                            s.includes().add("<thread>");
                            s.includes().add("<chrono>");
                            s.emit("std::this_thread::sleep_for(std::chrono::milliseconds(" + m.group(1) + "));");
                        }),
                of(RuleKind.WRITE_FILE, "^write\\s+\"(.+)\"\\s+to\\s+\"(.+)\"$",
                        (m, line, s) -> {
                            s.includes().add("<fstream>");
                            s.emit("{ std::ofstream _out(\"" + m.group(2) + "\"); _out << \"" + m.group(1) + "\"; }");
                        }),
                of(RuleKind.READ_FILE, "^(\\w+)\\s+is\\s+read\\s+\"(.+)\"$",
                        (m, line, s) -> {
                            s.includes().add("<fstream>");
                            String v = m.group(1);
                            s.emit("std::string " + v + "; { std::ifstream _in(\"" + m.group(2)
                                    + "\"); std::ostringstream _buf; _buf << _in.rdbuf(); " + v + " = _buf.str(); }");
                        }),
                of(RuleKind.ASK, "^(\\w+)\\s+is\\s+ask\\s+\"(.+)\"$",
                        (m, line, s) -> s.emit("std::string " + m.group(1) + "; std::cout << \"" + m.group(2)
                                + "\"; std::getline(std::cin, " + m.group(1) + ");")),
                of(RuleKind.SQRT, "^(\\w+)\\s+is\\s+sqrt\\s+(.+)$",
                        (m, line, s) -> mathCall(s, m.group(1), "std::sqrt(" + rw.rewriteExpression(m.group(2)) + ")")),
                of(RuleKind.ABS, "^(\\w+)\\s+is\\s+abs\\s+(.+)$",
                        (m, line, s) -> mathCall(s, m.group(1), "std::abs(" + rw.rewriteExpression(m.group(2)) + ")")),
                of(RuleKind.POW, "^(\\w+)\\s+is\\s+pow\\s+(\\S+)\\s+(\\S+)$",
                        (m, line, s) -> mathCall(s, m.group(1), "std::pow(" + rw.rewriteExpression(m.group(2))
                                + ", " + rw.rewriteExpression(m.group(3)) + ")")),
                of(RuleKind.RANDOM, "^(\\w+)\\s+is\\s+random\\s+(-?\\d+)\\s+(-?\\d+)$",
                        (m, line, s) -> {
                            s.includes().add("<random>");
                            String v = m.group(1);
                            s.emit("int " + v + "; { std::random_device rd; std::mt19937 gen(rd()); "
                                    + "std::uniform_int_distribution<> dis(" + m.group(2) + ", " + m.group(3) + "); "
                                    + v + " = dis(gen); }");
                        }),

                // ── calls ──
                guarded(RuleKind.CALL, "^(\\w+)\\s+(.+)$",
                        (m, s) -> !RESERVED.contains(m.group(1)),
                        (m, line, s) -> s.emit(m.group(1) + "(" + arguments(m.group(2)) + ");")),
                guarded(RuleKind.BARE_CALL, "^(\\w+)$",
                        (m, s) -> !CONTROL_WORDS.contains(m.group(1)),
                        (m, line, s) -> s.emit(m.group(1) + "();"))
        );
    }

    static boolean isBranchContinuation(String content) {
        return content.startsWith("otherwise") && content.endsWith(":");
    }

    static String fallback(String content) {
        return "// [flow] " + content;
    }

    /** Rewrites an expression, turning a leading declared function name into a call. */
    static String expression(ExpressionRewriter rw, TranslationState s, String raw) {
        String text = raw.trim();
        Matcher call = LEADING_CALL.matcher(text);
        if (call.matches() && s.isDeclaredFunction(call.group(1))) {
            text = call.group(1) + "(" + arguments(call.group(2)) + ")";
        }
        return rw.rewriteExpression(text);
    }

    private static String mutableValue(ExpressionRewriter rw, TranslationState s, String raw) {
        Matcher list = LIST_LITERAL.matcher(raw.trim());
        return list.matches() ? "std::vector<int>{" + list.group(1).trim() + "}" : expression(rw, s, raw);
    }

    private static void branch(TranslationState s, int indent, String content, String branchLine) {
        if (s.hasConditionalAt(indent)) {
            s.continueConditional(branchLine);
        } else {
            s.emit(fallback(content));
        }
    }

    private static void mathCall(TranslationState s, String name, String call) {
        s.includes().add("<cmath>");
        s.emit("const auto " + name + " = " + call + ";");
    }

    private static String parameters(String raw) {
        String args = arguments(raw);
        if (args.isEmpty()) return "";
        return Arrays.stream(args.split(",\\s*"))
                .map(String::trim)
                .filter(a -> !a.isEmpty())
                .map(a -> "auto " + a)
                .collect(Collectors.joining(", "));
    }

    private static String arguments(String raw) {
        if (raw == null) return "";
        return raw.trim().replaceAll("\\s+and\\s+", ", ");
    }

    private static String quoted(String singleQuoted) {
        return singleQuoted.replace("\"", "\\\"");
    }

    private static String firstWord(String text) {
        String t = text.trim();
        int sp = t.indexOf(' ');
        return sp < 0 ? t : t.substring(0, sp);
    }
}
