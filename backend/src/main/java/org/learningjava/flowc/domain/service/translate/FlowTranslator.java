package org.learningjava.flowc.domain.service.translate;

import org.learningjava.flowc.domain.model.SourceLine;
import org.learningjava.flowc.domain.model.StructDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;

/**
 * Translates Flow source into C++17 source.
 * <p>
 * Single forward pass over the lines. Each line first closes the blocks its indentation ends,
 * then goes to the first matching rule of {@link FlowRules}. Lines no rule takes become
 * {@code // [flow] ...} comments, so translation never fails on bad input.
 * <p>
 * Assembly order: includes, banner, structs, functions, {@code main}. Everything a later part
 * refers to is declared before it.
 */
@Service
public class FlowTranslator {

    private static final Logger log = LoggerFactory.getLogger(FlowTranslator.class);

    static final String BANNER = "// generated by flowc (phi = 1.618033988749895)";

    private final BlockReconciler reconciler;
    private final List<PatternRule> rules;

    @Autowired
    public FlowTranslator(ExpressionRewriter rewriter, BlockReconciler reconciler) {
        this.reconciler = reconciler;
        this.rules = FlowRules.ordered(rewriter);
    }

    public FlowTranslator() {
        this(new ExpressionRewriter(), new BlockReconciler());
    }

    public String translate(String flowSource) {
        TranslationState state = new TranslationState();
        int handled = 0;

        for (String raw : lines(flowSource)) {
            SourceLine line = SourceLine.of(raw);
            if (line.isSkippable()) continue;

            state.closeBlocksFrom(line.indent(), FlowRules.isBranchContinuation(line.content()));
            RuleKind kind = dispatch(line, state);
            if (kind != RuleKind.FALLBACK) handled++;
        }
        state.closeAll();

        String cpp = assemble(state);
        if (log.isDebugEnabled()) {
            log.debug("Translated {} recognized line(s) into {} chars of C++", handled, cpp.length());
        }
        return cpp;
    }

    /**
     * Which rule takes {@code line} when it appears at top level of an empty program.
     */
    public RuleKind classify(String line) {
        SourceLine src = SourceLine.of(line);
        TranslationState scratch = new TranslationState();
        for (PatternRule rule : rules) {
            if (rule.match(src.content(), scratch) != null) {
                return rule.kind();
            }
        }
        return RuleKind.FALLBACK;
    }

    private RuleKind dispatch(SourceLine line, TranslationState state) {
        for (PatternRule rule : rules) {
            Matcher m = rule.match(line.content(), state);
            if (m != null) {
                rule.emitter().emit(m, line, state);
                return rule.kind();
            }
        }
        state.emit(FlowRules.fallback(line.content()));
        return RuleKind.FALLBACK;
    }

    private String assemble(TranslationState state) {
        List<String> out = new ArrayList<>(state.includes().directives());
        out.add("");
        out.add(BANNER);
        out.add("");

        for (StructDefinition struct : state.structs()) {
            out.addAll(reconciler.reconcile(struct.render()));
        }
        out.addAll(reconciler.reconcile(state.declarations()));

        out.add("int main() {");
        out.addAll(reconciler.reconcile(state.body()));
        out.add("    return 0;");
        out.add("}");

        return String.join("\n", out) + "\n";
    }

    private static List<String> lines(String source) {
        if (source == null || source.isEmpty()) return List.of();
        return List.of(source.split("\\R", -1));
    }
}
