package org.learningjava.flowc.domain.service.translate;

import org.learningjava.flowc.domain.model.SourceLine;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One entry of the ordered dispatch table: a line pattern, an optional guard over the match,
 * and the emitter that writes the translation into the state.
 */
public record PatternRule(RuleKind kind, Pattern pattern, Guard guard, Emitter emitter) {

    @FunctionalInterface
    public interface Guard {
        boolean accepts(Matcher match, TranslationState state);
    }

    @FunctionalInterface
    public interface Emitter {
        void emit(Matcher match, SourceLine line, TranslationState state);
    }

    static PatternRule of(RuleKind kind, String regex, Emitter emitter) {
        return new PatternRule(kind, Pattern.compile(regex), (m, s) -> true, emitter);
    }

    static PatternRule guarded(RuleKind kind, String regex, Guard guard, Emitter emitter) {
        return new PatternRule(kind, Pattern.compile(regex), guard, emitter);
    }

    /** Returns the successful match, or {@code null} when this rule does not take the line. */
    Matcher match(String content, TranslationState state) {
        Matcher m = pattern.matcher(content);
        if (!m.matches()) return null;
        return guard.accepts(m, state) ? m : null;
    }
}
