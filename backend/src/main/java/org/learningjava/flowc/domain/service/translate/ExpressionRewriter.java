package org.learningjava.flowc.domain.service.translate;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Word-level substitution of Flow operators into C++ operators. This is not a tokenizer and
 * injects no grouping: mixed {@code and}/{@code or} keep C++ precedence. Double-quoted string
 * literals are copied through unchanged.
 */
@Component
public class ExpressionRewriter {

    private record Substitution(Pattern pattern, String replacement) {
        static Substitution of(String regex, String replacement) {
            return new Substitution(Pattern.compile(regex), Matcher.quoteReplacement(replacement));
        }

        String apply(String text) {
            return pattern.matcher(text).replaceAll(replacement);
        }
    }

    private static final List<Substitution> EXPRESSION = List.of(
            Substitution.of("\\byes\\b", "true"),
            Substitution.of("\\bno\\b", "false"),
            Substitution.of("\\band\\b", "&&"),
            Substitution.of("\\bor\\b", "||"),
            Substitution.of("\\bnot\\s+", "!"),
            Substitution.of("\\bmod\\b", "%"),
            Substitution.of("\\bis\\b", "==")
    );

    // "is not" must go before "is", otherwise it would become "== !"
    private static final List<Substitution> CONDITION = List.of(
            Substitution.of("\\bis\\s+not\\b", "!="),
            Substitution.of("\\byes\\b", "true"),
            Substitution.of("\\bno\\b", "false"),
            Substitution.of("\\band\\b", "&&"),
            Substitution.of("\\bor\\b", "||"),
            Substitution.of("\\bnot\\s+", "!"),
            Substitution.of("\\bmod\\b", "%"),
            Substitution.of("\\bis\\b", "==")
    );

    public String rewriteExpression(String expr) {
        return substitute(expr, EXPRESSION);
    }

    public String rewriteCondition(String cond) {
        return substitute(cond, CONDITION);
    }

    private static String substitute(String text, List<Substitution> subs) {
        if (text == null || text.isEmpty()) return "";
        StringBuilder out = new StringBuilder(text.length() + 8);
        int last = 0;
        int open = text.indexOf('"');
        while (open >= 0) {
            int close = literalEnd(text, open);
            if (close < 0) break;
            out.append(applyAll(text.substring(last, open), subs));
            out.append(text, open, close + 1);
            last = close + 1;
            open = text.indexOf('"', last);
        }
        out.append(applyAll(text.substring(last), subs));
        return out.toString().trim();
    }

    /** Index of the quote closing the literal opened at {@code open}, or -1 if it is unterminated. */
    static int literalEnd(String text, int open) {
        for (int i = open + 1; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\\') {
                i++;
            } else if (c == '"') {
                return i;
            }
        }
        return -1;
    }

    private static String applyAll(String chunk, List<Substitution> subs) {
        String s = chunk;
        for (Substitution sub : subs) {
            s = sub.apply(s);
        }
        return s;
    }
}
