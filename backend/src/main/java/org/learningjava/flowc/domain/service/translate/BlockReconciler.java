package org.learningjava.flowc.domain.service.translate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Balances {@code { }} in emitted C++ lines. Braces inside string/char literals and
 * {@code //} comments are not counted.
 * <p>
 * A line that would take the running depth below zero is turned into a comment. Missing
 * closes are appended at the end. This balances the skeleton; it does not move a close to the
 * semantically right line.
 */
@Component
public class BlockReconciler {

    private static final Logger log = LoggerFactory.getLogger(BlockReconciler.class);

    static final String UNMATCHED_PREFIX = "// [flow] unmatched: ";
    static final String APPENDED_CLOSE = "    }";

    public List<String> reconcile(List<String> lines) {
        List<String> out = new ArrayList<>(lines.size() + 2);
        int depth = 0;

        for (String line : lines) {
            BraceCount c = count(line);
            if (depth + c.lowest() < 0) {
                String indent = line.substring(0, line.length() - line.stripLeading().length());
                out.add(indent + UNMATCHED_PREFIX + line.strip());
                log.debug("Neutralized unmatched close at depth {}: {}", depth, line.strip());
                continue;
            }
            depth += c.net();
            out.add(line);
        }

        if (depth > 0) {
            log.debug("Appending {} missing close(s)", depth);
        }
        while (depth > 0) {
            out.add(APPENDED_CLOSE);
            depth--;
        }

        int check = netDepth(out);
        if (check != 0) {
            throw new ReconciliationException(check);
        }
        return out;
    }

    /** Net open-minus-close depth of the given lines. */
    public static int netDepth(List<String> lines) {
        int depth = 0;
        for (String line : lines) {
            depth += count(line).net();
        }
        return depth;
    }

    /**
     * @param net    opens minus closes on the line
     * @param lowest lowest running value reached while scanning the line (0 or negative)
     */
    record BraceCount(int net, int lowest) {}

    static BraceCount count(String line) {
        int net = 0;
        int lowest = 0;
        char quote = 0;
        for (int i = 0; i < line.length(); i++) {
            char ch = line.charAt(i);
            if (quote != 0) {
                if (ch == '\\') {
                    i++;
                } else if (ch == quote) {
                    quote = 0;
                }
                continue;
            }
            if (ch == '"' || ch == '\'') {
                quote = ch;
            } else if (ch == '/' && i + 1 < line.length() && line.charAt(i + 1) == '/') {
                break;
            } else if (ch == '{') {
                net++;
            } else if (ch == '}') {
                net--;
                lowest = Math.min(lowest, net);
            }
        }
        return new BraceCount(net, lowest);
    }
}
