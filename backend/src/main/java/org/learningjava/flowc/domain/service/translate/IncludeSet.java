package org.learningjava.flowc.domain.service.translate;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Header names pulled in by a translation, deduplicated and kept in first-insertion order.
 */
public class IncludeSet {

    static final List<String> BASE = List.of(
            "<iostream>", "<string>", "<vector>", "<cmath>", "<sstream>", "<algorithm>"
    );

    private final Set<String> headers = new LinkedHashSet<>(BASE);

    public void add(String header) {
        headers.add(header);
    }

    public List<String> directives() {
        return headers.stream().map(h -> "#include " + h).toList();
    }
}
