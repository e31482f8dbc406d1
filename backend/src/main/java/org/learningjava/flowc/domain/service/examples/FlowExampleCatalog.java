package org.learningjava.flowc.domain.service.examples;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.learningjava.flowc.domain.model.FlowExample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

// canned programs fed through the pipeline by the cycle driver
@Component
public class FlowExampleCatalog {
    private static final Logger log = LoggerFactory.getLogger(FlowExampleCatalog.class);

    public static final String DEFAULT_RESOURCE = "/flow-examples.yml";

    private final List<FlowExample> examples;

    public FlowExampleCatalog() {
        this(DEFAULT_RESOURCE);
    }

    public FlowExampleCatalog(String resource) {
        try (InputStream in = getClass().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Flow examples resource not found: " + resource);
            }
            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            Document doc = mapper.readValue(in, Document.class);
            List<FlowExample> loaded = new ArrayList<>();
            for (FlowExample ex : doc.examples) {
                if (ex.getSource() == null || ex.getSource().isBlank()) {
                    log.warn("Skipping example '{}' with empty source", ex.getName());
                    continue;
                }
                loaded.add(new FlowExample(ex.getName(), ex.getSource().strip()));
            }
            if (loaded.isEmpty()) {
                throw new IllegalStateException("No flow examples defined in " + resource);
            }
            this.examples = List.copyOf(loaded);
            log.info("Loaded {} flow examples from {}", examples.size(), resource);
        } catch (IllegalStateException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException("Failed to load flow examples from " + resource, e);
        }
    }

    public List<FlowExample> all() {
        return examples;
    }

    public int size() {
        return examples.size();
    }

    /** Example at {@code index} modulo the catalog size; negative indexes wrap too. */
    public FlowExample at(long index) {
        int i = (int) Math.floorMod(index, (long) examples.size());
        return examples.get(i);
    }

    static class Document {
        @JsonProperty("examples")
        List<FlowExample> examples = new ArrayList<>();
    }
}
