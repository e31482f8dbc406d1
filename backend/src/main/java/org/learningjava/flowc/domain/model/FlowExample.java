package org.learningjava.flowc.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public class FlowExample {

    @JsonProperty("name")
    private String name;

    @JsonProperty("source")
    private String source;

    public FlowExample() {
    }

    public FlowExample(String name, String source) {
        this.name = name;
        this.source = source;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getSource() {
        return source;
    }

    public void setSource(String source) {
        this.source = source;
    }
}
