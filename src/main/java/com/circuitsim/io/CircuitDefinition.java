package com.circuitsim.io;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Data;

/**
 * POJO representation of a circuit file.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class CircuitDefinition {
    private CircuitInfo circuit;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class CircuitInfo {
        private String name, description;
        private List<ComponentDef> components;
        /** Each entry is a net: two or more pin references joined together. */
        private List<List<String>> connections;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class ComponentDef {
        private String name, type;
        private Map<String, Object> properties;
    }
}
