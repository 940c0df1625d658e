package com.parametric.formula.io;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Data;

/**
 * POJO representation of a parameter set document.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ParameterSetDefinition {
    private SetInfo parameterSet;

    /** The set itself: name, dialect, store rules and parameters. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class SetInfo {
        private String name;
        private DialectDef dialect;
        private List<String> forbiddenDataTypes;
        private List<ParameterDef> parameters;
    }

    /**
     * Host formula dialect. With {@code extendDefaults} (the default) the listed
     * functions and boundary characters are added to the default ones;
     * otherwise they replace them. Default boundaries are kept when none are
     * listed.
     */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class DialectDef {
        private List<String> reservedFunctions;
        private String boundaryChars;
        private boolean extendDefaults = true;
    }

    /** Definition of a single parameter. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class ParameterDef {
        private long id;
        private String name, dataType, formula;
        private boolean instance, builtIn;
    }
}
