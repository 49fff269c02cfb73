package com.dataflow.graphcom.util;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Data;

/**
 * POJO view of a context for diagnostics: labelled values plus lineage
 * metadata. Input labels are listed but carry no value.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public final class ContextSnapshot {
    private long epoch;
    private int nodeCount;
    private List<String> inputs;
    private Map<String, Object> values;
    private List<List<String>> compiledInputSets;
}
