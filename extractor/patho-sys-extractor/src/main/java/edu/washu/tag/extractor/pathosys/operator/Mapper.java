package edu.washu.tag.extractor.pathosys.operator;

import java.util.Map;

/**
 * Contract of an operator that maps one sample descriptor to another.
 * A host registry configures the operator once, then calls {@link #execute(Map)} for every sample.
 */
public interface Mapper {

    /**
     * Sets the operator options. Options that are not given fall back to the application defaults.
     *
     * @param options Operator options
     */
    void configure(Map<String, Object> options);

    /**
     * Processes a sample.
     *
     * @param sample Sample descriptor. May be updated in place.
     * @return The processed sample descriptor
     */
    Map<String, Object> execute(Map<String, Object> sample);
}
