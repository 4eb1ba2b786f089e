package edu.washu.tag.extractor.pathosys.processing;

import edu.washu.tag.extractor.pathosys.model.CaseTable;

/**
 * Site specific filtering applied after paths are transformed.
 * Every bean implementing this interface is applied, in {@link org.springframework.core.annotation.Order} order.
 * None are registered by default.
 */
@FunctionalInterface
public interface ExtraRecordFilter {

    /**
     * Filters a processed table.
     *
     * @param table Table with transformed paths
     * @return Filtered table
     */
    CaseTable apply(CaseTable table);
}
