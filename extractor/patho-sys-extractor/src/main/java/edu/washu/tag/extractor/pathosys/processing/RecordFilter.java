package edu.washu.tag.extractor.pathosys.processing;

import static edu.washu.tag.extractor.pathosys.util.Constants.SDPC_EXTENSION;
import static edu.washu.tag.extractor.pathosys.util.Constants.SLIDE_PATH;
import static edu.washu.tag.extractor.pathosys.util.Constants.THUMBNAIL_PATH;

import edu.washu.tag.extractor.pathosys.model.CaseTable;
import java.util.Map;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

/**
 * Drops joined rows that cannot be published.
 */
@Component
public class RecordFilter {

    /**
     * Applies {@link #dropMissingSlides(CaseTable)} then {@link #applySdpcRule(CaseTable, boolean)}.
     *
     * @param table      Joined table
     * @param ignoreSdpc Drop every SDPC slide
     * @return Filtered table
     */
    public CaseTable filter(CaseTable table, boolean ignoreSdpc) {
        return applySdpcRule(dropMissingSlides(table), ignoreSdpc);
    }

    /**
     * Drops rows with no slide path.
     *
     * @param table Table to filter
     * @return Rows with a non-empty slide path
     */
    public CaseTable dropMissingSlides(CaseTable table) {
        return table.filter(row -> StringUtils.isNotEmpty(row.get(SLIDE_PATH)));
    }

    /**
     * Drops SDPC slides: all of them if {@code ignoreSdpc} is set, otherwise those without a thumbnail.
     * A whitespace-only thumbnail path counts as no thumbnail.
     *
     * @param table      Table to filter, with no missing slide paths
     * @param ignoreSdpc Drop every SDPC slide
     * @return Filtered table
     */
    public CaseTable applySdpcRule(CaseTable table, boolean ignoreSdpc) {
        if (ignoreSdpc) {
            return table.filter(row -> !isSdpc(row));
        }
        return table.filter(row -> !isSdpc(row) || StringUtils.isNotBlank(row.get(THUMBNAIL_PATH)));
    }

    private static boolean isSdpc(Map<String, String> row) {
        return StringUtils.endsWith(row.get(SLIDE_PATH), SDPC_EXTENSION);
    }
}
