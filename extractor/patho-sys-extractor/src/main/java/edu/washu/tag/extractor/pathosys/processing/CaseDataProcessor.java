package edu.washu.tag.extractor.pathosys.processing;

import static edu.washu.tag.extractor.pathosys.util.Constants.SLIDE_PATH;
import static edu.washu.tag.extractor.pathosys.util.Constants.THUMBNAIL_PATH;

import edu.washu.tag.extractor.pathosys.model.CaseTable;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Cleans a joined case table: drops unusable rows, transforms paths, then applies any extra filters.
 */
@Component
public class CaseDataProcessor {

    private final RecordFilter recordFilter;
    private final PathTransformer pathTransformer;
    private final List<ExtraRecordFilter> extraFilters;

    @Autowired
    public CaseDataProcessor(RecordFilter recordFilter, PathTransformer pathTransformer, ObjectProvider<ExtraRecordFilter> extraFilters) {
        this(recordFilter, pathTransformer, extraFilters.orderedStream().toList());
    }

    public CaseDataProcessor(RecordFilter recordFilter, PathTransformer pathTransformer, List<ExtraRecordFilter> extraFilters) {
        this.recordFilter = recordFilter;
        this.pathTransformer = pathTransformer;
        this.extraFilters = List.copyOf(extraFilters);
    }

    /**
     * Processes a joined table.
     *
     * @param table      Joined table
     * @param pathRule   Path transform rule
     * @param ignoreSdpc Drop every SDPC slide
     * @return Processed table. It always has a {@code thumbnail_path} column.
     */
    public CaseTable process(CaseTable table, String pathRule, boolean ignoreSdpc) {
        CaseTable processed = transformPaths(recordFilter.filter(table, ignoreSdpc), pathRule);
        for (ExtraRecordFilter extraFilter : extraFilters) {
            processed = extraFilter.apply(processed);
        }
        return processed;
    }

    /**
     * Transforms slide paths, and thumbnail paths where present. A blank thumbnail path becomes an empty string.
     *
     * @param table    Table with no missing slide paths
     * @param pathRule Path transform rule
     * @return Table with transformed paths
     */
    CaseTable transformPaths(CaseTable table, String pathRule) {
        List<String> columns = new ArrayList<>(table.columns());
        if (!columns.contains(THUMBNAIL_PATH)) {
            columns.add(THUMBNAIL_PATH);
        }
        return table.mapRows(columns, row -> {
            row.put(SLIDE_PATH, pathTransformer.transform(row.get(SLIDE_PATH), pathRule));
            String thumbnailPath = row.get(THUMBNAIL_PATH);
            row.put(THUMBNAIL_PATH, StringUtils.isBlank(thumbnailPath) ? "" : pathTransformer.transform(thumbnailPath, pathRule));
            return row;
        });
    }
}
