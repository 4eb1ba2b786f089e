package edu.washu.tag.extractor.pathosys.util;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import java.io.IOException;

/**
 * Pretty printer for table records: two-space indentation, {@code "key": value} pairs
 * and {@code []} for an empty array.
 */
public class RecordsPrettyPrinter extends DefaultPrettyPrinter {

    private static final DefaultIndenter INDENTER = new DefaultIndenter("  ", "\n");

    public RecordsPrettyPrinter() {
        indentArraysWith(INDENTER);
        indentObjectsWith(INDENTER);
        _objectFieldValueSeparatorWithSpaces = ": ";
    }

    private RecordsPrettyPrinter(RecordsPrettyPrinter base) {
        super(base);
    }

    @Override
    public DefaultPrettyPrinter createInstance() {
        return new RecordsPrettyPrinter(this);
    }

    @Override
    public void writeEndArray(JsonGenerator g, int nrOfValues) throws IOException {
        if (nrOfValues > 0) {
            super.writeEndArray(g, nrOfValues);
            return;
        }
        if (!_arrayIndenter.isInline()) {
            --_nesting;
        }
        g.writeRaw(']');
    }
}
