package im.arun.rptsearch.classify;

import im.arun.rptsearch.model.FieldDef;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Cuts field values out of a classified line by column range.
 */
public class FieldExtractor {

    /**
     * Values keyed by field name, in column order. Columns past the end of the
     * line read as blanks, so short lines give empty values rather than errors.
     */
    public LinkedHashMap<String, String> extract(String line, List<FieldDef> fields) {
        List<FieldDef> ordered = new ArrayList<>(fields);
        ordered.sort(Comparator.comparingInt(FieldDef::getStartColumn).thenComparingInt(FieldDef::getFieldId));

        LinkedHashMap<String, String> values = new LinkedHashMap<>();
        for (FieldDef field : ordered) {
            values.put(field.getName().trim(), slice(line, field.getStartColumn(), field.getEndColumn()));
        }
        return values;
    }

    static String slice(String line, int startColumn, int endColumn) {
        int from = Math.max(0, startColumn - 1);
        int to = Math.min(line.length(), endColumn);
        if (from >= to) {
            return "";
        }
        return line.substring(from, to).strip();
    }
}
