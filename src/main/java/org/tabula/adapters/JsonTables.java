package org.tabula.adapters;

import com.fasterxml.jackson.databind.JsonNode;
import org.tabula.model.Table;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Turns a parsed JSON document into a single {@link Table}.
 */
final class JsonTables {

    static final String VALUE_COLUMN = "value";

    private JsonTables() {
    }

    /**
     * An array of objects becomes one row per object, with columns taken from the first object's keys in order.
     * Keys missing from a later object read as null; keys the first object lacks are dropped.
     * Anything else becomes a single {@code value} cell holding the document text.
     */
    static Table toTable(String name, JsonNode root, String fileType, Map<String, Object> metadata, Logger logger) {
        if (isArrayOfObjects(root)) {
            List<String> columns = new ArrayList<>();
            root.get(0).fieldNames().forEachRemaining(columns::add);

            Set<String> dropped = new LinkedHashSet<>();
            List<List<Object>> records = new ArrayList<>(root.size());
            for (JsonNode element : root) {
                List<Object> row = new ArrayList<>(columns.size());
                for (String column : columns) {
                    row.add(scalar(element.get(column)));
                }
                records.add(row);
                Iterator<String> names = element.fieldNames();
                while (names.hasNext()) {
                    String fieldName = names.next();
                    if (!columns.contains(fieldName)) dropped.add(fieldName);
                }
            }
            if (!dropped.isEmpty()) {
                logger.log(Level.FINE, "{0}: keys absent from the first object were dropped: {1}", new Object[]{name, dropped});
            }
            return new Table(name, columns, records, fileType, metadata);
        }
        String text = root.isTextual() ? root.textValue() : root.toString();
        List<Object> single = new ArrayList<>(1);
        single.add(text);
        return new Table(name, List.of(VALUE_COLUMN), List.of(single), fileType, metadata);
    }

    private static boolean isArrayOfObjects(JsonNode root) {
        if (root == null || !root.isArray() || root.isEmpty()) return false;
        for (JsonNode element : root) {
            if (!element.isObject()) return false;
        }
        return true;
    }

    static Object scalar(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) return null;
        if (node.isTextual()) return node.textValue();
        if (node.isBoolean()) return node.booleanValue();
        if (node.isIntegralNumber()) return node.canConvertToLong() ? (Object) node.longValue() : node.bigIntegerValue();
        if (node.isNumber()) return node.doubleValue();
        return node.toString();
    }
}
