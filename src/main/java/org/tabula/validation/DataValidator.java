package org.tabula.validation;

import org.tabula.model.Table;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Applies field presence and content rules. Optional stage: the processor runs it only when one is supplied.
 */
public class DataValidator {

    private final List<ValidationRule> rules;

    public DataValidator(List<ValidationRule> rules) {
        this.rules = List.copyOf(rules);
    }

    /**
     * @return error messages for failed rules, empty when the data is valid
     */
    public List<String> validate(Map<String, Object> data) {
        List<String> errors = new ArrayList<>();
        for (ValidationRule rule : rules) {
            if (!data.containsKey(rule.field())) {
                errors.add("Missing required field: " + rule.field());
                continue;
            }
            if (!rule.validator().test(data.get(rule.field()))) {
                errors.add(rule.errorMessage());
            }
        }
        return errors;
    }

    /**
     * Validates a table's metadata together with its {@code name}, {@code columns} and {@code records}.
     */
    public List<String> validateTable(Table table) {
        Map<String, Object> view = new LinkedHashMap<>(table.metadata());
        view.put("name", table.name());
        view.put("columns", table.columns());
        view.put("records", table.records());
        return validate(view);
    }

    public List<ValidationRule> getRules() {
        return rules;
    }

    public static boolean isNotEmpty(Object value) {
        if (value == null) return false;
        if (value instanceof CharSequence s) return !s.toString().isBlank();
        if (value instanceof Collection<?> c) return !c.isEmpty();
        if (value instanceof Map<?, ?> m) return !m.isEmpty();
        return true;
    }

    /**
     * Rules applied by the command line run: provenance stamped and at least one column present.
     */
    public static DataValidator defaultRules() {
        return new DataValidator(List.of(
                new ValidationRule("source", DataValidator::isNotEmpty, "Source field cannot be empty"),
                new ValidationRule("timestamp", DataValidator::isNotEmpty, "Timestamp field cannot be empty"),
                new ValidationRule("columns", DataValidator::isNotEmpty, "Table must have at least one column")));
    }
}
