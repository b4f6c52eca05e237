package org.tabula.validation;

import java.util.function.Predicate;

/**
 * A named check on one field of a record.
 */
public record ValidationRule(String field, Predicate<Object> validator, String errorMessage) {
}
