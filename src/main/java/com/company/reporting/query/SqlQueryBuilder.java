package com.company.reporting.query;

import com.company.reporting.exception.ReportValidationException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Expands ${name} placeholders and appends filter predicates to relational query text.
 */
public final class SqlQueryBuilder {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_.]*");

    private SqlQueryBuilder() {
    }

    public static String build(String query, Map<String, Object> parameters, Map<String, Object> filters) {
        String expanded = substituteParameters(query, parameters);
        return appendFilters(expanded, filters);
    }

    static String substituteParameters(String query, Map<String, Object> parameters) {
        if (parameters == null || parameters.isEmpty()) {
            return query;
        }
        String result = query;
        for (Map.Entry<String, Object> parameter : parameters.entrySet()) {
            result = result.replace("${" + parameter.getKey() + "}", String.valueOf(parameter.getValue()));
        }
        return result;
    }

    static String appendFilters(String query, Map<String, Object> filters) {
        if (filters == null || filters.isEmpty()) {
            return query;
        }

        List<String> clauses = new ArrayList<>();
        for (Map.Entry<String, Object> filter : filters.entrySet()) {
            String field = requireIdentifier(filter.getKey());
            Object value = filter.getValue();

            if (value instanceof Collection<?> values && values.isEmpty()) {
                clauses.add(field + " IN ('')");
            } else if (value instanceof Collection<?> values) {
                String joined = values.stream()
                        .map(v -> quote(String.valueOf(v)))
                        .collect(Collectors.joining(","));
                clauses.add(field + " IN (" + joined + ")");
            } else {
                clauses.add(field + " = " + quote(String.valueOf(value)));
            }
        }

        String predicate = String.join(" AND ", clauses);
        if (query.toUpperCase(Locale.ROOT).contains("WHERE")) {
            return query + " AND " + predicate;
        }
        return query + " WHERE " + predicate;
    }

    public static String requireIdentifier(String name) {
        if (name == null || !IDENTIFIER.matcher(name).matches()) {
            throw new ReportValidationException("Invalid field name in query filters: " + name);
        }
        return name;
    }

    private static String quote(String value) {
        return "'" + value.replace("'", "''") + "'";
    }
}
