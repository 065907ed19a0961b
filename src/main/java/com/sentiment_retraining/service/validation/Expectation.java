package com.sentiment_retraining.service.validation;

import com.sentiment_retraining.dto.data.CsvTable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * A named rule over a table. {@code check} returns the failure details, empty when the rule holds.
 */
public record Expectation(String name, Function<CsvTable, List<String>> check) {

    public List<String> evaluate(CsvTable table) {
        return check.apply(table);
    }

    public static Expectation columnsExist(List<String> columns) {
        return new Expectation("expect_columns_to_exist", table -> columns.stream()
                .filter(column -> !table.hasColumn(column))
                .map(column -> "missing column '" + column + "'")
                .toList());
    }

    public static Expectation valuesNotNull(String column) {
        return new Expectation("expect_column_values_to_not_be_null[" + column + "]", table -> {
            if (!table.hasColumn(column)) {
                return List.of();
            }
            long nulls = table.column(column).stream().filter(v -> v == null).count();
            return nulls == 0 ? List.of() : List.of(nulls + " null value(s) in '" + column + "'");
        });
    }

    public static Expectation valuesInSet(String column, Collection<String> allowed) {
        return new Expectation("expect_column_values_to_be_in_set[" + column + "]", table -> {
            if (!table.hasColumn(column)) {
                return List.of();
            }
            List<String> unexpected = table.column(column).stream()
                    .filter(v -> v != null && !allowed.contains(v))
                    .distinct()
                    .toList();
            return unexpected.isEmpty() ? List.of() : List.of("unexpected values in '" + column + "': " + unexpected);
        });
    }

    public static Expectation valuesUnique(String column) {
        return new Expectation("expect_column_values_to_be_unique[" + column + "]", table -> {
            if (!table.hasColumn(column)) {
                return List.of();
            }
            Set<String> seen = new HashSet<>();
            List<String> duplicates = new ArrayList<>();
            for (String value : table.column(column)) {
                if (value != null && !seen.add(value) && !duplicates.contains(value)) {
                    duplicates.add(value);
                }
            }
            return duplicates.isEmpty() ? List.of() : List.of("duplicate values in '" + column + "': " + duplicates);
        });
    }

    public static Expectation rowCountAtLeast(int minRows) {
        return new Expectation("expect_table_row_count_to_be_at_least[" + minRows + "]", table ->
                table.rowCount() >= minRows ? List.of() : List.of("only " + table.rowCount() + " row(s), need " + minRows));
    }

    public static Expectation valueLengthAtMost(String column, int maxLength) {
        return new Expectation("expect_column_value_lengths_to_be_at_most[" + column + "]", table -> {
            if (!table.hasColumn(column)) {
                return List.of();
            }
            long tooLong = table.column(column).stream().filter(v -> v != null && v.length() > maxLength).count();
            return tooLong == 0 ? List.of() : List.of(tooLong + " value(s) in '" + column + "' longer than " + maxLength);
        });
    }
}
