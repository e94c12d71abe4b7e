package com.baykanat.bloganalytics.infrastructure.persistence.filter;

import com.baykanat.bloganalytics.domain.exception.InvalidFilterException;
import com.baykanat.bloganalytics.domain.filter.FilterPredicate;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * FilterPredicate → PostgreSQL WHERE parçası. Kolonlar registry'den gelir, değerler her zaman bind parametresidir.
 * NOT, NULL karşılaştırmaları false sayılarak iki değerli mantıkla uygulanır.
 */
public class SqlFilterRenderer implements FilterPredicate.Visitor<SqlFragment> {

    private final FilterFieldRegistry registry;

    public SqlFilterRenderer(FilterFieldRegistry registry) {
        this.registry = registry;
    }

    public SqlFragment render(FilterPredicate predicate) {
        return predicate.accept(this);
    }

    @Override
    public SqlFragment visitComparison(FilterPredicate.Comparison comparison) {
        FilterColumn column = registry.resolve(comparison.getField());
        String expr = column.getExpression();
        Object value = comparison.getValue();

        return switch (comparison.getOperator()) {
            case EQ -> SqlFragment.of(expr + " = ?", List.of(convert(column, value)));
            case LT -> SqlFragment.of(expr + " < ?", List.of(convert(column, value)));
            case LTE -> SqlFragment.of(expr + " <= ?", List.of(convert(column, value)));
            case GT -> SqlFragment.of(expr + " > ?", List.of(convert(column, value)));
            case GTE -> SqlFragment.of(expr + " >= ?", List.of(convert(column, value)));
            case CONTAINS -> {
                if (column.getType() != FilterColumn.Type.TEXT) {
                    throw new InvalidFilterException("'contains' is only supported on text fields, not '"
                            + comparison.getField().dotted() + "'");
                }
                yield SqlFragment.of(expr + " ILIKE ? ESCAPE '\\'",
                        List.of("%" + escapeLike(String.valueOf(value)) + "%"));
            }
            case IN -> renderIn(column, (List<?>) value);
        };
    }

    @Override
    public SqlFragment visitAnd(FilterPredicate.And and) {
        return SqlFragment.join("AND", and.getChildren().stream().map(this::render).toList());
    }

    @Override
    public SqlFragment visitOr(FilterPredicate.Or or) {
        return SqlFragment.join("OR", or.getChildren().stream().map(this::render).toList());
    }

    @Override
    public SqlFragment visitNot(FilterPredicate.Not not) {
        SqlFragment child = render(not.getChild());
        return SqlFragment.of("NOT COALESCE(" + child.getSql() + ", FALSE)", child.getParams());
    }

    private SqlFragment renderIn(FilterColumn column, List<?> values) {
        if (values.isEmpty()) {
            return SqlFragment.of("FALSE", Collections.emptyList());
        }
        List<Object> params = new ArrayList<>(values.size());
        for (Object value : values) {
            params.add(convert(column, value));
        }
        String placeholders = values.stream().map(v -> "?").collect(Collectors.joining(", "));
        return SqlFragment.of(column.getExpression() + " IN (" + placeholders + ")", params);
    }

    /** JSON skalerini kolon tipine çevirir; uyumsuz değer InvalidFilterException. */
    private Object convert(FilterColumn column, Object value) {
        return switch (column.getType()) {
            case TEXT -> String.valueOf(value);
            case NUMBER -> toNumber(column, value);
            case TIMESTAMP -> toTimestamp(column, value);
        };
    }

    private Object toNumber(FilterColumn column, Object value) {
        if (value instanceof Long || value instanceof BigDecimal) {
            return value;
        }
        if (value instanceof String text) {
            try {
                BigDecimal parsed = new BigDecimal(text.trim());
                return parsed.scale() <= 0 ? (Object) parsed.longValueExact() : parsed;
            } catch (NumberFormatException | ArithmeticException e) {
                throw new InvalidFilterException("'" + text + "' is not a number for " + column.getExpression(), e);
            }
        }
        throw new InvalidFilterException("value " + value + " is not a number for " + column.getExpression());
    }

    private Timestamp toTimestamp(FilterColumn column, Object value) {
        if (!(value instanceof String text)) {
            throw new InvalidFilterException("value " + value + " is not an ISO date for " + column.getExpression());
        }
        return Timestamp.from(parseInstant(text.trim()));
    }

    /** yyyy-MM-dd (UTC gece yarısı), offset'li ISO date-time veya offset'siz (UTC kabul edilir). */
    static Instant parseInstant(String text) {
        try {
            if (text.length() == 10) {
                return LocalDate.parse(text).atStartOfDay(ZoneOffset.UTC).toInstant();
            }
            if (text.endsWith("Z") || text.matches(".*[+-]\\d{2}:\\d{2}$")) {
                return OffsetDateTime.parse(text).toInstant();
            }
            return LocalDateTime.parse(text).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw new InvalidFilterException("'" + text + "' is not an ISO date or date-time", e);
        }
    }

    private static String escapeLike(String raw) {
        return raw.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }
}
