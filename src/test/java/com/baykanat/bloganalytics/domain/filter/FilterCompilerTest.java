package com.baykanat.bloganalytics.domain.filter;

import com.baykanat.bloganalytics.domain.exception.InvalidFilterException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for FilterCompiler.
 *
 * <p>Covers the accepted tree shapes and every rejection rule of the filter language.
 * No Spring context, no database.
 */
class FilterCompilerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private FilterCompiler compiler;

    @BeforeEach
    void setUp() {
        compiler = new FilterCompiler();
    }

    private JsonNode json(String raw) throws Exception {
        return objectMapper.readTree(raw);
    }

    @Test
    @DisplayName("and of eq and gte compiles to a conjunction of two comparisons")
    void compilesConjunction() throws Exception {
        FilterPredicate predicate = compiler.compile(json("""
                {"and": [
                  {"eq":  {"field": "country.code", "value": "US"}},
                  {"gte": {"field": "created_at",   "value": "2025-01-01"}}
                ]}
                """));

        assertThat(predicate).isInstanceOf(FilterPredicate.And.class);
        List<FilterPredicate> children = ((FilterPredicate.And) predicate).getChildren();
        assertThat(children).containsExactly(
                new FilterPredicate.Comparison(FilterOperator.EQ, FieldPath.parse("country.code"), "US"),
                new FilterPredicate.Comparison(FilterOperator.GTE, FieldPath.parse("created_at"), "2025-01-01"));
    }

    @Test
    @DisplayName("Dotted field paths map to double-underscore lookup paths")
    void dottedPathTranslatesToLookupPath() throws Exception {
        FilterPredicate.Comparison comparison = (FilterPredicate.Comparison) compiler.compile(
                json("{\"eq\": {\"field\": \"blog.author.country.code\", \"value\": \"TR\"}}"));

        assertThat(comparison.getField().lookupPath()).isEqualTo("blog__author__country__code");
        assertThat(comparison.getField().dotted()).isEqualTo("blog.author.country.code");
    }

    @Test
    @DisplayName("not and or nest; numeric and boolean scalars keep their JSON type")
    void compilesNestedCombinators() throws Exception {
        FilterPredicate predicate = compiler.compile(json("""
                {"not": {"or": [
                  {"lt": {"field": "blog.id", "value": 10}},
                  {"gt": {"field": "blog.id", "value": 2.5}},
                  {"eq": {"field": "blog.title", "value": true}}
                ]}}
                """));

        FilterPredicate.Or or = (FilterPredicate.Or) ((FilterPredicate.Not) predicate).getChild();
        assertThat(or.getChildren()).extracting(p -> ((FilterPredicate.Comparison) p).getValue())
                .containsExactly(10L, new BigDecimal("2.5"), true);
    }

    @Test
    @DisplayName("in takes a list of scalars")
    void compilesIn() throws Exception {
        FilterPredicate.Comparison comparison = (FilterPredicate.Comparison) compiler.compile(
                json("{\"in\": {\"field\": \"country.code\", \"value\": [\"US\", \"TR\"]}}"));

        assertThat(comparison.getOperator()).isEqualTo(FilterOperator.IN);
        assertThat(comparison.getValue()).isEqualTo(List.of("US", "TR"));
    }

    @Test
    @DisplayName("Null, missing and empty object filters compile to nothing")
    void emptyFiltersAreOptional() throws Exception {
        assertThat(compiler.compileOptional(null)).isEmpty();
        assertThat(compiler.compileOptional(json("null"))).isEmpty();
        assertThat(compiler.compileOptional(json("{}"))).isEmpty();
    }

    @Test
    @DisplayName("Unfilled template key additionalProp1 is rejected")
    void rejectsTemplatePlaceholder() {
        assertThatThrownBy(() -> compiler.compile(json("{\"additionalProp1\": \"x\"}")))
                .isInstanceOf(InvalidFilterException.class)
                .hasMessageContaining("additionalProp1");
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "[]",
            "\"eq\"",
            "{\"and\": []}",
            "{\"or\": {\"eq\": {\"field\": \"a\", \"value\": 1}}}",
            "{\"eq\": {\"value\": 1}}",
            "{\"eq\": {\"field\": \"blog.id\"}}",
            "{\"eq\": {\"field\": \"blog.id\", \"value\": null}}",
            "{\"in\": {\"field\": \"blog.id\", \"value\": 1}}",
            "{\"contains\": {\"field\": \"blog.title\", \"value\": 5}}",
            "{\"like\": {\"field\": \"blog.title\", \"value\": \"x\"}}",
            "{\"eq\": {\"field\": \"blog.id\", \"value\": 1}, \"lt\": {\"field\": \"blog.id\", \"value\": 2}}",
            "{\"eq\": {\"field\": \"blog.id\", \"value\": 1, \"extra\": true}}",
            "{\"eq\": {\"field\": \"blog.id; DROP TABLE blogs\", \"value\": 1}}",
            "{\"eq\": {\"field\": \"blog.id\", \"value\": {\"nested\": 1}}}"
    })
    @DisplayName("Malformed trees raise InvalidFilterException")
    void rejectsMalformedTrees(String raw) {
        assertThatThrownBy(() -> compiler.compile(json(raw)))
                .isInstanceOf(InvalidFilterException.class);
    }

    @Test
    @DisplayName("Nesting deeper than the limit is rejected")
    void rejectsDeepNesting() {
        String leaf = "{\"eq\": {\"field\": \"blog.id\", \"value\": 1}}";
        String tree = leaf;
        for (int i = 0; i < 20; i++) {
            tree = "{\"not\": " + tree + "}";
        }
        String deep = tree;

        assertThatThrownBy(() -> compiler.compile(json(deep)))
                .isInstanceOf(InvalidFilterException.class)
                .hasMessageContaining("nesting");
    }

    @Test
    @DisplayName("Error messages name the JSON node type independently of the default locale")
    void nodeTypeNameIgnoresDefaultLocale() throws Exception {
        Locale original = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            JsonNode text = json("\"country.code\"");
            assertThatThrownBy(() -> compiler.compile(text))
                    .isInstanceOf(InvalidFilterException.class)
                    .hasMessage("Invalid filter: filter node must be an object, got string");
        } finally {
            Locale.setDefault(original);
        }
    }
}
