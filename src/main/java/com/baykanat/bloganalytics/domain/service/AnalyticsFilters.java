package com.baykanat.bloganalytics.domain.service;

import com.baykanat.bloganalytics.domain.filter.FilterCompiler;
import com.baykanat.bloganalytics.domain.filter.FilterPredicate;
import com.baykanat.bloganalytics.infrastructure.persistence.filter.FilterFieldRegistry;
import com.baykanat.bloganalytics.infrastructure.persistence.filter.SqlFilterRenderer;
import com.baykanat.bloganalytics.infrastructure.persistence.filter.SqlFragment;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Optional;

/** İstek filtresini derleyip hedef sorgu kaynağının SQL parçasına indirger; hatalar storage'a gitmeden fırlar. */
@Component
@RequiredArgsConstructor
public class AnalyticsFilters {

    private final FilterCompiler filterCompiler;

    public Optional<FilterPredicate> compile(JsonNode filters) {
        return filterCompiler.compileOptional(filters);
    }

    /** Filtre yoksa null; repository'ler null'u "filtre yok" olarak yorumlar. */
    public SqlFragment toSql(JsonNode filters, FilterFieldRegistry registry) {
        return toSql(compile(filters), registry);
    }

    public SqlFragment toSql(Optional<FilterPredicate> predicate, FilterFieldRegistry registry) {
        return predicate.map(p -> new SqlFilterRenderer(registry).render(p)).orElse(null);
    }
}
