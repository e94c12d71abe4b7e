package com.baykanat.bloganalytics.domain.filter;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

import java.util.List;

/**
 * Derlenmiş filter ağacı; storage'dan bağımsızdır. Storage adapter'ları Visitor ile SQL vb.'ye indirger.
 */
public interface FilterPredicate {

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visitComparison(Comparison comparison);

        R visitAnd(And and);

        R visitOr(Or or);

        R visitNot(Not not);
    }

    /** field op value; IN için value bir List, diğerlerinde skaler. */
    @Getter
    @ToString
    @EqualsAndHashCode
    @RequiredArgsConstructor
    final class Comparison implements FilterPredicate {
        private final FilterOperator operator;
        private final FieldPath field;
        private final Object value;

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitComparison(this);
        }
    }

    @Getter
    @ToString
    @EqualsAndHashCode
    @RequiredArgsConstructor
    final class And implements FilterPredicate {
        private final List<FilterPredicate> children;

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAnd(this);
        }
    }

    @Getter
    @ToString
    @EqualsAndHashCode
    @RequiredArgsConstructor
    final class Or implements FilterPredicate {
        private final List<FilterPredicate> children;

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitOr(this);
        }
    }

    @Getter
    @ToString
    @EqualsAndHashCode
    @RequiredArgsConstructor
    final class Not implements FilterPredicate {
        private final FilterPredicate child;

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitNot(this);
        }
    }
}
