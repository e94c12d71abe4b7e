package com.baykanat.bloganalytics.infrastructure.persistence.filter;

import com.baykanat.bloganalytics.domain.exception.InvalidFilterException;
import com.baykanat.bloganalytics.domain.filter.FieldPath;
import com.baykanat.bloganalytics.domain.filter.FilterPredicate;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Bir sorgu kaynağında filtrelenebilen alanların whitelist'i: lookup path (blog__country__code) → SQL kolonu.
 * Listede olmayan alan SQL'e asla ulaşmaz.
 */
public final class FilterFieldRegistry {

    /** blog_views v JOIN blogs b JOIN authors a JOIN users u LEFT JOIN countries c. */
    public static final FilterFieldRegistry VIEW_EVENTS = builder("view events")
            .field(FilterColumn.Type.NUMBER, "v.id", "id")
            .field(FilterColumn.Type.TIMESTAMP, "v.viewed_at", "viewed_at", "created_at")
            .field(FilterColumn.Type.NUMBER, "v.user_id", "user.id", "user_id")
            .field(FilterColumn.Type.NUMBER, "b.id", "blog.id", "blog_id")
            .field(FilterColumn.Type.TEXT, "b.title", "blog.title")
            .field(FilterColumn.Type.TIMESTAMP, "b.created_at", "blog.created_at")
            .field(FilterColumn.Type.NUMBER, "a.id", "blog.author.id", "author.id")
            .field(FilterColumn.Type.NUMBER, "a.user_id", "blog.author.user.id", "author.user.id")
            .field(FilterColumn.Type.TEXT, "u.username", "blog.author.username", "author.username",
                    "blog.author.user.username", "author.user.username")
            .field(FilterColumn.Type.NUMBER, "c.id", "blog.country.id", "country.id")
            .field(FilterColumn.Type.TEXT, "c.code", "blog.country.code", "country.code")
            .field(FilterColumn.Type.TEXT, "c.name", "blog.country.name", "country.name")
            .field(FilterColumn.Type.TEXT, "c.continent", "blog.country.continent", "country.continent")
            .build();

    /** blog_view_rollups r LEFT JOIN countries c LEFT JOIN authors a LEFT JOIN users u; sadece dimension alanları. */
    public static final FilterFieldRegistry VIEW_ROLLUPS = builder("view rollups")
            .field(FilterColumn.Type.NUMBER, "r.blog_id", "blog.id", "blog_id")
            .field(FilterColumn.Type.NUMBER, "r.author_id", "blog.author.id", "author.id", "author_id")
            .field(FilterColumn.Type.NUMBER, "a.user_id", "blog.author.user.id", "author.user.id", "user_id")
            .field(FilterColumn.Type.TEXT, "u.username", "blog.author.username", "author.username")
            .field(FilterColumn.Type.NUMBER, "r.country_id", "blog.country.id", "country.id", "country_id")
            .field(FilterColumn.Type.TEXT, "c.code", "blog.country.code", "country.code")
            .field(FilterColumn.Type.TEXT, "c.name", "blog.country.name", "country.name")
            .field(FilterColumn.Type.TEXT, "c.continent", "blog.country.continent", "country.continent")
            .build();

    /** blog_creation_rollups r; blog dimension'ı yoktur. */
    public static final FilterFieldRegistry CREATION_ROLLUPS = builder("creation rollups")
            .field(FilterColumn.Type.NUMBER, "r.author_id", "blog.author.id", "author.id", "author_id")
            .field(FilterColumn.Type.NUMBER, "a.user_id", "blog.author.user.id", "author.user.id", "user_id")
            .field(FilterColumn.Type.TEXT, "u.username", "blog.author.username", "author.username")
            .field(FilterColumn.Type.NUMBER, "r.country_id", "blog.country.id", "country.id", "country_id")
            .field(FilterColumn.Type.TEXT, "c.code", "blog.country.code", "country.code")
            .field(FilterColumn.Type.TEXT, "c.name", "blog.country.name", "country.name")
            .field(FilterColumn.Type.TEXT, "c.continent", "blog.country.continent", "country.continent")
            .build();

    /** blogs b JOIN authors a JOIN users u LEFT JOIN countries c; blog alanlarıyla filtrelenen creation serisi için. */
    public static final FilterFieldRegistry BLOGS = builder("blogs")
            .field(FilterColumn.Type.NUMBER, "b.id", "blog.id", "blog_id")
            .field(FilterColumn.Type.TEXT, "b.title", "blog.title")
            .field(FilterColumn.Type.TIMESTAMP, "b.created_at", "blog.created_at", "created_at")
            .field(FilterColumn.Type.NUMBER, "a.id", "blog.author.id", "author.id", "author_id")
            .field(FilterColumn.Type.NUMBER, "a.user_id", "blog.author.user.id", "author.user.id", "user_id")
            .field(FilterColumn.Type.TEXT, "u.username", "blog.author.username", "author.username")
            .field(FilterColumn.Type.NUMBER, "c.id", "blog.country.id", "country.id", "country_id")
            .field(FilterColumn.Type.TEXT, "c.code", "blog.country.code", "country.code")
            .field(FilterColumn.Type.TEXT, "c.name", "blog.country.name", "country.name")
            .field(FilterColumn.Type.TEXT, "c.continent", "blog.country.continent", "country.continent")
            .build();

    private final String source;
    private final Map<String, FilterColumn> columns;

    private FilterFieldRegistry(String source, Map<String, FilterColumn> columns) {
        this.source = source;
        this.columns = Map.copyOf(columns);
    }

    /** Alan yolunu kolona çözer; bilinmeyen alan InvalidFilterException. */
    public FilterColumn resolve(FieldPath field) {
        FilterColumn column = columns.get(field.lookupPath());
        if (column == null) {
            throw new InvalidFilterException("field '" + field.dotted() + "' is not filterable on " + source);
        }
        return column;
    }

    /** Ağaçtaki tüm alanlar bu kaynakta filtrelenebiliyor mu. */
    public boolean covers(FilterPredicate predicate) {
        return predicate.accept(new FilterPredicate.Visitor<Boolean>() {
            @Override
            public Boolean visitComparison(FilterPredicate.Comparison comparison) {
                return columns.containsKey(comparison.getField().lookupPath());
            }

            @Override
            public Boolean visitAnd(FilterPredicate.And and) {
                return and.getChildren().stream().allMatch(child -> child.accept(this));
            }

            @Override
            public Boolean visitOr(FilterPredicate.Or or) {
                return or.getChildren().stream().allMatch(child -> child.accept(this));
            }

            @Override
            public Boolean visitNot(FilterPredicate.Not not) {
                return not.getChild().accept(this);
            }
        });
    }

    static Builder builder(String source) {
        return new Builder(source);
    }

    static final class Builder {
        private final String source;
        private final Map<String, FilterColumn> columns = new LinkedHashMap<>();

        private Builder(String source) {
            this.source = source;
        }

        Builder field(FilterColumn.Type type, String expression, String... dottedAliases) {
            FilterColumn column = new FilterColumn(expression, type);
            for (String alias : dottedAliases) {
                columns.put(FieldPath.parse(alias).lookupPath(), column);
            }
            return this;
        }

        FilterFieldRegistry build() {
            return new FilterFieldRegistry(source, columns);
        }
    }
}
