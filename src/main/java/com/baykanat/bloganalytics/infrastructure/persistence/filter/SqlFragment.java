package com.baykanat.bloganalytics.infrastructure.persistence.filter;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;

/** SQL WHERE parçası ve sıralı bind parametreleri. */
@Getter
@ToString
@RequiredArgsConstructor
public class SqlFragment {

    private final String sql;
    private final List<Object> params;

    public static SqlFragment of(String sql, List<Object> params) {
        return new SqlFragment(sql, List.copyOf(params));
    }

    /** Parçaları verilen bağlaçla (AND/OR) parantez içinde birleştirir. */
    public static SqlFragment join(String conjunction, List<SqlFragment> parts) {
        StringBuilder sql = new StringBuilder("(");
        List<Object> params = new ArrayList<>();
        for (int i = 0; i < parts.size(); i++) {
            if (i > 0) {
                sql.append(' ').append(conjunction).append(' ');
            }
            sql.append(parts.get(i).getSql());
            params.addAll(parts.get(i).getParams());
        }
        sql.append(')');
        return of(sql.toString(), params);
    }
}
