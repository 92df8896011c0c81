package com.guardsql.dialect;

import lombok.Value;

import java.util.List;

/**
 * Catalog SQL with its positional parameters.
 */
@Value
public class CatalogQuery {
    String sql;
    List<Object> params;

    public static CatalogQuery of(String sql, Object... params) {
        return new CatalogQuery(sql, List.of(params));
    }
}
