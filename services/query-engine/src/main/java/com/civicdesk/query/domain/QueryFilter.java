package com.civicdesk.query.domain;

import java.util.Locale;

/**
 * Status and free-text filter applied to the query table. Both parts are optional.
 */
public record QueryFilter(QueryStatus status, String search) {

    public static final QueryFilter ALL = new QueryFilter(null, null);

    public boolean matches(Query query) {
        if (status != null && query.status() != status) {
            return false;
        }
        if (search == null || search.isBlank()) {
            return true;
        }
        String needle = search.trim().toLowerCase(Locale.ROOT);
        return contains(query.referenceId(), needle)
            || contains(query.customerName(), needle)
            || contains(query.accountNumber(), needle)
            || contains(query.description(), needle);
    }

    private static boolean contains(String haystack, String needle) {
        return haystack != null && haystack.toLowerCase(Locale.ROOT).contains(needle);
    }
}
