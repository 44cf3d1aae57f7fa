package com.notesapi.db;

import java.util.Locale;

/**
 * Order in which notes are listed, by creation time.
 */
public enum SortOrder {
    /**
     * Oldest to newest.
     */
    ASCENDING,

    /**
     * Newest to oldest.
     */
    DESCENDING,

    /**
     * Unspecified sort order. The configured default will be used.
     */
    SORT_ORDER_UNSPECIFIED;

    /**
     * Resolves an unspecified order to the given default.
     *
     * @param defaultOrder the order to use when this one is unspecified
     * @return this order, or {@code defaultOrder} if this is {@link #SORT_ORDER_UNSPECIFIED}
     */
    public SortOrder orDefault(SortOrder defaultOrder) {
        return this == SORT_ORDER_UNSPECIFIED ? defaultOrder : this;
    }

    /**
     * Parse a sort order string to a SortOrder enum value.
     *
     * @param sortOrderStr The sort order string, may be null
     * @return The corresponding SortOrder enum value, or SORT_ORDER_UNSPECIFIED if null or invalid
     */
    public static SortOrder fromString(String sortOrderStr) {
        if (sortOrderStr == null) {
            return SORT_ORDER_UNSPECIFIED;
        }

        return switch (sortOrderStr.toUpperCase(Locale.ROOT)) {
            case "ASCENDING", "ASC" -> ASCENDING;
            case "DESCENDING", "DESC" -> DESCENDING;
            default -> SORT_ORDER_UNSPECIFIED;
        };
    }
}
