package com.geico.poc.ttlindex.policy;

import java.nio.charset.StandardCharsets;

/**
 * Quoting for identifiers that cannot be bound as statement parameters.
 */
public final class SqlIdentifiers {

    /** NAMEDATALEN - 1 */
    public static final int MAX_IDENTIFIER_BYTES = 63;

    private static final String INDEX_PREFIX = "idx_ttl_";

    private SqlIdentifiers() {
    }

    /**
     * Quote an identifier the way PostgreSQL's quote_ident/%I does, except that it always
     * quotes: the result names exactly the given (case-sensitive) identifier.
     */
    public static String quote(String identifier) {
        if (identifier == null || identifier.isEmpty()) {
            throw new IllegalArgumentException("identifier must not be empty");
        }
        if (identifier.indexOf('\0') >= 0) {
            throw new IllegalArgumentException("identifier must not contain NUL characters");
        }
        return '"' + identifier.replace("\"", "\"\"") + '"';
    }

    /**
     * Name of the supporting index created for a policy's column: {@code idx_ttl_<table>_<column>},
     * or {@link #hashedIndexName} when that would exceed {@value #MAX_IDENTIFIER_BYTES} bytes
     * and be truncated by the store.
     */
    public static String supportingIndexName(String tableName, String columnName) {
        String name = INDEX_PREFIX + tableName + "_" + columnName;
        if (utf8Length(name) <= MAX_IDENTIFIER_BYTES) {
            return name;
        }
        return hashedIndexName(tableName, columnName);
    }

    /**
     * Index name that is distinct per (table, column) pair even where the plain name is not,
     * e.g. ("a_b", "c") and ("a", "b_c"). Always fits in {@value #MAX_IDENTIFIER_BYTES} bytes.
     */
    public static String hashedIndexName(String tableName, String columnName) {
        String suffix = String.format("_%08x", (tableName + '\0' + columnName).hashCode());
        String plain = INDEX_PREFIX + tableName + "_" + columnName;
        return truncateUtf8(plain, MAX_IDENTIFIER_BYTES - suffix.length()) + suffix;
    }

    static int utf8Length(String s) {
        return s.getBytes(StandardCharsets.UTF_8).length;
    }

    // Never splits a character
    static String truncateUtf8(String s, int maxBytes) {
        StringBuilder out = new StringBuilder();
        int bytes = 0;
        for (int i = 0; i < s.length(); ) {
            int codePoint = s.codePointAt(i);
            String ch = new String(Character.toChars(codePoint));
            int len = utf8Length(ch);
            if (bytes + len > maxBytes) {
                break;
            }
            out.append(ch);
            bytes += len;
            i += Character.charCount(codePoint);
        }
        return out.toString();
    }
}
