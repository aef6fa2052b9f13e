package io.github.ledgersync.model;

import java.math.BigInteger;
import java.util.Collection;
import java.util.function.Function;

/**
 * Ordering of paging tokens (cursors).
 * <p>
 * Tokens are opaque to clients but ordered by the server. Decimal tokens
 * are compared numerically, anything else lexicographically. A null token
 * sorts before every other token.
 */
public final class PagingTokens {

    private PagingTokens() {
    }

    /**
     * Compares two paging tokens.
     *
     * @param a the first token, may be null
     * @param b the second token, may be null
     * @return negative, zero or positive as a is older than, equal to or newer than b
     */
    public static int compare(String a, String b) {
        if (a == null || b == null) {
            return a == null ? (b == null ? 0 : -1) : 1;
        }
        if (isDecimal(a) && isDecimal(b)) {
            return new BigInteger(a).compareTo(new BigInteger(b));
        }
        return a.compareTo(b);
    }

    /**
     * Checks whether token a is strictly newer than b.
     *
     * @param a the candidate token
     * @param b the reference token, may be null
     * @return true if a is newer
     */
    public static boolean isNewer(String a, String b) {
        return compare(a, b) > 0;
    }

    /**
     * Returns the newest token among the records.
     *
     * @param records the records
     * @param token   extracts the token of a record
     * @param <T>     the record type
     * @return the newest token, or null if there are no records
     */
    public static <T> String newest(Collection<T> records, Function<T, String> token) {
        String newest = null;
        for (T record : records) {
            String candidate = token.apply(record);
            if (newest == null || compare(candidate, newest) > 0) {
                newest = candidate;
            }
        }
        return newest;
    }

    private static boolean isDecimal(String token) {
        if (token.isEmpty()) {
            return false;
        }
        for (int i = 0; i < token.length(); i++) {
            if (!Character.isDigit(token.charAt(i))) {
                return false;
            }
        }
        return true;
    }
}
