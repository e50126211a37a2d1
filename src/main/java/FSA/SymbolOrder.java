package FSA;

import java.util.Comparator;

/**
 * Total order over transition symbols: numeric symbols compare by value, other symbols by the code of their first
 * character, so mixed alphabets such as {@code 0..9} and {@code a..z} sort deterministically. Ties fall back to
 * plain string order.
 */
public final class SymbolOrder implements Comparator<String> {
    public static final SymbolOrder INSTANCE = new SymbolOrder();
    private static final int MAX_DIGITS = 18;

    private SymbolOrder() {}

    @Override
    public int compare(String a, String b) {
        int byKey = Long.compare(sortKey(a), sortKey(b));
        return byKey != 0 ? byKey : a.compareTo(b);
    }

    static long sortKey(String symbol) {
        if (isNumeric(symbol)) {
            return Long.parseLong(symbol);
        }
        return symbol.isEmpty() ? Long.MIN_VALUE : symbol.codePointAt(0);
    }

    private static boolean isNumeric(String symbol) {
        int start = symbol.startsWith("-") ? 1 : 0;
        // longer digit runs do not fit a long; those order by first character
        if (symbol.length() <= start || symbol.length() - start > MAX_DIGITS) {
            return false;
        }
        for (int i = start; i < symbol.length(); i++) {
            if (!(symbol.charAt(i) >= '0' && symbol.charAt(i) <= '9')) {
                return false;
            }
        }
        return true;
    }
}
