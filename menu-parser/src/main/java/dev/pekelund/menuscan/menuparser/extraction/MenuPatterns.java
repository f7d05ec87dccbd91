package dev.pekelund.menuscan.menuparser.extraction;

import java.util.regex.Pattern;

/**
 * Regular expression fragments shared by the extraction strategies.
 */
final class MenuPatterns {

    /**
     * Currency markers in detection priority order.
     */
    static final String CURRENCY = "(?:\\$|₹|€|£|¥|AED|USD|INR|EUR|GBP|Rs\\.?)";

    /**
     * A run of digits with optional grouping or decimal separators, e.g. {@code 45}, {@code 12,50}, {@code 1,250.00}.
     */
    static final String PRICE = "\\d+(?:[.,]\\d+)*";

    // "250/-" is a common way of writing whole rupee amounts.
    static final String PRICE_SUFFIX = "(?:\\s*/-)?";

    static final Pattern PRICE_ONLY = Pattern.compile(
        "^(?<currency>" + CURRENCY + ")?\\s*(?<price>" + PRICE + ")" + PRICE_SUFFIX + "$"
    );

    static final Pattern PRICE_TOKEN = Pattern.compile("\\d+(?:[.,]\\d+)?");

    private MenuPatterns() {
    }
}
