package dev.pekelund.menuscan.menuparser.extraction;

import java.math.BigDecimal;
import java.util.regex.Pattern;

/**
 * Converts printed price tokens into decimals.
 */
public final class PriceParser {

    // Currency words such as "Rs." must not leave their dot in front of the amount.
    private static final Pattern LETTERS = Pattern.compile("\\p{L}+\\.?");

    private PriceParser() {
    }

    /**
     * Parse a price token. A comma used as the only separator is read as the decimal point; when both
     * separators occur the last one is the decimal point and the other groups thousands; a separator
     * repeated more than once is thousands grouping.
     *
     * @return the parsed amount or {@code null} if the token holds no digits
     */
    public static BigDecimal parse(String value) {
        if (value == null) {
            return null;
        }
        String token = LETTERS.matcher(value.replace('\u00A0', ' ')).replaceAll("").replaceAll("[^0-9.,]", "");
        if (token.isEmpty() || token.chars().noneMatch(Character::isDigit)) {
            return null;
        }

        int dots = count(token, '.');
        int commas = count(token, ',');
        String normalised;
        if (dots > 0 && commas > 0) {
            char decimal = token.lastIndexOf('.') > token.lastIndexOf(',') ? '.' : ',';
            char grouping = decimal == '.' ? ',' : '.';
            normalised = token.replace(String.valueOf(grouping), "").replace(decimal, '.');
        } else if (commas == 1) {
            normalised = token.replace(',', '.');
        } else if (commas > 1) {
            normalised = token.replace(",", "");
        } else if (dots > 1) {
            normalised = token.replace(".", "");
        } else {
            normalised = token;
        }

        if (normalised.startsWith(".")) {
            normalised = "0" + normalised;
        }
        if (normalised.endsWith(".")) {
            normalised = normalised.substring(0, normalised.length() - 1);
        }
        try {
            return new BigDecimal(normalised);
        } catch (NumberFormatException ex) {
            return null;
        }
    }

    private static int count(String value, char separator) {
        int count = 0;
        for (int i = 0; i < value.length(); i++) {
            if (value.charAt(i) == separator) {
                count++;
            }
        }
        return count;
    }
}
