package dev.pekelund.menuscan.menuparser.extraction;

import java.util.Locale;
import org.springframework.stereotype.Component;

/**
 * Decides whether a line of menu text reads like an item name, carries a price, or is a bare price.
 */
@Component
public class LineClassifier {

    private static final int MIN_NAME_LENGTH = 3;
    private static final int MAX_NAME_LENGTH = 60;
    private static final int MAX_UPPERCASE_LENGTH = 15;

    public boolean isLikelyItemName(String line) {
        if (line == null) {
            return false;
        }
        String trimmed = line.trim();
        int length = trimmed.length();
        if (length < MIN_NAME_LENGTH || length > MAX_NAME_LENGTH) {
            return false;
        }
        if (!Character.isLetter(trimmed.charAt(0))) {
            return false;
        }
        if (length > MAX_UPPERCASE_LENGTH && trimmed.equals(trimmed.toUpperCase(Locale.ROOT))) {
            return false;
        }
        long digits = trimmed.chars().filter(Character::isDigit).count();
        return digits * 3 < length;
    }

    public boolean containsPrice(String line) {
        return line != null && MenuPatterns.PRICE_TOKEN.matcher(line).find();
    }

    public boolean isPriceOnly(String line) {
        return line != null && MenuPatterns.PRICE_ONLY.matcher(line.trim()).matches();
    }
}
