package dev.pekelund.menuscan.menuparser.extraction;

import dev.pekelund.menuscan.items.MenuItemConstants;
import dev.pekelund.menuscan.items.ParsedItem;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Filters implausible items and suppresses duplicates recovered by more than one strategy.
 */
@Component
public class ItemValidator {

    private static final Set<String> STOPLIST = Set.of(
        "total", "subtotal", "tax", "tip", "discount", "page", "menu", "price", "amount"
    );

    public boolean isValidItem(ParsedItem item) {
        if (item == null || item.name() == null || item.price() == null) {
            return false;
        }
        int length = item.name().length();
        if (length < MenuItemConstants.MIN_NAME_LENGTH || length > MenuItemConstants.MAX_NAME_LENGTH) {
            return false;
        }
        if (item.price().signum() <= 0 || item.price().compareTo(MenuItemConstants.MAX_PRICE) > 0) {
            return false;
        }
        return !STOPLIST.contains(item.name().toLowerCase(Locale.ROOT));
    }

    public String generateItemKey(String name, BigDecimal price) {
        String normalisedName = name == null ? "" : name.toLowerCase(Locale.ROOT).replaceAll("\\s+", "");
        String normalisedPrice = price == null ? "" : price.setScale(2, RoundingMode.HALF_UP).toPlainString();
        return normalisedName + normalisedPrice;
    }

    /**
     * Fold strategy outputs, highest priority first, into one list of valid items. An item whose key was
     * already produced by an earlier strategy is dropped.
     */
    public List<ParsedItem> mergeInPriorityOrder(List<List<ParsedItem>> outputsByPriority) {
        Set<String> seenKeys = new HashSet<>();
        List<ParsedItem> merged = new ArrayList<>();
        for (List<ParsedItem> output : outputsByPriority) {
            for (ParsedItem item : output) {
                if (isValidItem(item) && seenKeys.add(generateItemKey(item.name(), item.price()))) {
                    merged.add(item);
                }
            }
        }
        return merged;
    }
}
