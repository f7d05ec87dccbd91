package dev.pekelund.menuscan.menuparser.extraction;

import dev.pekelund.menuscan.items.MenuItemConstants;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Assigns a menu category from a keyword lexicon. The first category whose keywords occur in the name wins.
 */
@Component
public class CategoryInferrer {

    private static final Map<String, Pattern> LEXICON = buildLexicon();

    public String infer(String name) {
        if (name == null || name.isBlank()) {
            return MenuItemConstants.DEFAULT_CATEGORY;
        }
        String lower = name.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, Pattern> entry : LEXICON.entrySet()) {
            if (entry.getValue().matcher(lower).find()) {
                return entry.getKey();
            }
        }
        return MenuItemConstants.DEFAULT_CATEGORY;
    }

    private static Map<String, Pattern> buildLexicon() {
        Map<String, Pattern> lexicon = new LinkedHashMap<>();
        lexicon.put("Beverage", keywords(List.of("tea", "chai", "coffee", "lassi", "juice", "soda", "shake",
            "milkshake", "smoothie", "cola", "coke", "pepsi", "water", "lemonade", "mojito", "beer", "wine")));
        lexicon.put("Dessert", keywords(List.of("dessert", "ice cream", "kulfi", "gulab jamun", "rasmalai", "halwa",
            "kheer", "cake", "brownie", "pastry", "pudding", "sundae")));
        lexicon.put("Bread", keywords(List.of("naan", "roti", "paratha", "kulcha", "chapati", "bread", "bun", "pav")));
        lexicon.put("Starter", keywords(List.of("starter", "soup", "salad", "tikka", "kebab", "kabab", "pakora",
            "samosa", "fries", "wings", "spring roll", "appetizer")));
        lexicon.put("Main Course", keywords(List.of("biryani", "curry", "masala", "dal", "rice", "pulao", "thali",
            "paneer", "korma", "pasta", "pizza", "burger", "noodles", "sandwich", "steak")));
        return lexicon;
    }

    private static Pattern keywords(List<String> words) {
        return Pattern.compile("\\b(?:" + String.join("|", words) + ")s?\\b");
    }
}
