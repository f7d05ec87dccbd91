package dev.pekelund.menuscan.menuparser.decoding;

import dev.pekelund.menuscan.items.CategoryDetails;

/**
 * One data row of a tabular menu import, with cells already mapped through the header aliases.
 * The price is kept as the raw cell text.
 */
public record MenuRow(String name, String price, String category, String description,
    CategoryDetails categoryDetails) {

    public MenuRow(String name, String price, String category, String description) {
        this(name, price, category, description, null);
    }

    MenuRow withCategoryDetails(CategoryDetails details) {
        return new MenuRow(name, price, category, description, details);
    }
}
