package dev.pekelund.menuscan.items;

import java.util.regex.Pattern;

/**
 * Presentation details of a category, as supplied by a workbook's {@code Categories} sheet.
 *
 * @param description free text shown under the category heading, may be {@code null}
 * @param color       {@code #RRGGBB} colour, {@code null} when absent or not a valid hex colour
 */
public record CategoryDetails(String description, String color) {

    private static final Pattern HEX_COLOR = Pattern.compile("^#[0-9A-Fa-f]{6}$");

    public CategoryDetails {
        description = description == null || description.isBlank() ? null : description.trim();
        color = color == null || !HEX_COLOR.matcher(color.trim()).matches() ? null : color.trim();
    }

    /**
     * Returns {@code null} instead of an instance carrying no information.
     */
    public static CategoryDetails of(String description, String color) {
        CategoryDetails details = new CategoryDetails(description, color);
        return details.description() == null && details.color() == null ? null : details;
    }
}
