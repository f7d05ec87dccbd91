package dev.pekelund.menuscan.menuparser.decoding;

import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Maps the header row of a tabular import onto the columns the importer understands.
 */
final class HeaderAliases {

    enum Column {
        NAME(Set.of("name", "item", "item name", "item_name", "itemname", "product")),
        PRICE(Set.of("price", "rate", "amount")),
        CATEGORY(Set.of("category")),
        DESCRIPTION(Set.of("description"));

        private final Set<String> aliases;

        Column(Set<String> aliases) {
            this.aliases = aliases;
        }
    }

    private final Map<Column, Integer> positions;

    private HeaderAliases(Map<Column, Integer> positions) {
        this.positions = positions;
    }

    static HeaderAliases resolve(List<String> headers) {
        Map<Column, Integer> positions = new EnumMap<>(Column.class);
        for (int index = 0; index < headers.size(); index++) {
            String header = normalise(headers.get(index));
            for (Column column : Column.values()) {
                if (column.aliases.contains(header)) {
                    positions.putIfAbsent(column, index);
                }
            }
        }
        if (!positions.containsKey(Column.NAME) || !positions.containsKey(Column.PRICE)) {
            throw new MenuDecodingException("Header row must contain a name and a price column but was " + headers);
        }
        return new HeaderAliases(positions);
    }

    MenuRow toRow(List<String> cells) {
        String name = cell(cells, Column.NAME);
        String price = cell(cells, Column.PRICE);
        if (name == null || price == null) {
            return null;
        }
        return new MenuRow(name, price, cell(cells, Column.CATEGORY), cell(cells, Column.DESCRIPTION));
    }

    private String cell(List<String> cells, Column column) {
        Integer index = positions.get(column);
        if (index == null || index >= cells.size()) {
            return null;
        }
        String value = cells.get(index);
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }

    private static String normalise(String header) {
        if (header == null) {
            return "";
        }
        return header.replace("\uFEFF", "").trim().toLowerCase(Locale.ROOT);
    }
}
