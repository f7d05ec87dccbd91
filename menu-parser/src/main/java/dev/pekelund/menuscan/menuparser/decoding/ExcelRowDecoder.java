package dev.pekelund.menuscan.menuparser.decoding;

import dev.pekelund.menuscan.items.CategoryDetails;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.apache.poi.EncryptedDocumentException;
import org.apache.poi.UnsupportedFileFormatException;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reads xls/xlsx price lists. Workbooks exported with a separate {@code Categories} sheet keep their items on
 * a sheet named {@code Items}; otherwise the first sheet is used. Category descriptions and colours from the
 * {@code Categories} sheet are attached to the rows of the matching category.
 */
@Component
public class ExcelRowDecoder implements SpreadsheetRowDecoder {

    private static final Logger LOGGER = LoggerFactory.getLogger(ExcelRowDecoder.class);

    static final String ITEMS_SHEET = "Items";
    static final String CATEGORIES_SHEET = "Categories";

    private static final Set<String> CATEGORY_NAME_HEADERS = Set.of("name", "category", "category name");
    private static final Set<String> CATEGORY_DESCRIPTION_HEADERS = Set.of("description");
    private static final Set<String> CATEGORY_COLOR_HEADERS = Set.of("color", "colour");

    @Override
    public List<MenuRow> parseRows(byte[] content) {
        if (content == null || content.length == 0) {
            throw new MenuDecodingException("Cannot parse an empty spreadsheet");
        }
        try (Workbook workbook = WorkbookFactory.create(new ByteArrayInputStream(content))) {
            if (workbook.getNumberOfSheets() == 0) {
                throw new MenuDecodingException("Spreadsheet does not contain any sheets");
            }
            DataFormatter formatter = new DataFormatter();
            Sheet sheet = selectSheet(workbook);
            List<MenuRow> rows = readSheet(sheet, formatter);
            Sheet categoriesSheet = findSheet(workbook, CATEGORIES_SHEET);
            if (categoriesSheet != null && categoriesSheet != sheet) {
                rows = attachCategoryDetails(rows, readCategories(categoriesSheet, formatter));
            }
            LOGGER.info("Read {} rows from sheet '{}'", rows.size(), sheet.getSheetName());
            return rows;
        } catch (EncryptedDocumentException ex) {
            throw new MenuDecodingException("Password protected spreadsheets are not supported", ex);
        } catch (UnsupportedFileFormatException ex) {
            throw new MenuDecodingException("Unsupported spreadsheet format", ex);
        } catch (IOException ex) {
            throw new MenuDecodingException("Failed to read spreadsheet", ex);
        }
    }

    private Sheet selectSheet(Workbook workbook) {
        Sheet items = findSheet(workbook, ITEMS_SHEET);
        return items != null ? items : workbook.getSheetAt(0);
    }

    private Sheet findSheet(Workbook workbook, String name) {
        for (int index = 0; index < workbook.getNumberOfSheets(); index++) {
            Sheet sheet = workbook.getSheetAt(index);
            if (name.equalsIgnoreCase(sheet.getSheetName().trim())) {
                return sheet;
            }
        }
        return null;
    }

    private List<MenuRow> readSheet(Sheet sheet, DataFormatter formatter) {
        HeaderAliases header = null;
        List<MenuRow> rows = new ArrayList<>();
        for (Row row : sheet) {
            List<String> cells = readCells(row, formatter);
            if (cells.stream().allMatch(String::isBlank)) {
                continue;
            }
            if (header == null) {
                header = HeaderAliases.resolve(cells);
                continue;
            }
            MenuRow menuRow = header.toRow(cells);
            if (menuRow != null) {
                rows.add(menuRow);
            }
        }
        if (header == null) {
            throw new MenuDecodingException("Sheet '" + sheet.getSheetName() + "' is empty");
        }
        return rows;
    }

    /**
     * Category details keyed by lower-cased category name. A sheet without a name column yields nothing.
     */
    private Map<String, CategoryDetails> readCategories(Sheet sheet, DataFormatter formatter) {
        Map<String, CategoryDetails> categories = new HashMap<>();
        int nameColumn = -1;
        int descriptionColumn = -1;
        int colorColumn = -1;
        boolean headerSeen = false;
        for (Row row : sheet) {
            List<String> cells = readCells(row, formatter);
            if (cells.stream().allMatch(String::isBlank)) {
                continue;
            }
            if (!headerSeen) {
                headerSeen = true;
                for (int index = 0; index < cells.size(); index++) {
                    String header = cells.get(index).trim().toLowerCase(Locale.ROOT);
                    if (nameColumn < 0 && CATEGORY_NAME_HEADERS.contains(header)) {
                        nameColumn = index;
                    } else if (descriptionColumn < 0 && CATEGORY_DESCRIPTION_HEADERS.contains(header)) {
                        descriptionColumn = index;
                    } else if (colorColumn < 0 && CATEGORY_COLOR_HEADERS.contains(header)) {
                        colorColumn = index;
                    }
                }
                if (nameColumn < 0) {
                    LOGGER.warn("Sheet '{}' has no category name column; ignoring it", sheet.getSheetName());
                    return categories;
                }
                continue;
            }
            String name = cellAt(cells, nameColumn);
            CategoryDetails details = CategoryDetails.of(cellAt(cells, descriptionColumn), cellAt(cells, colorColumn));
            if (!name.isBlank() && details != null) {
                categories.putIfAbsent(name.trim().toLowerCase(Locale.ROOT), details);
            }
        }
        return categories;
    }

    private List<MenuRow> attachCategoryDetails(List<MenuRow> rows, Map<String, CategoryDetails> categories) {
        if (categories.isEmpty()) {
            return rows;
        }
        List<MenuRow> enriched = new ArrayList<>(rows.size());
        for (MenuRow row : rows) {
            CategoryDetails details = row.category() == null
                ? null
                : categories.get(row.category().toLowerCase(Locale.ROOT));
            enriched.add(details == null ? row : row.withCategoryDetails(details));
        }
        return enriched;
    }

    private List<String> readCells(Row row, DataFormatter formatter) {
        List<String> cells = new ArrayList<>();
        short lastCell = row.getLastCellNum();
        for (int index = 0; index < Math.max(lastCell, 0); index++) {
            Cell cell = row.getCell(index, Row.MissingCellPolicy.RETURN_BLANK_AS_NULL);
            cells.add(cell == null ? "" : cellText(cell, formatter));
        }
        return cells;
    }

    /**
     * Numbers are read as their stored value; display formats such as {@code #,##0} would otherwise add grouping
     * separators that read as decimal commas.
     */
    static String cellText(Cell cell, DataFormatter formatter) {
        CellType type = cell.getCellType() == CellType.FORMULA ? cell.getCachedFormulaResultType() : cell.getCellType();
        if (type == CellType.NUMERIC && !DateUtil.isCellDateFormatted(cell)) {
            return BigDecimal.valueOf(cell.getNumericCellValue()).stripTrailingZeros().toPlainString();
        }
        if (cell.getCellType() == CellType.FORMULA && type == CellType.STRING) {
            return cell.getStringCellValue();
        }
        return formatter.formatCellValue(cell);
    }

    private static String cellAt(List<String> cells, int index) {
        return index >= 0 && index < cells.size() ? cells.get(index) : "";
    }
}
