package dev.pekelund.menuscan.menuparser.decoding;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reads CSV and TSV price lists. The column separator is sniffed from the header line.
 */
@Component
public class DelimitedRowDecoder implements SpreadsheetRowDecoder {

    private static final Logger LOGGER = LoggerFactory.getLogger(DelimitedRowDecoder.class);

    private static final char[] SEPARATORS = {',', ';', '\t'};

    private final CsvMapper csvMapper;

    public DelimitedRowDecoder() {
        this.csvMapper = new CsvMapper();
        this.csvMapper.enable(CsvParser.Feature.WRAP_AS_ARRAY);
        this.csvMapper.enable(CsvParser.Feature.SKIP_EMPTY_LINES);
        this.csvMapper.enable(CsvParser.Feature.TRIM_SPACES);
    }

    @Override
    public List<MenuRow> parseRows(byte[] content) {
        if (content == null || content.length == 0) {
            throw new MenuDecodingException("Cannot parse an empty delimited file");
        }
        String text = new String(content, StandardCharsets.UTF_8);
        if (text.startsWith("\uFEFF")) {
            text = text.substring(1);
        }
        char separator = sniffSeparator(text);
        CsvSchema schema = CsvSchema.emptySchema().withColumnSeparator(separator);

        HeaderAliases header = null;
        List<MenuRow> rows = new ArrayList<>();
        try (MappingIterator<String[]> iterator = csvMapper.readerFor(String[].class).with(schema).readValues(text)) {
            while (iterator.hasNextValue()) {
                List<String> cells = Arrays.asList(iterator.nextValue());
                if (cells.stream().allMatch(cell -> cell == null || cell.isBlank())) {
                    continue;
                }
                if (header == null) {
                    header = HeaderAliases.resolve(cells);
                    continue;
                }
                MenuRow row = header.toRow(cells);
                if (row != null) {
                    rows.add(row);
                }
            }
        } catch (IOException ex) {
            throw new MenuDecodingException("Failed to read delimited file", ex);
        }
        if (header == null) {
            throw new MenuDecodingException("Delimited file does not contain a header row");
        }
        LOGGER.info("Read {} rows from delimited file (separator '{}')", rows.size(),
            separator == '\t' ? "\\t" : String.valueOf(separator));
        return rows;
    }

    static char sniffSeparator(String text) {
        int end = text.indexOf('\n');
        String headerLine = end < 0 ? text : text.substring(0, end);
        char best = SEPARATORS[0];
        long bestCount = 0;
        for (char candidate : SEPARATORS) {
            long count = headerLine.chars().filter(ch -> ch == candidate).count();
            if (count > bestCount) {
                best = candidate;
                bestCount = count;
            }
        }
        return best;
    }
}
