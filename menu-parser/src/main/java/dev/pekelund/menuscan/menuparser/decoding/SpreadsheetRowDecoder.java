package dev.pekelund.menuscan.menuparser.decoding;

import java.util.List;

public interface SpreadsheetRowDecoder {

    /**
     * Parses a headed table into rows. Rows without a name or a price cell are skipped.
     *
     * @throws MenuDecodingException when the payload cannot be read or lacks a name or price header
     */
    List<MenuRow> parseRows(byte[] content);
}
