package dev.pekelund.menuscan.items;

import java.util.Locale;
import java.util.Optional;

/**
 * Declared kind of an uploaded menu, used to select the decoder.
 */
public enum InputKind {
    IMAGE,
    PDF,
    SPREADSHEET,
    DELIMITED_TEXT,
    TEXT;

    /**
     * Resolves the kind of an upload from an explicit value, falling back to the content type and
     * finally the file extension.
     */
    public static Optional<InputKind> resolve(String declared, String contentType, String fileName) {
        if (declared != null && !declared.isBlank()) {
            String normalised = declared.trim().toUpperCase(Locale.US).replace('-', '_');
            for (InputKind kind : values()) {
                if (kind.name().equals(normalised)) {
                    return Optional.of(kind);
                }
            }
            return Optional.empty();
        }
        Optional<InputKind> fromContentType = fromContentType(contentType);
        if (fromContentType.isPresent()) {
            return fromContentType;
        }
        return fromFileName(fileName);
    }

    private static Optional<InputKind> fromContentType(String contentType) {
        if (contentType == null || contentType.isBlank()) {
            return Optional.empty();
        }
        String normalised = contentType.toLowerCase(Locale.US);
        if (normalised.startsWith("image/")) {
            return Optional.of(IMAGE);
        }
        if (normalised.startsWith("application/pdf")) {
            return Optional.of(PDF);
        }
        if (normalised.contains("spreadsheetml") || normalised.startsWith("application/vnd.ms-excel")) {
            return Optional.of(SPREADSHEET);
        }
        if (normalised.startsWith("text/csv") || normalised.startsWith("text/tab-separated-values")) {
            return Optional.of(DELIMITED_TEXT);
        }
        if (normalised.startsWith("text/plain")) {
            return Optional.of(TEXT);
        }
        return Optional.empty();
    }

    private static Optional<InputKind> fromFileName(String fileName) {
        if (fileName == null) {
            return Optional.empty();
        }
        String name = fileName.toLowerCase(Locale.US);
        if (name.endsWith(".png") || name.endsWith(".jpg") || name.endsWith(".jpeg") || name.endsWith(".bmp")
            || name.endsWith(".gif")) {
            return Optional.of(IMAGE);
        }
        if (name.endsWith(".pdf")) {
            return Optional.of(PDF);
        }
        if (name.endsWith(".xlsx") || name.endsWith(".xls")) {
            return Optional.of(SPREADSHEET);
        }
        if (name.endsWith(".csv") || name.endsWith(".tsv")) {
            return Optional.of(DELIMITED_TEXT);
        }
        if (name.endsWith(".txt")) {
            return Optional.of(TEXT);
        }
        return Optional.empty();
    }
}
