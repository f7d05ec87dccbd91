package dev.pekelund.menuscan.menuparser.pipeline;

import dev.pekelund.menuscan.items.InputKind;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * One uploaded menu to extract.
 *
 * @param kind            decoder to use
 * @param content         raw upload bytes
 * @param fileName        original file name, used for logging only
 * @param confidenceFloor items below this confidence are flagged; {@code null} uses the configured default
 */
public record ExtractionRequest(InputKind kind, byte[] content, String fileName, Integer confidenceFloor) {

    public ExtractionRequest {
        Objects.requireNonNull(kind, "kind");
        content = content == null ? new byte[0] : content;
        if (confidenceFloor != null && (confidenceFloor < 0 || confidenceFloor > 100)) {
            throw new IllegalArgumentException("Confidence floor must be within 0..100 but was " + confidenceFloor);
        }
    }

    public static ExtractionRequest ofText(String text, Integer confidenceFloor) {
        byte[] bytes = text == null ? new byte[0] : text.getBytes(StandardCharsets.UTF_8);
        return new ExtractionRequest(InputKind.TEXT, bytes, "pasted-text", confidenceFloor);
    }
}
