package dev.pekelund.menuscan.menuparser.decoding;

import dev.pekelund.menuscan.items.OcrWord;
import java.util.List;

/**
 * Text recognised on one page bitmap.
 *
 * @param text       full recognised text, line breaks preserved
 * @param confidence mean word confidence in the range 0..100
 * @param words      word-level boxes in page pixel coordinates
 */
public record OcrResult(String text, double confidence, List<OcrWord> words) {

    public OcrResult {
        text = text == null ? "" : text;
        words = words == null ? List.of() : List.copyOf(words);
    }
}
