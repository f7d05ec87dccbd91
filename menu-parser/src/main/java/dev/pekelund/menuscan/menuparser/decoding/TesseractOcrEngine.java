package dev.pekelund.menuscan.menuparser.decoding;

import dev.pekelund.menuscan.items.BoundingBox;
import dev.pekelund.menuscan.items.OcrWord;
import java.awt.Rectangle;
import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;
import net.sourceforge.tess4j.ITessAPI;
import net.sourceforge.tess4j.ITesseract;
import net.sourceforge.tess4j.Tesseract;
import net.sourceforge.tess4j.Word;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * OCR backed by a local Tesseract installation through tess4j. A fresh {@link ITesseract} is obtained per
 * call because Tesseract handles are not safe to share between threads.
 */
public class TesseractOcrEngine implements OcrEngine {

    private static final Logger LOGGER = LoggerFactory.getLogger(TesseractOcrEngine.class);

    private final Supplier<ITesseract> tesseractFactory;

    public TesseractOcrEngine(OcrProperties properties) {
        this(() -> {
            Tesseract tesseract = new Tesseract();
            if (StringUtils.hasText(properties.getDatapath())) {
                tesseract.setDatapath(properties.getDatapath());
            }
            tesseract.setLanguage(properties.getLanguage());
            return tesseract;
        });
    }

    public TesseractOcrEngine(Supplier<ITesseract> tesseractFactory) {
        this.tesseractFactory = tesseractFactory;
    }

    @Override
    public OcrResult recognize(BufferedImage image) {
        if (image == null) {
            throw new MenuDecodingException("Cannot run OCR on a missing image");
        }
        ITesseract tesseract = tesseractFactory.get();
        List<Word> recognised;
        try {
            recognised = tesseract.getWords(image, ITessAPI.TessPageIteratorLevel.RIL_WORD);
        } catch (LinkageError ex) {
            throw new MenuDecodingException("Tesseract is not available: " + ex.getMessage(), ex);
        } catch (RuntimeException ex) {
            throw new MenuDecodingException("Tesseract failed to recognise the image: " + ex.getMessage(), ex);
        }

        List<OcrWord> words = new ArrayList<>();
        double confidenceSum = 0;
        if (recognised != null) {
            for (Word word : recognised) {
                if (!StringUtils.hasText(word.getText())) {
                    continue;
                }
                Rectangle box = word.getBoundingBox();
                words.add(new OcrWord(word.getText().trim(),
                    BoundingBox.of(box.x, box.y, box.width, box.height), word.getConfidence()));
                confidenceSum += word.getConfidence();
            }
        }
        String text = joinLines(words);
        double confidence = words.isEmpty() ? 0 : confidenceSum / words.size();
        LOGGER.info("Tesseract recognised {} words ({} characters) with mean confidence {}", words.size(),
            text.length(), Math.round(confidence));
        return new OcrResult(text, confidence, words);
    }

    /**
     * Rebuilds page text from words in Tesseract's reading order. A word starts a new line when it sits left
     * of its predecessor or its vertical centre falls outside the predecessor's box.
     */
    static String joinLines(List<OcrWord> words) {
        StringBuilder text = new StringBuilder();
        BoundingBox previous = null;
        for (OcrWord word : words) {
            BoundingBox box = word.bbox();
            if (previous != null) {
                boolean sameLine = box.x0() >= previous.x0()
                    && box.centerY() >= previous.y0() && box.centerY() <= previous.y1();
                text.append(sameLine ? ' ' : '\n');
            }
            text.append(word.text());
            previous = box;
        }
        if (text.length() > 0) {
            text.append('\n');
        }
        return text.toString();
    }
}
