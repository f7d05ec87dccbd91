package dev.pekelund.menuscan.menuparser.decoding;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "menu.ocr")
public class OcrProperties {

    /**
     * Flag indicating whether image uploads are sent through Tesseract.
     */
    private boolean enabled = true;

    /**
     * Directory holding the Tesseract {@code tessdata} files. The tess4j default is used when omitted.
     */
    private String datapath;

    /**
     * Tesseract language code(s), for example {@code eng} or {@code eng+hin}.
     */
    private String language = "eng";

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getDatapath() {
        return datapath;
    }

    public void setDatapath(String datapath) {
        this.datapath = datapath;
    }

    public String getLanguage() {
        return language;
    }

    public void setLanguage(String language) {
        this.language = language;
    }
}
