package dev.pekelund.menuscan.menuparser.pipeline;

import dev.pekelund.menuscan.items.InputKind;
import java.util.Map;
import org.slf4j.MDC;
import org.springframework.util.StringUtils;

/**
 * Utility for populating mapped diagnostic context (MDC) entries so log lines emitted while a menu is
 * extracted share the same identifiers (slot, file, kind, stage).
 */
public final class MenuProcessingMdc {

    static final String KEY_SLOT = "menu.slot";
    static final String KEY_FILE = "menu.file";
    static final String KEY_KIND = "menu.kind";
    static final String KEY_STAGE = "menu.stage";

    private MenuProcessingMdc() {
        // Utility class
    }

    public static Context openSlot(String slot) {
        Context context = new Context(MDC.getCopyOfContextMap());
        putIfHasText(KEY_SLOT, slot);
        return context;
    }

    static Context openRequest(ExtractionRequest request) {
        Context context = new Context(MDC.getCopyOfContextMap());
        putIfHasText(KEY_FILE, request.fileName());
        putIfHasText(KEY_KIND, request.kind().name());
        return context;
    }

    /**
     * Installs a snapshot taken on another thread, for work handed to the decode pool.
     */
    static Context inherit(Map<String, String> snapshot) {
        Context context = new Context(MDC.getCopyOfContextMap());
        if (snapshot != null) {
            MDC.setContextMap(snapshot);
        }
        return context;
    }

    static void setStage(ExtractionState stage) {
        if (stage == null) {
            MDC.remove(KEY_STAGE);
        } else {
            MDC.put(KEY_STAGE, stage.name());
        }
    }

    private static void putIfHasText(String key, String value) {
        if (StringUtils.hasText(value)) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }

    public static final class Context implements AutoCloseable {

        private final Map<String, String> previous;

        private Context(Map<String, String> previous) {
            this.previous = previous;
        }

        @Override
        public void close() {
            if (previous == null) {
                MDC.clear();
            } else {
                MDC.setContextMap(previous);
            }
        }
    }
}
