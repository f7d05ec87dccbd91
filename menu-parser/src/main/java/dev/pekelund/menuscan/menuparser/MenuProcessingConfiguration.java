package dev.pekelund.menuscan.menuparser;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.pekelund.menuscan.menuparser.decoding.DisabledOcrEngine;
import dev.pekelund.menuscan.menuparser.decoding.OcrEngine;
import dev.pekelund.menuscan.menuparser.decoding.OcrProperties;
import dev.pekelund.menuscan.menuparser.decoding.TesseractOcrEngine;
import dev.pekelund.menuscan.menuparser.imaging.ImageRegionDetector;
import dev.pekelund.menuscan.menuparser.imaging.SpatialMatcher;
import dev.pekelund.menuscan.menuparser.pipeline.MenuExtractionProperties;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

/**
 * Service configuration for the menu extraction workload.
 */
@Configuration
@EnableConfigurationProperties({MenuExtractionProperties.class, OcrProperties.class})
public class MenuProcessingConfiguration {

    private static final Logger LOGGER = LoggerFactory.getLogger(MenuProcessingConfiguration.class);

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.findAndRegisterModules();
        return mapper;
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService menuDecodeExecutor(MenuExtractionProperties properties) {
        int threads = Math.max(1, properties.getWorkerThreads());
        LOGGER.info("Decoding uploads on {} worker threads with a budget of {}", threads,
            properties.getDecodeTimeout());
        return Executors.newFixedThreadPool(threads, new CustomizableThreadFactory("menu-decode-"));
    }

    @Bean
    public ImageRegionDetector imageRegionDetector(MenuExtractionProperties properties) {
        return new ImageRegionDetector(properties.getRegionCellSize());
    }

    @Bean
    public SpatialMatcher spatialMatcher(MenuExtractionProperties properties) {
        return new SpatialMatcher(properties.getMatchDistance());
    }

    @Bean
    @ConditionalOnProperty(value = "menu.ocr.enabled", havingValue = "true", matchIfMissing = true)
    public OcrEngine tesseractOcrEngine(OcrProperties properties) {
        LOGGER.info("Tesseract OCR enabled (language '{}', datapath '{}')", properties.getLanguage(),
            properties.getDatapath());
        return new TesseractOcrEngine(properties);
    }

    @Bean
    @ConditionalOnProperty(value = "menu.ocr.enabled", havingValue = "false")
    public OcrEngine disabledOcrEngine() {
        LOGGER.info("OCR disabled; image uploads will fail to decode");
        return new DisabledOcrEngine();
    }
}
