package dev.pekelund.menuscan.menuparser.pipeline;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BooleanSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Serialises uploads per slot with last-request-wins semantics. Submitting to a slot bumps its generation,
 * which cancels any run still in flight for that slot; an overtaken run reports
 * {@link ExtractionFailure#SUPERSEDED} and never replaces the slot's latest result.
 * <p>
 * Generation counters live only while a run is in flight for the slot. Published results are kept for
 * {@code menu.extraction.result-retention} and at most {@code menu.extraction.max-retained-slots} slots.
 */
@Service
public class ExtractionCoordinator {

    private static final Logger LOGGER = LoggerFactory.getLogger(ExtractionCoordinator.class);

    private final ExtractionOrchestrator orchestrator;
    private final ConcurrentMap<String, SlotGeneration> generations = new ConcurrentHashMap<>();
    private final Cache<String, MenuExtractionResult> latestResults;

    @Autowired
    public ExtractionCoordinator(ExtractionOrchestrator orchestrator, MenuExtractionProperties properties) {
        this(orchestrator, properties, Ticker.systemTicker());
    }

    ExtractionCoordinator(ExtractionOrchestrator orchestrator, MenuExtractionProperties properties, Ticker ticker) {
        this.orchestrator = orchestrator;
        this.latestResults = Caffeine.newBuilder()
            .expireAfterWrite(properties.getResultRetention())
            .maximumSize(properties.getMaxRetainedSlots())
            .ticker(ticker)
            .build();
    }

    public MenuExtractionResult submit(String slot, ExtractionRequest request) {
        if (!StringUtils.hasText(slot)) {
            return orchestrator.extract(request);
        }
        long[] issued = new long[1];
        SlotGeneration generation = generations.compute(slot, (key, existing) -> {
            SlotGeneration state = existing != null ? existing : new SlotGeneration();
            state.inFlight++;
            issued[0] = state.current.incrementAndGet();
            return state;
        });
        long ticket = issued[0];
        BooleanSupplier superseded = () -> generation.current.get() != ticket;

        try (MenuProcessingMdc.Context ignored = MenuProcessingMdc.openSlot(slot)) {
            LOGGER.info("Accepted upload '{}' as generation {} of slot '{}'", request.fileName(), ticket, slot);
            MenuExtractionResult result = orchestrator.extract(request, superseded);
            if (superseded.getAsBoolean()) {
                LOGGER.info("Generation {} of slot '{}' was overtaken by generation {}", ticket, slot,
                    generation.current.get());
                return MenuExtractionResult.superseded();
            }
            latestResults.asMap().compute(slot,
                (key, previous) -> generation.current.get() == ticket ? result : previous);
            return result;
        } finally {
            release(slot);
        }
    }

    /**
     * Most recent result published for a slot, if any run for it has completed without being overtaken
     * and the result has not expired.
     */
    public Optional<MenuExtractionResult> latestResult(String slot) {
        if (!StringUtils.hasText(slot)) {
            return Optional.empty();
        }
        return Optional.ofNullable(latestResults.getIfPresent(slot));
    }

    int trackedSlots() {
        return generations.size();
    }

    private void release(String slot) {
        generations.computeIfPresent(slot, (key, state) -> --state.inFlight == 0 ? null : state);
    }

    // Mutated only inside ConcurrentHashMap compute calls for its slot.
    private static final class SlotGeneration {

        private final AtomicLong current = new AtomicLong();
        private int inFlight;
    }
}
