package dev.pekelund.menuscan.menuparser.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

import dev.pekelund.menuscan.items.ParsedItem;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BooleanSupplier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ExtractionCoordinatorTest {

    @Mock
    private ExtractionOrchestrator orchestrator;

    private ExtractionCoordinator coordinator;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        coordinator = new ExtractionCoordinator(orchestrator, new MenuExtractionProperties());
        executor = Executors.newSingleThreadExecutor();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void runsWithoutSlotDirectly() {
        ExtractionRequest request = ExtractionRequest.ofText("Paneer Tikka 250", null);
        MenuExtractionResult done = doneWith("Paneer Tikka");
        when(orchestrator.extract(request)).thenReturn(done);

        assertThat(coordinator.submit(null, request)).isSameAs(done);
        assertThat(coordinator.latestResult(null)).isEmpty();
    }

    @Test
    void publishesLatestResultPerSlot() {
        ExtractionRequest request = ExtractionRequest.ofText("Paneer Tikka 250", null);
        MenuExtractionResult done = doneWith("Paneer Tikka");
        when(orchestrator.extract(eq(request), any(BooleanSupplier.class))).thenReturn(done);

        assertThat(coordinator.submit("counter-1", request)).isSameAs(done);
        assertThat(coordinator.latestResult("counter-1")).containsSame(done);
        assertThat(coordinator.latestResult("counter-2")).isEmpty();
    }

    @Test
    void newerUploadSupersedesRunInFlight() throws Exception {
        ExtractionRequest first = ExtractionRequest.ofText("Old Menu 10", null);
        ExtractionRequest second = ExtractionRequest.ofText("New Menu 20", null);
        MenuExtractionResult staleResult = doneWith("Old Menu");
        MenuExtractionResult freshResult = doneWith("New Menu");
        CountDownLatch firstStarted = new CountDownLatch(1);
        CountDownLatch secondFinished = new CountDownLatch(1);
        BooleanSupplier[] firstSuperseded = new BooleanSupplier[1];

        when(orchestrator.extract(eq(first), any(BooleanSupplier.class))).thenAnswer(invocation -> {
            firstSuperseded[0] = invocation.getArgument(1);
            firstStarted.countDown();
            secondFinished.await(5, TimeUnit.SECONDS);
            return staleResult;
        });
        when(orchestrator.extract(eq(second), any(BooleanSupplier.class))).thenReturn(freshResult);

        Future<MenuExtractionResult> inFlight = executor.submit(() -> coordinator.submit("counter-1", first));
        assertThat(firstStarted.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(firstSuperseded[0].getAsBoolean()).isFalse();

        MenuExtractionResult latest = coordinator.submit("counter-1", second);
        assertThat(firstSuperseded[0].getAsBoolean()).isTrue();
        secondFinished.countDown();

        MenuExtractionResult overtaken = inFlight.get(5, TimeUnit.SECONDS);
        assertThat(latest).isSameAs(freshResult);
        assertThat(overtaken.state()).isEqualTo(ExtractionState.FAILED);
        assertThat(overtaken.failure()).isEqualTo(ExtractionFailure.SUPERSEDED);
        assertThat(coordinator.latestResult("counter-1")).containsSame(freshResult);
        assertThat(coordinator.trackedSlots()).isZero();
    }

    @Test
    void releasesSlotGenerationOnceNoRunIsInFlight() {
        ExtractionRequest request = ExtractionRequest.ofText("Paneer Tikka 250", null);
        MenuExtractionResult done = doneWith("Paneer Tikka");
        when(orchestrator.extract(eq(request), any(BooleanSupplier.class))).thenReturn(done);

        for (int i = 0; i < 50; i++) {
            coordinator.submit("kiosk-" + i, request);
        }

        assertThat(coordinator.trackedSlots()).isZero();
        assertThat(coordinator.latestResult("kiosk-49")).containsSame(done);
    }

    @Test
    void releasesSlotGenerationWhenExtractionThrows() {
        ExtractionRequest request = ExtractionRequest.ofText("Paneer Tikka 250", null);
        when(orchestrator.extract(eq(request), any(BooleanSupplier.class)))
            .thenThrow(new IllegalStateException("boom"));

        assertThatThrownBy(() -> coordinator.submit("counter-1", request))
            .isInstanceOf(IllegalStateException.class);
        assertThat(coordinator.trackedSlots()).isZero();
        assertThat(coordinator.latestResult("counter-1")).isEmpty();
    }

    @Test
    void forgetsLatestResultAfterRetention() {
        AtomicLong nanos = new AtomicLong();
        MenuExtractionProperties properties = new MenuExtractionProperties();
        properties.setResultRetention(Duration.ofMinutes(5));
        ExtractionCoordinator expiring = new ExtractionCoordinator(orchestrator, properties, nanos::get);
        ExtractionRequest request = ExtractionRequest.ofText("Paneer Tikka 250", null);
        MenuExtractionResult done = doneWith("Paneer Tikka");
        when(orchestrator.extract(eq(request), any(BooleanSupplier.class))).thenReturn(done);

        expiring.submit("counter-1", request);
        nanos.addAndGet(Duration.ofMinutes(4).toNanos());
        assertThat(expiring.latestResult("counter-1")).containsSame(done);

        nanos.addAndGet(Duration.ofMinutes(2).toNanos());
        assertThat(expiring.latestResult("counter-1")).isEmpty();
    }

    private static MenuExtractionResult doneWith(String name) {
        ParsedItem item = ParsedItem.of(name, new BigDecimal("10"), "$", "General", 85).withId("1");
        return MenuExtractionResult.done(List.of(item), name, List.of());
    }
}
