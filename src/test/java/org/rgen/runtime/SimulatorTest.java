package org.rgen.runtime;

import org.rgen.junit.extensions.logging.AllowLog;
import org.rgen.junit.extensions.logging.ExpectLog;
import org.rgen.junit.extensions.logging.LogLevel;
import org.rgen.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@Tag("unit")
@ExtendWith({MockitoExtension.class, LogWatchExtension.class})
class SimulatorTest {

    @Mock
    private IStepObserver observer;

    private World world;
    private Simulator simulator;

    @BeforeEach
    void setUp() {
        world = TestWorlds.create(TestWorlds.standard());
        simulator = new Simulator(world);
    }

    @Test
    @DisplayName("run performs every step and notifies observers after each")
    void run_completesAllSteps() throws Exception {
        simulator.addObserver(observer);

        RunResult result = simulator.run(15, 4, CancellationToken.none());

        assertThat(result.status()).isEqualTo(RunResult.Status.COMPLETED);
        assertThat(result.stepsCompleted()).isEqualTo(4);
        assertThat(result.minutesSimulated()).isEqualTo(60);
        assertThat(world.getClock().timeString()).isEqualTo("09:00");

        ArgumentCaptor<StepSummary> summaries = ArgumentCaptor.forClass(StepSummary.class);
        verify(observer, times(4)).onStep(eq(world), summaries.capture());
        assertThat(summaries.getAllValues()).extracting(StepSummary::stepNumber).containsExactly(1L, 2L, 3L, 4L);
        assertThat(summaries.getAllValues().get(3).clock().totalMinutes()).isEqualTo(540);

        SimulationStatistics statistics = simulator.getStatistics();
        assertThat(statistics.steps()).isEqualTo(4);
        assertThat(statistics.minutesSimulated()).isEqualTo(60);
        assertThat(statistics.eventsEmitted()).isEqualTo(world.getEventBus().getTotalPublished() - 1);
    }

    @Test
    @DisplayName("A cancelled token stops the run before the next step")
    void run_stopsWhenCancelled() throws Exception {
        CancellationToken token = new CancellationToken();
        simulator.addObserver((w, summary) -> {
            if (summary.stepNumber() == 3) {
                token.cancel();
            }
        });

        RunResult result = simulator.run(10, 10, token);

        assertThat(result.status()).isEqualTo(RunResult.Status.CANCELLED);
        assertThat(result.stepsCompleted()).isEqualTo(3);
        assertThat(world.getTickCount()).isEqualTo(3);
    }

    @Test
    @DisplayName("run rejects invalid arguments")
    void run_rejectsInvalidArguments() {
        assertThatThrownBy(() -> simulator.run(0, 1, CancellationToken.none()))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> simulator.run(10, -1, CancellationToken.none()))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("A failing observer is logged and later observers still run")
    @AllowLog(level = LogLevel.WARN, loggerPattern = ".*Simulator", messagePattern = "Step observer .* failed.*")
    void step_isolatesObserverFailure() throws Exception {
        List<Long> seen = new ArrayList<>();
        doThrow(new IllegalStateException("observer down")).when(observer).onStep(any(), any());
        simulator.addObserver(observer);
        simulator.addObserver((w, summary) -> seen.add(summary.stepNumber()));

        simulator.step(30);
        simulator.step(30);

        assertThat(seen).containsExactly(1L, 2L);
        assertThat(simulator.getStatistics().observerFailures()).isEqualTo(2);
    }

    @Test
    @DisplayName("runUntil stops as soon as the condition holds")
    void runUntil_completesWhenConditionHolds() throws Exception {
        RunResult result = simulator.runUntil(w -> w.getClock().hour() >= 12, 100, 60);

        assertThat(result.status()).isEqualTo(RunResult.Status.COMPLETED);
        assertThat(result.stepsCompleted()).isEqualTo(4);
    }

    @Test
    @DisplayName("runUntil reports the step limit when the condition never holds")
    @ExpectLog(level = LogLevel.WARN, loggerPattern = ".*Simulator", messagePattern = "Stop condition not met after 5 steps")
    void runUntil_reportsLimit() throws Exception {
        RunResult result = simulator.runUntil(w -> false, 5, 10);

        assertThat(result.status()).isEqualTo(RunResult.Status.LIMIT_REACHED);
        assertThat(result.stepsCompleted()).isEqualTo(5);
    }

    @Test
    @DisplayName("simulateHours covers a trailing partial step")
    void simulateHours_coversPartialStep() throws Exception {
        RunResult result = simulator.simulateHours(1, 25);

        assertThat(result.steps()).extracting(StepSummary::minutes).containsExactly(25L, 25L, 10L);
        assertThat(world.getClock().totalMinutes()).isEqualTo(540);
    }

    @Test
    @DisplayName("simulateDays advances whole days")
    void simulateDays_advancesDays() throws Exception {
        simulator.simulateDays(2, 120);

        assertThat(world.getClock().dayOfYear()).isEqualTo(3);
        assertThat(world.getClock().timeString()).isEqualTo("08:00");
        assertThat(simulator.getStatistics().steps()).isEqualTo(24);
    }

    @Test
    @DisplayName("A removed observer is no longer notified")
    void removeObserver_stopsNotifications() throws Exception {
        simulator.addObserver(observer);
        assertThat(simulator.removeObserver(observer)).isTrue();

        simulator.step(5);

        verify(observer, times(0)).onStep(any(), any());
    }
}
