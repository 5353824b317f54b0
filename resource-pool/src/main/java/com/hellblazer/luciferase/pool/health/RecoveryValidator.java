package com.hellblazer.luciferase.pool.health;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Decides whether a proposed health transition is admissible.
 *
 * <p>Built-in rules, keyed on the (from, to) pair:
 * <ul>
 *   <li>healthy to unhealthy and unhealthy to healthy are never allowed;</li>
 *   <li>healthy to degraded needs a warning bound crossed;</li>
 *   <li>degraded to unhealthy needs a critical bound crossed and a degraded preceding sample;</li>
 *   <li>unhealthy to degraded needs sustained improvement or an explicit reset;</li>
 *   <li>degraded to healthy needs every metric inside its recovery bound, plus improved performance or a
 *       steady-or-better error rate versus the previous sample, plus the validation window success rate;</li>
 *   <li>moves toward healthy respect the cooldown since the last accepted transition.</li>
 * </ul>
 * User guards are checked in addition to these. Guards only run for status changes.
 */
public class RecoveryValidator {
    private static final Logger log = LoggerFactory.getLogger(RecoveryValidator.class);

    /**
     * Outcome of validating one proposed transition.
     */
    public record ValidationResult(boolean accepted, List<String> failedReasons) {

        public ValidationResult {
            failedReasons = List.copyOf(failedReasons);
        }
    }

    private final ThresholdConfig thresholds;
    private final RecoveryConfig recovery;
    private final StateHistory history;
    private final List<GuardCondition> builtInGuards;
    private final List<GuardCondition> userGuards = new CopyOnWriteArrayList<>();

    public RecoveryValidator(ThresholdConfig thresholds, RecoveryConfig recovery, StateHistory history) {
        this.thresholds = Objects.requireNonNull(thresholds, "thresholds");
        this.recovery = Objects.requireNonNull(recovery, "recovery");
        this.history = Objects.requireNonNull(history, "history");
        if (history.getCapacity() < recovery.requiredHistoryDepth()) {
            throw new IllegalArgumentException(
                "History capacity " + history.getCapacity() + " is below required depth " + recovery.requiredHistoryDepth());
        }
        this.builtInGuards = List.of(
            GuardCondition.of("Direct transitions between healthy and unhealthy are forbidden", this::noDirectJump),
            GuardCondition.of("No metric crosses its warning threshold", this::degradationWarranted),
            GuardCondition.of("No critical threshold crossed after a degraded sample", this::criticalProgression),
            GuardCondition.of("Improvement is not sustained", this::sustainedImprovement),
            GuardCondition.of("Recovery thresholds not met or no improvement over the previous sample",
                              this::recoveryToHealthy),
            GuardCondition.of("Recovery cooldown has not elapsed", this::cooldownElapsed),
            GuardCondition.of("Validation window success rate below requirement", this::validationWindow)
        );
    }

    public void addGuardCondition(GuardCondition condition) {
        userGuards.add(Objects.requireNonNull(condition, "condition"));
    }

    public List<GuardCondition> getGuardConditions() {
        var all = new ArrayList<>(builtInGuards);
        all.addAll(userGuards);
        return all;
    }

    /**
     * Run every guard. Does not mutate anything.
     */
    public ValidationResult validate(HealthState from, HealthState to) {
        if (from.status() == to.status()) {
            return new ValidationResult(true, List.of());
        }
        var failed = new ArrayList<String>();
        for (var guard : getGuardConditions()) {
            boolean passed;
            try {
                passed = guard.evaluate(from, to);
            } catch (RuntimeException e) {
                log.error("Guard '{}' failed while evaluating {} -> {}", guard.reason(), from.status(), to.status(), e);
                passed = false;
            }
            if (!passed) {
                failed.add(guard.reason());
            }
        }
        if (!failed.isEmpty()) {
            log.debug("Rejected {} -> {} with metrics {}: {}", from.status(), to.status(), to.metrics(), failed);
        }
        return new ValidationResult(failed.isEmpty(), failed);
    }

    public int getRequiredSamples() {
        return recovery.minHealthySamples();
    }

    public int getValidationWindow() {
        return recovery.validationWindow();
    }

    private boolean noDirectJump(HealthState from, HealthState to) {
        return from.status().distance(to.status()) <= 1;
    }

    private boolean degradationWarranted(HealthState from, HealthState to) {
        if (from.status() != HealthStatus.HEALTHY || to.status() != HealthStatus.DEGRADED) {
            return true;
        }
        return anyCrossing(to.metrics(), false);
    }

    private boolean criticalProgression(HealthState from, HealthState to) {
        if (from.status() != HealthStatus.DEGRADED || to.status() != HealthStatus.UNHEALTHY) {
            return true;
        }
        var previous = history.lastSample().map(HealthState::status).orElse(from.status());
        return previous == HealthStatus.DEGRADED && anyCrossing(to.metrics(), true);
    }

    private boolean sustainedImprovement(HealthState from, HealthState to) {
        if (from.status() != HealthStatus.UNHEALTHY || to.status() != HealthStatus.DEGRADED) {
            return true;
        }
        if (to.source() == HealthState.Source.RESET) {
            return true;
        }
        int k = recovery.minHealthySamples();
        var window = new ArrayList<>(history.getRecentSamples(k));
        if (window.size() < k) {
            return false;
        }
        window.add(to);
        // window holds k predecessors plus the proposal: k steps, each ending in a non-critical sample
        for (int i = 1; i < window.size(); i++) {
            var earlier = window.get(i - 1).metrics();
            var later = window.get(i).metrics();
            if (anyCrossing(later, true) || !noWorse(later, earlier)) {
                return false;
            }
        }
        return true;
    }

    private boolean recoveryToHealthy(HealthState from, HealthState to) {
        if (from.status() != HealthStatus.DEGRADED || to.status() != HealthStatus.HEALTHY) {
            return true;
        }
        var metrics = to.metrics();
        if (metrics.isEmpty() || !withinRecovery(metrics)) {
            return false;
        }
        var previous = history.lastSample();
        if (previous.isEmpty()) {
            return false;
        }
        var prior = previous.get().metrics();
        return performanceImproved(metrics, prior) || errorRateSteady(metrics, prior);
    }

    private boolean cooldownElapsed(HealthState from, HealthState to) {
        if (!to.status().isBetterThan(from.status()) || to.source() == HealthState.Source.RESET) {
            return true;
        }
        long cooldown = recovery.cooldownPeriod().toMillis();
        if (cooldown <= 0) {
            return true;
        }
        return history.lastTransition().map(t -> to.timestamp() - t.timestamp() >= cooldown).orElse(true);
    }

    private boolean validationWindow(HealthState from, HealthState to) {
        if (from.status() != HealthStatus.DEGRADED || to.status() != HealthStatus.HEALTHY) {
            return true;
        }
        var window = new ArrayList<>(history.getRecentSamples(recovery.validationWindow() - 1));
        window.add(to);
        long inside = window.stream().filter(s -> withinRecovery(s.metrics())).count();
        return (double) inside / window.size() >= recovery.requiredSuccessRate();
    }

    boolean anyCrossing(HealthMetrics metrics, boolean critical) {
        for (var metric : metrics.present()) {
            var bands = thresholds.forMetric(metric);
            double value = metrics.get(metric).getAsDouble();
            if (critical ? bands.isCritical(value) : bands.isWarning(value)) {
                return true;
            }
        }
        return false;
    }

    boolean withinRecovery(HealthMetrics metrics) {
        for (var metric : metrics.present()) {
            if (!thresholds.forMetric(metric).isWithinRecovery(metrics.get(metric).getAsDouble())) {
                return false;
            }
        }
        return true;
    }

    private boolean noWorse(HealthMetrics later, HealthMetrics earlier) {
        for (var metric : later.present()) {
            if (!earlier.has(metric)) {
                continue;
            }
            var polarity = thresholds.forMetric(metric).polarity();
            if (!polarity.isNoWorse(later.get(metric).getAsDouble(), earlier.get(metric).getAsDouble())) {
                return false;
            }
        }
        return true;
    }

    private static boolean performanceImproved(HealthMetrics current, HealthMetrics previous) {
        var rt = current.responseTime();
        var tp = current.throughput();
        var prevRt = previous.responseTime();
        var prevTp = previous.throughput();
        if (rt.isEmpty() || tp.isEmpty() || prevRt.isEmpty() || prevTp.isEmpty()) {
            return false;
        }
        return rt.getAsDouble() < prevRt.getAsDouble() && tp.getAsDouble() > prevTp.getAsDouble();
    }

    private static boolean errorRateSteady(HealthMetrics current, HealthMetrics previous) {
        var er = current.errorRate();
        var prevEr = previous.errorRate();
        if (er.isEmpty() && prevEr.isEmpty()) {
            return true;
        }
        if (er.isEmpty() || prevEr.isEmpty()) {
            return false;
        }
        return er.getAsDouble() <= prevEr.getAsDouble();
    }
}
