package xyz.firestige.coordinator.orchestration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * 单次部署尝试的结果，重试循环据此决定继续或结束
 */
public class AttemptResult {
    private boolean success;
    private int attempt;
    private RuntimeException failure;
    private Duration duration;
    private final List<String> deployedServices = new ArrayList<>();

    public static AttemptResult ok(int attempt, Duration duration, List<String> services) {
        AttemptResult r = new AttemptResult();
        r.success = true;
        r.attempt = attempt;
        r.duration = duration;
        if (services != null) r.deployedServices.addAll(services);
        return r;
    }

    public static AttemptResult fail(int attempt, Duration duration, RuntimeException failure, List<String> services) {
        AttemptResult r = new AttemptResult();
        r.success = false;
        r.attempt = attempt;
        r.duration = duration;
        r.failure = failure;
        if (services != null) r.deployedServices.addAll(services);
        return r;
    }

    public boolean isSuccess() { return success; }
    public int getAttempt() { return attempt; }
    public RuntimeException getFailure() { return failure; }
    public String getMessage() { return failure == null ? null : failure.getMessage(); }
    public Duration getDuration() { return duration; }
    public List<String> getDeployedServices() { return deployedServices; }
}
