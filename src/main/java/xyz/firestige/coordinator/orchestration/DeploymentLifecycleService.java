package xyz.firestige.coordinator.orchestration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.coordinator.domain.deployment.DeploymentStatus;
import xyz.firestige.coordinator.domain.shared.exception.DeploymentException;
import xyz.firestige.coordinator.domain.shared.exception.RollbackException;

/**
 * 部署生命周期服务
 * <p>
 * 执行部署；失败且 deployment.rollback_on_failure=true、rollback.enabled=true 时显式发起回滚。
 * 回滚失败不会覆盖原始部署异常，而是作为 suppressed 附加。
 */
public class DeploymentLifecycleService {

    private static final Logger log = LoggerFactory.getLogger(DeploymentLifecycleService.class);

    private final DeploymentOrchestratorFactory orchestratorFactory;

    public DeploymentLifecycleService(DeploymentOrchestratorFactory orchestratorFactory) {
        this.orchestratorFactory = orchestratorFactory;
    }

    /**
     * @return 部署成功时的报告
     * @throws DeploymentException 部署失败（无论是否回滚成功）
     */
    public DeploymentReport run() {
        DeploymentOrchestrator orchestrator = orchestratorFactory.create();
        try {
            orchestrator.deploy();
            return report(orchestrator, false, null);
        } catch (DeploymentException e) {
            if (!shouldRollback(orchestrator)) {
                throw e;
            }
            try {
                orchestrator.executeRollback();
                log.warn("部署失败，已回滚: deploymentId={}", orchestrator.getDeploymentId());
            } catch (RollbackException re) {
                log.error("部署失败且回滚失败: deploymentId={}, reason={}",
                        orchestrator.getDeploymentId(), re.getMessage());
                e.addSuppressed(re);
            }
            throw e;
        }
    }

    /**
     * 与 {@link #run()} 相同，但失败时返回报告而非抛出；部署配置无效时返回 id 为 null 的 failed 报告
     */
    public DeploymentReport runQuietly() {
        DeploymentOrchestrator orchestrator;
        try {
            orchestrator = orchestratorFactory.create();
        } catch (DeploymentException e) {
            log.error("部署配置无效，未开始部署: {}", e.getMessage());
            return new DeploymentReport(null, DeploymentStatus.FAILED, 0, false, e.getMessage());
        }
        try {
            orchestrator.deploy();
            return report(orchestrator, false, null);
        } catch (DeploymentException e) {
            boolean rolledBack = false;
            if (shouldRollback(orchestrator)) {
                try {
                    rolledBack = orchestrator.executeRollback();
                } catch (RollbackException re) {
                    log.error("回滚失败: deploymentId={}, reason={}", orchestrator.getDeploymentId(), re.getMessage());
                }
            }
            return report(orchestrator, rolledBack, e.getMessage());
        }
    }

    private boolean shouldRollback(DeploymentOrchestrator orchestrator) {
        return orchestrator.getSettings().isRollbackOnFailure()
                && orchestrator.getSettings().isRollbackEnabled()
                && orchestrator.getDeploymentId() != null;
    }

    private DeploymentReport report(DeploymentOrchestrator orchestrator, boolean rolledBack, String failure) {
        return new DeploymentReport(orchestrator.getDeploymentId(), orchestrator.getStatus(),
                orchestrator.getCurrentAttempt(), rolledBack, failure);
    }
}
