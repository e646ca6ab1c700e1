package xyz.firestige.coordinator.orchestration;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 单次尝试内的服务部署进度，由部署线程写、监控线程读
 */
public class DeploymentProgress {

    private final int totalServices;
    private final List<String> deployed = Collections.synchronizedList(new ArrayList<>());
    private volatile String currentService;

    public DeploymentProgress(int totalServices) {
        this.totalServices = totalServices;
    }

    void markStarted(String serviceName) {
        currentService = serviceName;
    }

    void markDeployed(String serviceName) {
        deployed.add(serviceName);
        currentService = null;
    }

    public int getTotalServices() {
        return totalServices;
    }

    public int getDeployedCount() {
        return deployed.size();
    }

    public List<String> getDeployedServices() {
        synchronized (deployed) {
            return List.copyOf(deployed);
        }
    }

    public String getCurrentService() {
        return currentService;
    }

    public double getPercentage() {
        if (totalServices == 0) {
            return 100.0;
        }
        return deployed.size() * 100.0 / totalServices;
    }
}
