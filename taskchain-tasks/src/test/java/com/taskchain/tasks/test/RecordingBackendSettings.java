package com.taskchain.tasks.test;

import com.taskchain.tasks.cloud.BackendSettings;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Backend settings kept in memory, keyed by {@code user/backend}.
 */
public class RecordingBackendSettings implements BackendSettings {

    private final List<String> disabled = new CopyOnWriteArrayList<>();
    private final Map<String, Integer> machineCounts = new ConcurrentHashMap<>();

    @Override
    public void disableBackend(String userId, String backendId) {
        disabled.add(userId + "/" + backendId);
    }

    @Override
    public void updateMachineCount(String userId, String backendId, int machineCount) {
        machineCounts.put(userId + "/" + backendId, machineCount);
    }

    public List<String> disabled() {
        return List.copyOf(disabled);
    }

    /**
     * Sum of the machine counts recorded for a user.
     */
    public int totalMachineCount(String userId) {
        return machineCounts.entrySet().stream()
            .filter(e -> e.getKey().startsWith(userId + "/"))
            .mapToInt(Map.Entry::getValue)
            .sum();
    }

    public Map<String, Integer> machineCounts() {
        return Map.copyOf(machineCounts);
    }
}
