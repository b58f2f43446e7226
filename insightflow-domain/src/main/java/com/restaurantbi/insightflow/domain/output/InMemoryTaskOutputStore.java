package com.restaurantbi.insightflow.domain.output;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * InMemoryTaskOutputStore - 进程内产出存储
 */
public class InMemoryTaskOutputStore implements TaskOutputStore {

    private final Map<String, Object> outputs = new ConcurrentHashMap<>();
    private final Map<String, Integer> authoritative = new ConcurrentHashMap<>();

    @Override
    public String write(String runId, String taskId, int attempt, Object output) {
        String reference = TaskOutputStore.reference(runId, taskId, attempt);
        if (output != null) {
            outputs.put(reference, output);
        }
        return reference;
    }

    @Override
    public void markAuthoritative(String runId, String taskId, int attempt) {
        authoritative.put(runId + "/" + taskId, attempt);
    }

    @Override
    public Optional<Object> readAuthoritative(String runId, String taskId) {
        Integer attempt = authoritative.get(runId + "/" + taskId);
        if (attempt == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(outputs.get(TaskOutputStore.reference(runId, taskId, attempt)));
    }

    @Override
    public int countAttempts(String runId, String taskId) {
        String prefix = runId + "/" + taskId + "#";
        return (int) outputs.keySet().stream().filter(k -> k.startsWith(prefix)).count();
    }

    @Override
    public void purgeRun(String runId) {
        String prefix = runId + "/";
        outputs.keySet().removeIf(k -> k.startsWith(prefix));
        authoritative.keySet().removeIf(k -> k.startsWith(prefix));
    }
}
