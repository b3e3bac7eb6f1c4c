package io.taskloom.process;

public record SpawnResult(boolean success, long pid, long recordId, String taskId, String error) {
    public static SpawnResult success(long pid, long recordId, String taskId) {
        return new SpawnResult(true, pid, recordId, taskId, null);
    }

    public static SpawnResult failure(String taskId, String error) {
        return new SpawnResult(false, -1L, -1L, taskId, error);
    }
}
