package io.taskloom.process;

public record KillResult(boolean killed, long pid, String error) {
    public static KillResult killed(long pid) {
        return new KillResult(true, pid, null);
    }

    public static KillResult failed(long pid, String error) {
        return new KillResult(false, pid, error);
    }
}
