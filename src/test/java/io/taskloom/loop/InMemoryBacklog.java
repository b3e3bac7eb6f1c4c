package io.taskloom.loop;

import io.taskloom.backlog.BacklogItem;
import io.taskloom.backlog.BacklogSource;
import io.taskloom.backlog.BacklogStatus;

import java.util.List;

final class InMemoryBacklog implements BacklogSource {
    private List<BacklogItem> items = List.of();
    private int version;
    private RuntimeException failure;

    synchronized void set(BacklogItem... items) {
        this.items = List.of(items);
        version++;
    }

    synchronized void failNextRead(RuntimeException failure) {
        this.failure = failure;
    }

    @Override
    public synchronized List<BacklogItem> getAllItems() {
        if (failure != null) {
            RuntimeException e = failure;
            failure = null;
            throw e;
        }
        return items;
    }

    @Override
    public synchronized String version() {
        return "v" + version;
    }

    static BacklogItem needsSpec(int number) {
        return new BacklogItem(number, "item " + number, BacklogStatus.PLANNED, false);
    }

    static BacklogItem specified(int number) {
        return new BacklogItem(number, "item " + number, BacklogStatus.PLANNED, true);
    }
}
