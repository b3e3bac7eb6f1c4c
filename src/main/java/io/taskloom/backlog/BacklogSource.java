package io.taskloom.backlog;

import java.util.List;

/**
 * Source of truth for backlog items.
 */
public interface BacklogSource {
    List<BacklogItem> getAllItems();

    /**
     * Cheap freshness token. Equal tokens mean the items have not changed since the last read.
     */
    String version();
}
