package io.taskloom.process;

import java.util.List;
import java.util.Map;

/**
 * Turns a spawn request into a concrete command line and environment.
 */
public interface SpawnStrategy {
    List<String> command(SpawnRequest request);

    Map<String, String> environment(SpawnRequest request);
}
