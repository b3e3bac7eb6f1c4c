package io.taskloom.loop;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What one cycle did. Mutable while the cycle runs; read by callers afterwards.
 */
public final class CycleReport {
    private final long cycle;
    private final List<Integer> specsDispatched = new ArrayList<>();
    private final List<Integer> implementationsDispatched = new ArrayList<>();
    private final List<String> periodicRuns = new ArrayList<>();
    private final List<String> finished = new ArrayList<>();
    private final List<String> orphaned = new ArrayList<>();
    private final List<String> timeoutAlerts = new ArrayList<>();
    private final List<String> batchesDrained = new ArrayList<>();
    private String batchId;
    private int hungProcesses;
    private String error;

    CycleReport(long cycle) {
        this.cycle = cycle;
    }

    public long cycle() {
        return cycle;
    }

    public List<Integer> specsDispatched() {
        return specsDispatched;
    }

    public List<Integer> implementationsDispatched() {
        return implementationsDispatched;
    }

    public List<String> periodicRuns() {
        return periodicRuns;
    }

    public List<String> finished() {
        return finished;
    }

    public List<String> orphaned() {
        return orphaned;
    }

    public List<String> timeoutAlerts() {
        return timeoutAlerts;
    }

    public List<String> batchesDrained() {
        return batchesDrained;
    }

    public String batchId() {
        return batchId;
    }

    void batchId(String batchId) {
        this.batchId = batchId;
    }

    public int hungProcesses() {
        return hungProcesses;
    }

    void hungProcesses(int hungProcesses) {
        this.hungProcesses = hungProcesses;
    }

    public String error() {
        return error;
    }

    void error(String error) {
        this.error = error;
    }

    public boolean failed() {
        return error != null;
    }

    public Map<String, Object> toView() {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("cycle", cycle);
        view.put("specs_dispatched", specsDispatched);
        view.put("implementations_dispatched", implementationsDispatched);
        view.put("batch_id", batchId);
        view.put("periodic_runs", periodicRuns);
        view.put("finished", finished);
        view.put("orphaned", orphaned);
        view.put("timeout_alerts", timeoutAlerts);
        view.put("batches_drained", batchesDrained);
        view.put("hung_processes", hungProcesses);
        view.put("error", error);
        return view;
    }
}
