package xyz.firestige.fleet.domain.archive;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * 有界的活动归档历史，新记录在前，超过容量时淘汰最旧的记录
 */
public class RunArchive {

    private final int capacity;
    private final Deque<DeploymentRun> history = new ArrayDeque<>();

    public RunArchive(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("归档容量至少为 1: " + capacity);
        }
        this.capacity = capacity;
    }

    public synchronized void prepend(DeploymentRun run) {
        history.addFirst(run);
        while (history.size() > capacity) {
            history.removeLast();
        }
    }

    /**
     * 历史快照，最新的在前
     */
    public synchronized List<DeploymentRun> history() {
        return List.copyOf(history);
    }

    public int getCapacity() {
        return capacity;
    }
}
