package dev.queuectl;

import dev.queuectl.WorkerPool.WorkerEntry;

public interface ProcessSupervisor {

    /**
     * Launches a worker loop under {@code workerId}.
     *
     * @return the registry entry identifying the started process
     * @throws LaunchException if the process could not be started
     */
    WorkerEntry start(String workerId);

    /**
     * True only if the process recorded in {@code worker} is still the one that was started, not a later
     * process that reused its pid.
     */
    boolean isAlive(WorkerEntry worker);

    /**
     * Asks the worker to finish its current job and exit.
     *
     * @return false if the worker was not running
     */
    boolean terminate(WorkerEntry worker);
}
