package fr.lapetina.workerpool.domain.model;

/**
 * Health status of a worker instance.
 *
 * HEALTHY: instance accepts jobs
 * UNHEALTHY: a probe or repeated executions failed; the instance is recycled
 * as soon as it is idle
 */
public enum InstanceHealth {
    HEALTHY,
    UNHEALTHY
}
