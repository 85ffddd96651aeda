/**
 * Lifecycle of worker instances: creation, acquisition, release and recycling.
 *
 * @see fr.lapetina.workerpool.pool.PoolManager
 */
package fr.lapetina.workerpool.pool;
