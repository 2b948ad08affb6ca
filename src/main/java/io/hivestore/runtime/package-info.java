/**
 * Store lifecycle and background upkeep.
 *
 * <p>{@link io.hivestore.runtime.HiveStore} wires the entity stores onto one database,
 * stamps operations with its clock and audits coordination events;
 * {@link io.hivestore.runtime.MaintenanceSweeper} expires and trims the memory cache.
 */
package io.hivestore.runtime;
