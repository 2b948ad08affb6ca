/**
 * HiveStore source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.hivestore.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.hivestore.cli.HiveStoreCommand} maps commands to store APIs.</li>
 *   <li>{@code io.hivestore.runtime.HiveStore} is the facade every caller goes through.</li>
 *   <li>{@code io.hivestore.storage.Database} owns the SQLite connection and statement cache.</li>
 * </ul>
 */
package io.hivestore;
