/**
 * Runtime wiring package.
 *
 * <p>{@link io.laneboard.runtime.LaneBoardRuntime} assembles the store, lock manager, event
 * broadcaster, audit log and transition engine for one namespace root, and runs the scheduled
 * archive maintenance used by the CLI and the HTTP server.
 */
package io.laneboard.runtime;
