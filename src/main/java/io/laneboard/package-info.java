/**
 * LaneBoard source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.laneboard.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.laneboard.cli.LaneBoardCommand} maps commands to engine calls and serves the tool surface over HTTP.</li>
 *   <li>{@code io.laneboard.engine.TransitionEngine} is the board state machine: gating, WIP limits, ordering, sweeps.</li>
 *   <li>{@code io.laneboard.storage.BoardStore} is the authoritative persistence layer.</li>
 * </ul>
 */
package io.laneboard;
