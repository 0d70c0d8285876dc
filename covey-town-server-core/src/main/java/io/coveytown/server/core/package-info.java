/**
 * Town state machine for Covey Town.
 *
 * <p>Contains:
 * <ul>
 *   <li>{@link io.coveytown.server.core.TownState} (roster, sessions, conversation areas, listeners)</li>
 *   <li>{@link io.coveytown.server.core.TownsStore} (registry of towns)</li>
 *   <li>{@link io.coveytown.server.core.NanoIdGenerator} (default id and token source)</li>
 * </ul>
 *
 * <p>Transports subscribe {@link io.coveytown.server.core.TownListener}s and translate their
 * callbacks onto the wire.
 */
package io.coveytown.server.core;
