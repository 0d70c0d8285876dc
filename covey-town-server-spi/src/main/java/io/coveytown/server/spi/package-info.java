/**
 * Collaborator SPI for Covey Town servers.
 *
 * <p>The town state machine depends only on these interfaces; concrete video providers and id
 * sources are plugged in by the hosting application.
 */
package io.coveytown.server.spi;
