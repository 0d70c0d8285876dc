/**
 * Request/response handlers and the connection subscription handler, independent of any web
 * framework.
 */
package io.coveytown.server.core.handlers;
