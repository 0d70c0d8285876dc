/**
 * HTTP-backed video token provisioning, using the JDK {@link java.net.http.HttpClient} and Jackson.
 */
package io.coveytown.video.http;
