package com.mk.fx.qa.login.load.session;

import java.net.URI;

/**
 * Page as seen by the driver at a given step of the login flow.
 *
 * @param uri final address of the page after redirects
 * @param statusCode HTTP status of the response
 * @param html page markup
 */
public record PageSnapshot(URI uri, int statusCode, String html) {}
