package com.mk.fx.qa.login.load.session;

import java.io.IOException;
import java.net.CookieManager;
import java.net.CookiePolicy;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Clock;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link LoginSessionDriver} that performs a form-based login over plain HTTP, the way a browser
 * would: fetch the start page (following redirects to the identity provider), fill the {@code
 * #username} and {@code #password} controls, submit the form and follow redirects back to the
 * relying party. Every session gets its own cookie jar, so concurrent sessions never share state.
 *
 * <p>Page snapshots are offered to the {@link PageArtifactSink} under the step names {@code
 * 001-StartPage}, {@code 002-CredentialsEntered}, {@code 004-AfterRedirect} and, when the flow
 * fails after a page was loaded, {@code 999-Errored}.
 */
@Slf4j
public class HttpLoginSessionDriver implements LoginSessionDriver {

    /** Default time allowed for each navigation, including redirects. */
    public static final Duration DEFAULT_NAVIGATION_TIMEOUT = Duration.ofSeconds(60);

    /** Time allowed for each navigation. */
    private final Duration navigationTimeout;

    /** Source of the start and finish timestamps. */
    private final Clock clock;

    public HttpLoginSessionDriver() {
        this(DEFAULT_NAVIGATION_TIMEOUT, Clock.systemDefaultZone());
    }

    /**
     * Creates a driver.
     *
     * @param navigationTimeout time allowed for each navigation
     * @param clock source of the timestamps reported in {@link SessionTiming}
     */
    public HttpLoginSessionDriver(Duration navigationTimeout, Clock clock) {
        this.navigationTimeout = Objects.requireNonNull(navigationTimeout, "navigationTimeout");
        this.clock = Objects.requireNonNull(clock, "clock");
        if (navigationTimeout.isZero() || navigationTimeout.isNegative()) {
            throw new IllegalArgumentException("navigationTimeout must be positive");
        }
        log.info("HttpLoginSessionDriver initialised - Navigation timeout: {} ms",
                navigationTimeout.toMillis());
    }

    @Override
    public SessionTiming drive(String targetUrl, Credential credential, PageArtifactSink artifacts)
            throws SessionFailureException, InterruptedException {
        Objects.requireNonNull(targetUrl, "targetUrl");
        Objects.requireNonNull(credential, "credential");
        var sink = artifacts != null ? artifacts : PageArtifactSink.NONE;
        var startUri = URI.create(targetUrl.trim());
        var browser = newBrowser();

        PageSnapshot lastPage = null;
        try {
            log.debug("Navigate to {}", startUri);
            lastPage = navigate(browser, HttpRequest.newBuilder(startUri)
                    .timeout(navigationTimeout)
                    .GET()
                    .build());
            requireLoaded(lastPage);
            capture(sink, "001-StartPage", lastPage);
            var startTime = clock.instant();

            log.debug("Complete login form as {}", credential.username());
            var form = LoginForm.locate(lastPage);
            capture(sink, "002-CredentialsEntered", form.fill(credential));

            log.debug("Submit login form to {} and wait to redirect back", form.action());
            lastPage = navigate(browser, form.submission(navigationTimeout));
            requireLoaded(lastPage);
            capture(sink, "004-AfterRedirect", lastPage);

            var landedOn = lastPage.uri().toString();
            if (!landedOn.toLowerCase(Locale.ROOT).startsWith(targetUrl.trim().toLowerCase(Locale.ROOT))) {
                throw new SessionFailureException("Ended on wrong page - " + landedOn);
            }
            return new SessionTiming(startTime, clock.instant());
        } catch (SessionFailureException e) {
            if (lastPage != null) {
                captureQuietly(sink, "999-Errored", lastPage);
            }
            throw e;
        }
    }

    private HttpClient newBrowser() {
        return HttpClient.newBuilder()
                .cookieHandler(new CookieManager(null, CookiePolicy.ACCEPT_ALL))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(navigationTimeout)
                .build();
    }

    private PageSnapshot navigate(HttpClient browser, HttpRequest request)
            throws SessionFailureException, InterruptedException {
        try {
            var response = browser.send(request, HttpResponse.BodyHandlers.ofString());
            return new PageSnapshot(response.uri(), response.statusCode(), response.body());
        } catch (HttpTimeoutException e) {
            throw new SessionFailureException(
                    "Navigation timeout of " + navigationTimeout.toMillis() + " ms exceeded", e);
        } catch (IOException e) {
            throw new SessionFailureException(
                    "Navigation to " + request.uri() + " failed: " + e.getMessage(), e);
        }
    }

    private static void requireLoaded(PageSnapshot page) throws SessionFailureException {
        if (page.statusCode() >= 400) {
            throw new SessionFailureException(
                    "Navigation to " + page.uri() + " returned HTTP " + page.statusCode());
        }
    }

    private static void capture(PageArtifactSink sink, String name, PageSnapshot page)
            throws SessionFailureException {
        try {
            sink.capture(name, page);
        } catch (IOException e) {
            throw new SessionFailureException(
                    "Failed to capture " + name + ": " + e.getMessage(), e);
        }
    }

    private static void captureQuietly(PageArtifactSink sink, String name, PageSnapshot page) {
        try {
            sink.capture(name, page);
        } catch (IOException e) {
            log.warn("Failed to capture {} for {}: {}", name, page.uri(), e.getMessage());
        }
    }
}
