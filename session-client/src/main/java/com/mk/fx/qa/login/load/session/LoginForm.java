package com.mk.fx.qa.login.load.session;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpRequest;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Locale;
import java.util.stream.Collectors;
import org.jsoup.Connection;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.FormElement;

/**
 * Sign-in form located on a page by its {@code #username} and {@code #password} controls. Hidden
 * fields of the enclosing form (anti-forgery tokens, state parameters) are submitted unchanged.
 */
final class LoginForm {

    static final String USERNAME_ID = "username";
    static final String PASSWORD_ID = "password";
    private static final String PASSWORD_MASK = "********";

    private final PageSnapshot page;
    private final Document document;
    private final FormElement form;
    private final Element usernameField;
    private final Element passwordField;

    private LoginForm(
            PageSnapshot page,
            Document document,
            FormElement form,
            Element usernameField,
            Element passwordField) {
        this.page = page;
        this.document = document;
        this.form = form;
        this.usernameField = usernameField;
        this.passwordField = passwordField;
    }

    /**
     * Finds the login form on the given page.
     *
     * @throws SessionFailureException if a required control or the enclosing form is missing
     */
    static LoginForm locate(PageSnapshot page) throws SessionFailureException {
        var document = Jsoup.parse(page.html() != null ? page.html() : "", page.uri().toString());
        var usernameField = requireControl(document, USERNAME_ID);
        var passwordField = requireControl(document, PASSWORD_ID);
        var enclosing = usernameField.closest("form");
        if (!(enclosing instanceof FormElement form)) {
            throw new SessionFailureException("Missing form enclosing #" + USERNAME_ID);
        }
        ensureNamed(usernameField, USERNAME_ID);
        ensureNamed(passwordField, PASSWORD_ID);
        return new LoginForm(page, document, form, usernameField, passwordField);
    }

    /**
     * Types the credential into the form.
     *
     * @return snapshot of the filled-in page with the password masked
     */
    PageSnapshot fill(Credential credential) {
        usernameField.val(credential.username());
        passwordField.val(PASSWORD_MASK);
        var masked = new PageSnapshot(page.uri(), page.statusCode(), document.outerHtml());
        passwordField.val(credential.password());
        return masked;
    }

    /** Builds the request a browser would send when the form's button is clicked. */
    HttpRequest submission(Duration timeout) {
        var body =
                form.formData().stream()
                        .map(LoginForm::encode)
                        .collect(Collectors.joining("&"));
        var method = form.attr("method").isBlank()
                ? "GET"
                : form.attr("method").toUpperCase(Locale.ROOT);
        var action = action();

        if ("GET".equals(method)) {
            var separator = action.getQuery() == null ? "?" : "&";
            return HttpRequest.newBuilder(URI.create(action + separator + body))
                    .timeout(timeout)
                    .GET()
                    .build();
        }
        return HttpRequest.newBuilder(action)
                .timeout(timeout)
                .header("Content-Type", "application/x-www-form-urlencoded")
                .method(method, HttpRequest.BodyPublishers.ofString(body))
                .build();
    }

    URI action() {
        var action = form.absUrl("action");
        return action.isBlank() ? page.uri() : URI.create(action);
    }

    private static Element requireControl(Document document, String id)
            throws SessionFailureException {
        var control = document.getElementById(id);
        if (control == null) {
            throw new SessionFailureException("Missing form control #" + id);
        }
        return control;
    }

    private static void ensureNamed(Element field, String fallback) {
        if (!field.hasAttr("name")) {
            field.attr("name", fallback);
        }
    }

    private static String encode(Connection.KeyVal pair) {
        return URLEncoder.encode(pair.key(), StandardCharsets.UTF_8)
                + "="
                + URLEncoder.encode(pair.value(), StandardCharsets.UTF_8);
    }
}
