package com.yerin.submitflow.automation;

import java.nio.file.Path;
import java.util.Optional;

/**
 * One headless page. Implementations raise
 * {@link com.yerin.submitflow.domain.failure.TransientAutomationException} for timeouts and
 * browser-level errors.
 */
public interface BrowserSession extends AutoCloseable {

    /** @return HTTP status of the main document, or 0 when the browser reported none */
    int navigate(String url);

    void fill(String selector, String value);

    void select(String selector, String value);

    void check(String selector);

    void click(String selector);

    void waitForNetworkIdle();

    String visibleText();

    String currentUrl();

    void screenshot(Path path);

    Optional<String> attribute(String selector, String name);

    void injectCaptchaToken(String token);

    @Override
    void close();
}
