package com.yerin.submitflow.automation;

import com.microsoft.playwright.*;
import com.microsoft.playwright.options.LoadState;
import com.microsoft.playwright.options.WaitUntilState;
import com.yerin.submitflow.domain.failure.TransientAutomationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Headless Chromium through Playwright. Playwright objects are not thread-safe, so every
 * session gets its own Playwright instance and browser.
 */
@Slf4j
@Component
public class PlaywrightBrowserDriver implements BrowserDriver {

    private static final String INJECT_TOKEN_JS = """
            token => {
              for (const name of ['g-recaptcha-response', 'h-captcha-response', 'cf-turnstile-response']) {
                document.querySelectorAll('[name="' + name + '"]').forEach(el => { el.value = token; });
              }
            }
            """;

    @Value("${submitflow.automation.headless:true}")
    private boolean headless = true;

    @Value("${submitflow.automation.navigation-timeout-ms:30000}")
    private double navigationTimeoutMs = 30000;

    @Value("${submitflow.automation.action-timeout-ms:10000}")
    private double actionTimeoutMs = 10000;

    @Override
    public BrowserSession open() {
        Playwright playwright = null;
        try {
            playwright = Playwright.create();
            Browser browser = playwright.chromium().launch(new BrowserType.LaunchOptions().setHeadless(headless));
            Page page = browser.newContext().newPage();
            page.setDefaultTimeout(actionTimeoutMs);
            page.setDefaultNavigationTimeout(navigationTimeoutMs);
            return new PlaywrightSession(playwright, page);
        } catch (PlaywrightException e) {
            if (playwright != null) playwright.close();
            throw new TransientAutomationException("browser launch failed: " + e.getMessage(), e);
        }
    }

    private final class PlaywrightSession implements BrowserSession {
        private final Playwright playwright;
        private final Page page;

        private PlaywrightSession(Playwright playwright, Page page) {
            this.playwright = playwright;
            this.page = page;
        }

        @Override
        public int navigate(String url) {
            return call("navigate " + url, () -> {
                Response r = page.navigate(url, new Page.NavigateOptions().setWaitUntil(WaitUntilState.NETWORKIDLE));
                return r == null ? 0 : r.status();
            });
        }

        @Override
        public void fill(String selector, String value) {
            run("fill " + selector, () -> page.fill(selector, value));
        }

        @Override
        public void select(String selector, String value) {
            run("select " + selector, () -> page.selectOption(selector, value));
        }

        @Override
        public void check(String selector) {
            run("check " + selector, () -> page.check(selector));
        }

        @Override
        public void click(String selector) {
            run("click " + selector, () -> page.click(selector));
        }

        @Override
        public void waitForNetworkIdle() {
            run("wait networkidle", () -> page.waitForLoadState(LoadState.NETWORKIDLE,
                    new Page.WaitForLoadStateOptions().setTimeout(navigationTimeoutMs)));
        }

        @Override
        public String visibleText() {
            return call("read text", () -> page.innerText("body"));
        }

        @Override
        public String currentUrl() {
            return page.url();
        }

        @Override
        public void screenshot(Path path) {
            run("screenshot", () -> page.screenshot(new Page.ScreenshotOptions().setPath(path).setFullPage(true)));
        }

        @Override
        public Optional<String> attribute(String selector, String name) {
            return call("attribute " + selector, () -> {
                ElementHandle el = page.querySelector(selector);
                return el == null ? Optional.<String>empty() : Optional.ofNullable(el.getAttribute(name));
            });
        }

        @Override
        public void injectCaptchaToken(String token) {
            run("inject captcha token", () -> page.evaluate(INJECT_TOKEN_JS, token));
        }

        @Override
        public void close() {
            try {
                playwright.close();
            } catch (PlaywrightException e) {
                log.warn("[Browser] close failed: {}", e.getMessage());
            }
        }

        private void run(String step, Runnable action) {
            call(step, () -> {
                action.run();
                return null;
            });
        }

        private <T> T call(String step, Supplier<T> action) {
            try {
                return action.get();
            } catch (TimeoutError e) {
                throw new TransientAutomationException("timeout during " + step, e);
            } catch (PlaywrightException e) {
                throw new TransientAutomationException("browser error during " + step + ": " + e.getMessage(), e);
            }
        }
    }
}
