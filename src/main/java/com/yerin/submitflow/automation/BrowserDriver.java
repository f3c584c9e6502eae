package com.yerin.submitflow.automation;

/**
 * Opens isolated browser sessions. Each submission task owns one session from open to close.
 */
public interface BrowserDriver {
    BrowserSession open();
}
