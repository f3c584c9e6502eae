package com.yerin.submitflow.automation;

import java.util.Optional;

public interface CaptchaSolver {

    boolean isEnabled();

    /**
     * @return the solved token, or empty when the solver answered that it cannot solve this challenge
     * @throws com.yerin.submitflow.domain.failure.TransientInfraException when the solver is unreachable
     */
    Optional<String> solve(String siteKey, String pageUrl);
}
