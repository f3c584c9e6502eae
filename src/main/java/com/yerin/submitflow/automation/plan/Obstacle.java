package com.yerin.submitflow.automation.plan;

public enum Obstacle {
    CAPTCHA,
    LOGIN_REQUIRED
}
