package com.yerin.submitflow.support;

import com.yerin.submitflow.domain.DirectoryDescriptor;
import com.yerin.submitflow.domain.PackageTier;
import com.yerin.submitflow.domain.TaskMessage;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class Fixtures {
    private Fixtures() {}

    public static DirectoryDescriptor directory(String id) {
        return new DirectoryDescriptor(id, id + "-name", "https://" + id + ".example.com", null,
                Map.of(), null, List.of(), List.of(), 0, false, false);
    }

    public static DirectoryDescriptor directory(String id, boolean captcha, boolean requiresLogin) {
        return new DirectoryDescriptor(id, id + "-name", "https://" + id + ".example.com", null,
                Map.of(), null, List.of(), List.of(), 0, captcha, requiresLogin);
    }

    public static Map<String, String> profile() {
        Map<String, String> p = new LinkedHashMap<>();
        p.put("business_name", "Acme Coffee");
        p.put("email", "owner@acme.test");
        p.put("phone", "010-1234-5678");
        p.put("website", "https://acme.test");
        p.put("description", "Specialty coffee roaster");
        return p;
    }

    public static TaskMessage task(String jobId, String directoryId) {
        return new TaskMessage(jobId, "run-1", directory(directoryId), profile(), PackageTier.PRO);
    }
}
