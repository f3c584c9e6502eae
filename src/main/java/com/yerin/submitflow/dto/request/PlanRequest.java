package com.yerin.submitflow.dto.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.yerin.submitflow.domain.DirectoryDescriptor;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

import java.util.Map;

public record PlanRequest(
        @JsonProperty("directory") @NotNull(message = "directory 는 필수입니다.") @Valid DirectoryDescriptor directory,
        @JsonProperty("business_profile") @NotNull(message = "business_profile 은 필수입니다.") Map<String, String> businessProfile
) {
}
