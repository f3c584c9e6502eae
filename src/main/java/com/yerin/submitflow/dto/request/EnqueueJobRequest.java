package com.yerin.submitflow.dto.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

public record EnqueueJobRequest(
        @JsonProperty("customer_id") @NotBlank(message = "customer_id 는 필수입니다.") String customerId,
        @JsonProperty("package_size") @NotNull(message = "package_size 는 필수입니다.")
        @Positive(message = "package_size 는 1 이상이어야 합니다.") Integer packageSize,
        @JsonProperty("priority") String priority,
        @JsonProperty("source") String source
) {
}
