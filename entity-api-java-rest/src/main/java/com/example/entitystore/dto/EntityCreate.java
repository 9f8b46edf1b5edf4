package com.example.entitystore.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Body of create and update requests.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EntityCreate {

    @JsonProperty("created_by")
    @NotEmpty(message = "created_by is required")
    private String createdBy;

    @JsonProperty("data")
    @NotNull(message = "data is required")
    private Map<String, Object> data;
}
