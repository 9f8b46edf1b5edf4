package com.example.entitystore.dto;

import com.example.entitystore.query.QueryError;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {

    @JsonProperty("detail")
    private String detail;

    @JsonProperty("error")
    private String error;

    @JsonProperty("parameter")
    private String parameter;

    public static ErrorResponse of(String detail) {
        return ErrorResponse.builder().detail(detail).build();
    }

    public static ErrorResponse from(QueryError queryError) {
        return ErrorResponse.builder()
                .detail(queryError.getMessage())
                .error(queryError.getKind().name())
                .parameter(queryError.getParameter())
                .build();
    }
}
