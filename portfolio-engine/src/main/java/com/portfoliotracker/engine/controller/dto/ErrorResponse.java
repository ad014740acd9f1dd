package com.portfoliotracker.engine.controller.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Error body: a reason and, for validation failures, the offending fields.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {

    private String error;
    private Map<String, String> fields;

    public static ErrorResponse of(String error) {
        return new ErrorResponse(error, null);
    }
}
