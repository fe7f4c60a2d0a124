package org.nowstart.cadence.data.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record KrakenResponse<T>(
        List<String> error,
        T result
) {

    public boolean hasError() {
        return error != null && !error.isEmpty();
    }

    public String errorMessage() {
        return hasError() ? String.join(", ", error) : "";
    }
}
