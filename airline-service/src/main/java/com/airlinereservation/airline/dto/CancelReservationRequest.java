package com.airlinereservation.airline.dto;

import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.*;
import lombok.experimental.FieldDefaults;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Body of a cancellation: exactly one field, {@code ID}. Anything else is collected
 * so the request can be rejected rather than silently ignored.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class CancelReservationRequest {

    @JsonProperty("ID")
    Long id;

    @JsonIgnore
    @Builder.Default
    Map<String, Object> unexpectedFields = new LinkedHashMap<>();

    @JsonAnySetter
    public void addUnexpectedField(String name, Object value) {
        if (unexpectedFields == null) {
            unexpectedFields = new LinkedHashMap<>();
        }
        unexpectedFields.put(name, value);
    }

    public boolean hasUnexpectedFields() {
        return unexpectedFields != null && !unexpectedFields.isEmpty();
    }
}
