package com.baykanat.notifier.api.dto;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Recipient fields of an event payload")
public class EventPayloadRequest {

    @NotBlank(message = "payload.userId is required")
    @Schema(description = "User identifier", example = "user_123")
    private String userId;

    @NotBlank(message = "payload.email is required")
    @Email(message = "payload.email must be a valid email address")
    @Schema(description = "Recipient address", example = "jane@example.com")
    private String email;

    @NotBlank(message = "payload.username is required")
    @Size(min = 3, max = 30, message = "payload.username must be 3-30 characters")
    @Schema(description = "Display name", example = "jane")
    private String username;

    @Builder.Default
    private Map<String, Object> attributes = new LinkedHashMap<>();

    @JsonAnyGetter
    public Map<String, Object> getAttributes() {
        return attributes;
    }

    @JsonAnySetter
    public void setAttribute(String name, Object value) {
        attributes.put(name, value);
    }
}
