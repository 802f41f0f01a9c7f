package com.lyshra.open.flowsync.integration.models.source;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SidecarEnvironmentEntry {

    @NotBlank(message = "native_id must not be blank")
    @JsonProperty("native_id")
    private String nativeId;

    @JsonProperty("content_hash")
    private String contentHash;

    @JsonProperty("last_seen_at")
    private String lastSeenAt;
}
