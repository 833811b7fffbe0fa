package com.groviate.aicodereviewer.model.gitlab;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@JsonIgnoreProperties(ignoreUnknown = true)
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MergeRequestDiffRefs {

    @JsonProperty("base_sha")
    private String baseSha;

    @JsonProperty("start_sha")
    private String startSha;

    @JsonProperty("head_sha")
    private String headSha;
}
