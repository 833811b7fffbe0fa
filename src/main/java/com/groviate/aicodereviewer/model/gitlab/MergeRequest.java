package com.groviate.aicodereviewer.model.gitlab;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * DTO для десериализации Merge Request из GitLab API (только нужные ревьюеру поля)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MergeRequest {

    @JsonProperty("iid") //Уникальный id MR внутри проекта
    private Integer iid;

    @JsonProperty("title")
    private String title;

    @JsonProperty("target_branch")
    private String targetBranch; //Куда слияние -> dev

    @JsonProperty("state")
    private String status; //"opened", "merged", "closed"

    @JsonProperty("sha")
    private String sha; //Git-хэш последнего коммита

    @JsonProperty("author")
    private Author author;

    @JsonProperty("diff_refs")
    private MergeRequestDiffRefs diffRefs;

    @JsonIgnoreProperties(ignoreUnknown = true)
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class Author {

        @JsonProperty("username")
        private String username; //Ник в Gitlab
    }
}
