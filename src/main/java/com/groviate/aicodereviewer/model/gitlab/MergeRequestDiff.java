package com.groviate.aicodereviewer.model.gitlab;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * DTO для хранения информации об одном измененном файле в MR.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MergeRequestDiff {

    @JsonProperty("old_path")
    private String oldPath; //Путь к файлу до изменений

    @JsonProperty("new_path")
    private String newPath; //Путь к файлу после изменений

    @JsonProperty("new_file")
    private Boolean newFile;

    @JsonProperty("deleted_file")
    private Boolean deletedFile;

    private String diff; //Строки с изменениями (с + и - для добавленных/удаленных строк)

    public boolean isDeletedFile() {
        return deletedFile != null && deletedFile;
    }

    public String getPath() {
        return newPath != null ? newPath : oldPath;
    }
}
