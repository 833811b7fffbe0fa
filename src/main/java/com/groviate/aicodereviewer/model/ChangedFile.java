package com.groviate.aicodereviewer.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Изменённый файл: полное содержимое и diff (diff может отсутствовать)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChangedFile {

    private String content;

    private String diff;
}
