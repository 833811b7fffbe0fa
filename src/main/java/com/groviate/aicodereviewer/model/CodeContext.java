package com.groviate.aicodereviewer.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Контекст проверяемого файла: путь, содержимое и сведения об изменении
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class CodeContext {

    private String filePath; //Путь к файлу в репозитории

    private String content; //Полный текст файла

    private String diff; //Unified diff изменений (null, если ревьюим файл целиком)

    private String language; //Язык, например "java"

    private String repository; //Имя репозитория / id проекта

    private String baseBranch; //Ветка, с которой сравниваем

    private String commitHash; //SHA текущего коммита

    private String author; //Автор изменений

    private List<String> changedFiles; //Остальные файлы, изменённые в том же MR
}
