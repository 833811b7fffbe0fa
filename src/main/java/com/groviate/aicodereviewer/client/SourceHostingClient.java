package com.groviate.aicodereviewer.client;

import com.groviate.aicodereviewer.model.ChangedFile;
import com.groviate.aicodereviewer.model.FeedbackComment;
import com.groviate.aicodereviewer.model.ReviewDisposition;

import java.util.List;
import java.util.Map;

/**
 * Контракт системы хостинга кода: получить изменённые файлы и опубликовать результат ревью
 */
public interface SourceHostingClient {

    /**
     * @param repository  идентификатор репозитория (для GitLab - id или путь проекта)
     * @param revisionRef идентификатор изменения (для GitLab - iid merge request)
     * @return путь -> (содержимое, diff); удалённые файлы не возвращаются
     */
    Map<String, ChangedFile> fetchChangedFiles(String repository, String revisionRef);

    void submitFeedback(String repository, String revisionRef, List<FeedbackComment> comments, String summary,
                        ReviewDisposition disposition);
}
