package com.groviate.aicodereviewer.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Комментарий для публикации в системе хостинга кода
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FeedbackComment {

    private String path;

    private Integer line; //null - комментарий без привязки к строке

    private String body;
}
