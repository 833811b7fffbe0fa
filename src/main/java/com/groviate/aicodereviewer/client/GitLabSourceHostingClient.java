package com.groviate.aicodereviewer.client;

import com.groviate.aicodereviewer.exception.SourceHostingException;
import com.groviate.aicodereviewer.model.ChangedFile;
import com.groviate.aicodereviewer.model.FeedbackComment;
import com.groviate.aicodereviewer.model.ReviewDisposition;
import com.groviate.aicodereviewer.model.gitlab.MergeRequest;
import com.groviate.aicodereviewer.model.gitlab.MergeRequestDiff;
import com.groviate.aicodereviewer.model.gitlab.MergeRequestDiffRefs;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Клиент GitLab API для ревью Merge Request
 * <p>
 * GitLab API endpoints:
 * - GET /projects/{id}/merge_requests/{iid} детали MR (diff_refs, sha)
 * - GET /projects/{id}/merge_requests/{iid}/changes список изменённых файлов с diff
 * - GET /projects/{id}/repository/files/{path}/raw?ref={sha} полный текст файла
 * - POST /projects/{id}/merge_requests/{iid}/notes общий комментарий
 * - POST /projects/{id}/merge_requests/{iid}/discussions комментарий к строке
 * - POST /projects/{id}/merge_requests/{iid}/approve approve MR
 */
@Component
@Slf4j
public class GitLabSourceHostingClient implements SourceHostingClient {

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String gitlabApiUrl;

    public GitLabSourceHostingClient(RestTemplate restTemplate,
                                     ObjectMapper objectMapper,
                                     @Value("${gitlab.api.url}") String gitlabApiUrl) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.gitlabApiUrl = gitlabApiUrl;
    }

    /**
     * Получает изменённые файлы MR вместе с полным текстом на head-коммите
     *
     * @throws SourceHostingException если произойдёт ошибка при обращении к API / парсинге
     */
    @Override
    @Retry(name = "gitlab")
    public Map<String, ChangedFile> fetchChangedFiles(String repository, String revisionRef) {
        log.info("Получаем изменения MR {}/{}", repository, revisionRef);

        MergeRequest mr = getMergeRequest(repository, revisionRef);
        String ref = headSha(mr);
        List<MergeRequestDiff> changes = getChanges(repository, revisionRef);

        Map<String, ChangedFile> files = new LinkedHashMap<>();
        int skipped = 0;
        for (MergeRequestDiff change : changes) {
            if (change.isDeletedFile() || change.getPath() == null) {
                skipped++;
                continue;
            }
            String content = getRawFile(repository, change.getPath(), ref);
            files.put(change.getPath(), ChangedFile.builder()
                    .content(content)
                    .diff(change.getDiff() == null || change.getDiff().isBlank() ? null : change.getDiff())
                    .build());
        }

        log.info("MR {}/{}: файлов для ревью={}, пропущено удалённых={}", repository, revisionRef, files.size(), skipped);
        return files;
    }

    /**
     * Публикует итог ревью: общий комментарий, комментарии к строкам и approve при необходимости.
     * Комментарий к строке, который GitLab не принял, переносится в общий комментарий.
     * Без @Retry: повтор после частичного успеха продублирует комментарии.
     */
    @Override
    public void submitFeedback(String repository, String revisionRef, List<FeedbackComment> comments, String summary,
                               ReviewDisposition disposition) {
        log.info("Публикуем ревью в MR {}/{}: комментариев={}, решение={}", repository, revisionRef,
                comments.size(), disposition);

        List<FeedbackComment> general = new ArrayList<>();
        List<FeedbackComment> inline = new ArrayList<>();
        for (FeedbackComment c : comments) {
            (c.getLine() != null && c.getLine() > 0 ? inline : general).add(c);
        }

        if (!inline.isEmpty()) {
            MergeRequestDiffRefs refs = getMergeRequest(repository, revisionRef).getDiffRefs();
            for (FeedbackComment c : inline) {
                if (refs == null || !postLineComment(repository, revisionRef, refs, c)) {
                    general.add(c);
                }
            }
        }

        postNote(repository, revisionRef, buildNote(summary, disposition, general));

        if (disposition == ReviewDisposition.APPROVE) {
            post(uri("projects", repository, "merge_requests", revisionRef, "approve"), null);
            log.info("MR {}/{} approved", repository, revisionRef);
        }
    }

    private MergeRequest getMergeRequest(String repository, String revisionRef) {
        try {
            MergeRequest mr = restTemplate.getForObject(
                    uri("projects", repository, "merge_requests", revisionRef), MergeRequest.class);
            if (mr == null) {
                throw new SourceHostingException("MR " + repository + "/" + revisionRef + " не найден");
            }
            return mr;
        } catch (RestClientException e) {
            log.error("Ошибка при получении MR {}/{}: {}", repository, revisionRef, e.getMessage());
            throw new SourceHostingException("Ошибка при получении MR " + repository + "/" + revisionRef, e);
        }
    }

    private List<MergeRequestDiff> getChanges(String repository, String revisionRef) {
        try {
            @SuppressWarnings("unchecked")
            Map<String, Object> response = restTemplate.getForObject(
                    uri("projects", repository, "merge_requests", revisionRef, "changes"), Map.class);

            if (response == null || response.get("changes") == null) {
                log.info("MR {}/{} не содержит измененных файлов", repository, revisionRef);
                return List.of();
            }

            @SuppressWarnings("unchecked")
            List<Map<String, Object>> changes = (List<Map<String, Object>>) response.get("changes");
            return changes.stream()
                    .map(map -> objectMapper.convertValue(map, MergeRequestDiff.class))
                    .toList();

        } catch (RestClientException | IllegalArgumentException | ClassCastException e) {
            log.error("Ошибка поиска изменений в MR {}/{}: {}", repository, revisionRef, e.getMessage());
            throw new SourceHostingException("Ошибка при получении изменений MR", e);
        }
    }

    private String getRawFile(String repository, String path, String ref) {
        URI uri = UriComponentsBuilder.fromUriString(gitlabApiUrl)
                .pathSegment("projects", repository, "repository", "files", path, "raw")
                .queryParam("ref", ref)
                .build()
                .encode()
                .toUri();
        try {
            String content = restTemplate.getForObject(uri, String.class);
            return content == null ? "" : content;
        } catch (RestClientException e) {
            log.error("Не удалось получить файл {}@{}: {}", path, ref, e.getMessage());
            throw new SourceHostingException("Не удалось получить файл " + path, e);
        }
    }

    private boolean postLineComment(String repository, String revisionRef, MergeRequestDiffRefs refs,
                                    FeedbackComment comment) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("body", comment.getBody());
        form.add("position[base_sha]", refs.getBaseSha());
        form.add("position[start_sha]", refs.getStartSha());
        form.add("position[head_sha]", refs.getHeadSha());
        form.add("position[position_type]", "text");
        form.add("position[old_path]", comment.getPath());
        form.add("position[new_path]", comment.getPath());
        form.add("position[new_line]", String.valueOf(comment.getLine()));

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);

        try {
            restTemplate.postForEntity(uri("projects", repository, "merge_requests", revisionRef, "discussions"),
                    new HttpEntity<>(form, headers), String.class);
            return true;
        } catch (HttpClientErrorException.BadRequest | HttpClientErrorException.UnprocessableEntity e) {
            // строка вне diff
            log.warn("Inline комментарий {}:{} не принят ({}), переносим в общий", comment.getPath(),
                    comment.getLine(), e.getStatusCode().value());
            return false;
        } catch (RestClientException e) {
            throw new SourceHostingException("Не удалось опубликовать inline comment: " + e.getMessage(), e);
        }
    }

    private void postNote(String repository, String revisionRef, String body) {
        Map<String, String> requestBody = new LinkedHashMap<>();
        requestBody.put("body", body);
        post(uri("projects", repository, "merge_requests", revisionRef, "notes"), requestBody);
    }

    private void post(URI uri, Object body) {
        try {
            restTemplate.postForEntity(uri, body, String.class);
        } catch (RestClientException e) {
            log.error("Ошибка POST {}: {}", uri, e.getMessage());
            throw new SourceHostingException("Не удалось выполнить запрос к GitLab: " + e.getMessage(), e);
        }
    }

    private String buildNote(String summary, ReviewDisposition disposition, List<FeedbackComment> general) {
        StringBuilder sb = new StringBuilder();
        sb.append("## 🤖 AI code review: ").append(dispositionLabel(disposition)).append("\n\n");
        if (summary != null && !summary.isBlank()) {
            sb.append(summary.strip()).append("\n");
        }
        if (!general.isEmpty()) {
            sb.append("\n### Замечания\n");
            for (FeedbackComment c : general) {
                sb.append("- `").append(c.getPath());
                if (c.getLine() != null && c.getLine() > 0) {
                    sb.append(':').append(c.getLine());
                }
                sb.append("` ").append(c.getBody()).append('\n');
            }
        }
        return sb.toString();
    }

    private static String dispositionLabel(ReviewDisposition disposition) {
        return switch (disposition) {
            case APPROVE -> "✅ можно сливать";
            case REQUEST_CHANGES -> "❌ требуются исправления";
            case COMMENT -> "💬 есть замечания";
        };
    }

    private static String headSha(MergeRequest mr) {
        if (mr.getDiffRefs() != null && mr.getDiffRefs().getHeadSha() != null) {
            return mr.getDiffRefs().getHeadSha();
        }
        if (mr.getSha() != null && !mr.getSha().isBlank()) {
            return mr.getSha();
        }
        throw new SourceHostingException("Не удалось определить head SHA для MR " + mr.getIid());
    }

    private URI uri(String... segments) {
        return UriComponentsBuilder.fromUriString(gitlabApiUrl)
                .pathSegment(segments)
                .build()
                .encode()
                .toUri();
    }
}
