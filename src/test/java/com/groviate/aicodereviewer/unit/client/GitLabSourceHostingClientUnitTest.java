package com.groviate.aicodereviewer.unit.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.groviate.aicodereviewer.client.GitLabSourceHostingClient;
import com.groviate.aicodereviewer.exception.SourceHostingException;
import com.groviate.aicodereviewer.model.ChangedFile;
import com.groviate.aicodereviewer.model.FeedbackComment;
import com.groviate.aicodereviewer.model.ReviewDisposition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.allOf;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.not;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

@DisplayName("Юнит тесты GitLabSourceHostingClient")
class GitLabSourceHostingClientUnitTest {

    private static final String BASE = "http://gitlab.test/api/v4";
    private static final String MR_URL = BASE + "/projects/42/merge_requests/7";

    private static final String MR_JSON = """
            {
              "iid": 7,
              "title": "Add feature",
              "sha": "fallback",
              "diff_refs": {"base_sha": "b1", "start_sha": "s1", "head_sha": "h1"}
            }
            """;

    private MockRestServiceServer server;
    private GitLabSourceHostingClient client;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        client = new GitLabSourceHostingClient(restTemplate, new ObjectMapper(), BASE);
    }

    @Nested
    @DisplayName("fetchChangedFiles")
    class FetchChangedFilesTests {

        @Test
        @DisplayName("Должен вернуть изменённые файлы с текстом на head-коммите и пропустить удалённые")
        void givenMergeRequestChangesWhenFetchChangedFilesThenReturnContentAndDiff() {
            String changesJson = """
                    {
                      "changes": [
                        {"old_path": "src/Main.java", "new_path": "src/Main.java",
                         "diff": "@@ -1 +1 @@\\n-a\\n+b", "deleted_file": false},
                        {"old_path": "old.txt", "new_path": "old.txt", "deleted_file": true},
                        {"old_path": "README.md", "new_path": "README.md", "diff": "", "new_file": true}
                      ]
                    }
                    """;

            server.expect(requestTo(MR_URL)).andExpect(method(HttpMethod.GET))
                    .andRespond(withSuccess(MR_JSON, MediaType.APPLICATION_JSON));
            server.expect(requestTo(MR_URL + "/changes")).andExpect(method(HttpMethod.GET))
                    .andRespond(withSuccess(changesJson, MediaType.APPLICATION_JSON));
            server.expect(requestTo(BASE + "/projects/42/repository/files/src%2FMain.java/raw?ref=h1"))
                    .andExpect(method(HttpMethod.GET))
                    .andRespond(withSuccess("class Main {}", MediaType.TEXT_PLAIN));
            server.expect(requestTo(BASE + "/projects/42/repository/files/README.md/raw?ref=h1"))
                    .andExpect(method(HttpMethod.GET))
                    .andRespond(withSuccess("# readme", MediaType.TEXT_PLAIN));

            Map<String, ChangedFile> files = client.fetchChangedFiles("42", "7");

            server.verify();
            assertThat(files).containsOnlyKeys("src/Main.java", "README.md");
            assertThat(files.get("src/Main.java").getContent()).isEqualTo("class Main {}");
            assertThat(files.get("src/Main.java").getDiff()).contains("+b");
            assertThat(files.get("README.md").getDiff()).isNull();
        }

        @Test
        @DisplayName("Без diff_refs берётся sha MR")
        void givenNoDiffRefsWhenFetchChangedFilesThenUseMergeRequestSha() {
            server.expect(requestTo(MR_URL))
                    .andRespond(withSuccess("{\"iid\": 7, \"sha\": \"abc\"}", MediaType.APPLICATION_JSON));
            server.expect(requestTo(MR_URL + "/changes"))
                    .andRespond(withSuccess("{\"changes\": [{\"new_path\": \"a.py\", \"diff\": \"+x\"}]}",
                            MediaType.APPLICATION_JSON));
            server.expect(requestTo(BASE + "/projects/42/repository/files/a.py/raw?ref=abc"))
                    .andRespond(withSuccess("x = 1", MediaType.TEXT_PLAIN));

            Map<String, ChangedFile> files = client.fetchChangedFiles("42", "7");

            server.verify();
            assertThat(files.get("a.py").getContent()).isEqualTo("x = 1");
        }

        @Test
        @DisplayName("Ошибка GitLab оборачивается в SourceHostingException")
        void givenServerErrorWhenFetchChangedFilesThenThrowSourceHostingException() {
            server.expect(requestTo(MR_URL)).andRespond(withStatus(HttpStatus.INTERNAL_SERVER_ERROR));

            assertThatThrownBy(() -> client.fetchChangedFiles("42", "7"))
                    .isInstanceOf(SourceHostingException.class)
                    .hasMessageContaining("42/7");
        }

        @Test
        @DisplayName("MR без изменений даёт пустой результат")
        void givenNoChangesWhenFetchChangedFilesThenReturnEmptyMap() {
            server.expect(requestTo(MR_URL)).andRespond(withSuccess(MR_JSON, MediaType.APPLICATION_JSON));
            server.expect(requestTo(MR_URL + "/changes"))
                    .andRespond(withSuccess("{}", MediaType.APPLICATION_JSON));

            assertThat(client.fetchChangedFiles("42", "7")).isEmpty();
            server.verify();
        }
    }

    @Nested
    @DisplayName("submitFeedback")
    class SubmitFeedbackTests {

        @Test
        @DisplayName("Должен опубликовать inline комментарий, общий комментарий и approve")
        void givenInlineCommentAndApproveWhenSubmitFeedbackThenPostDiscussionNoteAndApprove() {
            server.expect(requestTo(MR_URL)).andExpect(method(HttpMethod.GET))
                    .andRespond(withSuccess(MR_JSON, MediaType.APPLICATION_JSON));
            server.expect(requestTo(MR_URL + "/discussions")).andExpect(method(HttpMethod.POST))
                    .andExpect(content().string(allOf(containsString("head_sha"), containsString("h1"))))
                    .andRespond(withSuccess());
            server.expect(requestTo(MR_URL + "/notes")).andExpect(method(HttpMethod.POST))
                    .andExpect(content().string(allOf(containsString("Проверено файлов: 1"),
                            not(containsString("Замечания")))))
                    .andRespond(withSuccess());
            server.expect(requestTo(MR_URL + "/approve")).andExpect(method(HttpMethod.POST))
                    .andRespond(withSuccess());

            client.submitFeedback("42", "7",
                    List.of(new FeedbackComment("src/Main.java", 12, "Отлично")),
                    "Проверено файлов: 1", ReviewDisposition.APPROVE);

            server.verify();
        }

        @Test
        @DisplayName("Отклонённый inline комментарий переносится в общий")
        void givenRejectedInlineCommentWhenSubmitFeedbackThenMoveItToNote() {
            server.expect(requestTo(MR_URL)).andRespond(withSuccess(MR_JSON, MediaType.APPLICATION_JSON));
            server.expect(requestTo(MR_URL + "/discussions")).andRespond(withStatus(HttpStatus.BAD_REQUEST));
            server.expect(requestTo(MR_URL + "/notes"))
                    .andExpect(content().string(allOf(containsString("Замечания"),
                            containsString("src/Main.java:12"), containsString("Утечка ресурса"))))
                    .andRespond(withSuccess());

            client.submitFeedback("42", "7",
                    List.of(new FeedbackComment("src/Main.java", 12, "Утечка ресурса")),
                    "итог", ReviewDisposition.REQUEST_CHANGES);

            server.verify();
        }

        @Test
        @DisplayName("Комментарии без строки публикуются только общим комментарием")
        void givenCommentWithoutLineWhenSubmitFeedbackThenOnlyPostNote() {
            server.expect(requestTo(MR_URL + "/notes")).andExpect(method(HttpMethod.POST))
                    .andExpect(content().string(containsString("README.md")))
                    .andRespond(withSuccess());

            client.submitFeedback("42", "7",
                    List.of(new FeedbackComment("README.md", null, "Опечатка")),
                    "итог", ReviewDisposition.COMMENT);

            server.verify();
        }

        @Test
        @DisplayName("Ошибка публикации общего комментария оборачивается в SourceHostingException")
        void givenNoteFailureWhenSubmitFeedbackThenThrowSourceHostingException() {
            server.expect(requestTo(MR_URL + "/notes")).andRespond(withStatus(HttpStatus.FORBIDDEN));

            assertThatThrownBy(() -> client.submitFeedback("42", "7", List.of(), "итог",
                    ReviewDisposition.COMMENT))
                    .isInstanceOf(SourceHostingException.class);
        }
    }
}
