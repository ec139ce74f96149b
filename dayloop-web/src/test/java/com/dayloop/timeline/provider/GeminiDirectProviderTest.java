package com.dayloop.timeline.provider;

import com.dayloop.timeline.config.CategoryProperties;
import com.dayloop.timeline.exception.ProviderException;
import com.dayloop.timeline.model.LlmCall;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

@ExtendWith(MockitoExtension.class)
class GeminiDirectProviderTest {

    private static final String BASE = "http://gemini.test";
    private static final String GENERATE = BASE + "/v1beta/models/gemini-test:generateContent";

    @Mock
    private LlmCallRecorder recorder;

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private RestTemplate restTemplate;
    private MockRestServiceServer server;

    @BeforeEach
    void setUp() {
        restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        lenient().when(recorder.record(any())).thenAnswer(inv -> inv.getArgument(0));
    }

    private GeminiDirectProvider provider(String apiKey, int maxAttempts) {
        return new GeminiDirectProvider(restTemplate, objectMapper, recorder, apiKey, "gemini-test", BASE,
                10, 5, maxAttempts, 0);
    }

    private String candidate(String text) throws Exception {
        ObjectNode root = objectMapper.createObjectNode();
        root.putArray("candidates").addObject()
                .putObject("content").putArray("parts").addObject().put("text", text);
        return objectMapper.writeValueAsString(root);
    }

    private BatchVideo video() throws Exception {
        Path file = Files.write(tempDir.resolve("batch.mp4"), new byte[]{1, 2, 3, 4});
        return new BatchVideo(9L, file, 900, 1_000);
    }

    private void expectUpload(String state) {
        HttpHeaders sessionHeaders = new HttpHeaders();
        sessionHeaders.set("X-Goog-Upload-URL", BASE + "/upload/session/1");
        server.expect(requestTo(BASE + "/upload/v1beta/files"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("x-goog-api-key", "secret"))
                .andExpect(header("X-Goog-Upload-Command", "start"))
                .andRespond(withSuccess().headers(sessionHeaders));
        server.expect(requestTo(BASE + "/upload/session/1"))
                .andExpect(method(HttpMethod.PUT))
                .andExpect(header("X-Goog-Upload-Command", "upload, finalize"))
                .andRespond(withSuccess("{\"file\":{\"name\":\"files/abc\",\"uri\":\"" + BASE
                        + "/v1beta/files/abc\",\"state\":\"" + state + "\"}}", MediaType.APPLICATION_JSON));
    }

    @Test
    void testTranscribeUploadsPollsAndParses() throws Exception {
        expectUpload("PROCESSING");
        server.expect(requestTo(BASE + "/v1beta/files/abc"))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess("{\"state\":\"ACTIVE\"}", MediaType.APPLICATION_JSON));
        server.expect(requestTo(GENERATE))
                .andExpect(method(HttpMethod.POST))
                .andRespond(withSuccess(candidate("[{\"startTimestamp\":\"00:00\",\"endTimestamp\":\"05:00\","
                        + "\"description\":\"Editing code\"},{\"startTimestamp\":\"05:00\",\"endTimestamp\":\"15:00\","
                        + "\"description\":\"Reading docs\"}]"), MediaType.APPLICATION_JSON));

        TranscriptionResult result = provider("secret", 3).transcribe(video());

        server.verify();
        assertThat(result.observations()).extracting(ObservationDraft::description)
                .containsExactly("Editing code", "Reading docs");
        assertThat(result.calls()).extracting(LlmCall::getOperation)
                .containsExactly("upload-start", "upload-finalize", "transcribe");
        assertThat(result.calls()).allMatch(c -> c.getStatus() == LlmCall.CallStatus.SUCCESS);
    }

    @Test
    void testServerErrorIsRetriedAndAudited() throws Exception {
        expectUpload("ACTIVE");
        server.expect(requestTo(GENERATE)).andRespond(withServerError());
        server.expect(requestTo(GENERATE))
                .andRespond(withSuccess(candidate("```json\n[{\"startTimestamp\":\"00:00\",\"endTimestamp\":\"10:00\","
                        + "\"description\":\"Writing\"}]\n```"), MediaType.APPLICATION_JSON));

        TranscriptionResult result = provider("secret", 3).transcribe(video());

        server.verify();
        List<LlmCall> transcribeCalls = result.calls().stream()
                .filter(c -> "transcribe".equals(c.getOperation())).toList();
        assertThat(transcribeCalls).extracting(LlmCall::getAttempt).containsExactly(1, 2);
        assertThat(transcribeCalls.get(0).getStatus()).isEqualTo(LlmCall.CallStatus.FAILURE);
        assertThat(transcribeCalls.get(0).getHttpStatus()).isEqualTo(500);
        assertThat(transcribeCalls.get(0).getErrorDomain()).isEqualTo("http");
        assertThat(transcribeCalls.get(0).getCallGroupId()).isEqualTo(transcribeCalls.get(1).getCallGroupId());
    }

    @Test
    void testObservationPastVideoEndIsRejected() throws Exception {
        expectUpload("ACTIVE");
        server.expect(requestTo(GENERATE))
                .andRespond(withSuccess(candidate("[{\"startTimestamp\":\"00:00\",\"endTimestamp\":\"30:00\","
                        + "\"description\":\"Too long\"}]"), MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> provider("secret", 1).transcribe(video()))
                .isInstanceOf(ProviderException.class)
                .hasMessageContaining("outside the video");
    }

    @Test
    void testSynthesizeCards() throws Exception {
        server.expect(requestTo(GENERATE))
                .andExpect(header("x-goog-api-key", "secret"))
                .andRespond(withSuccess(candidate("[{\"startTime\":\"00:00\",\"endTime\":\"15:00\",\"category\":\"Work\","
                        + "\"subcategory\":\"Coding\",\"title\":\"Parser work\",\"summary\":\"Wrote the parser\","
                        + "\"distractions\":[{\"startTime\":\"03:00\",\"endTime\":\"04:00\",\"title\":\"Chat\"}]}]"),
                        MediaType.APPLICATION_JSON));

        CardContext context = new CardContext(9L, 1_000, 900, List.of(), new CategoryProperties().getCategories());
        CardSynthesisResult result = provider("secret", 1).synthesizeCards(
                List.of(new ObservationDraft("00:00", "15:00", "Editing code")), context);

        assertThat(result.cards()).hasSize(1);
        CardDraft card = result.cards().get(0);
        assertThat(card.title()).isEqualTo("Parser work");
        assertThat(card.durationSeconds()).isEqualTo(900);
        assertThat(card.distractions()).extracting(CardDraft.Distraction::title).containsExactly("Chat");
        assertThat(result.calls()).hasSize(1);
    }

    @Test
    void testCardsDroppingEarlierCoverageAreRetried() throws Exception {
        server.expect(requestTo(GENERATE))
                .andRespond(withSuccess(candidate("[{\"startTime\":\"00:00\",\"endTime\":\"15:00\",\"category\":\"Work\","
                        + "\"title\":\"Parser work\",\"summary\":\"Wrote the parser\"}]"), MediaType.APPLICATION_JSON));
        server.expect(requestTo(GENERATE))
                .andRespond(withSuccess(candidate("[{\"startTime\":\"-40:00\",\"endTime\":\"00:00\",\"category\":\"Work\","
                        + "\"title\":\"Design review\",\"summary\":\"Reviewed the design\"},"
                        + "{\"startTime\":\"00:00\",\"endTime\":\"15:00\",\"category\":\"Work\","
                        + "\"title\":\"Parser work\",\"summary\":\"Wrote the parser\"}]"), MediaType.APPLICATION_JSON));

        CardDraft earlier = new CardDraft("-40:00", "00:00", "Work", null, "Design review",
                "Reviewed the design", null, List.of());
        CardContext context = new CardContext(9L, 1_000, 900, List.of(earlier), new CategoryProperties().getCategories());
        CardSynthesisResult result = provider("secret", 3).synthesizeCards(
                List.of(new ObservationDraft("00:00", "15:00", "Editing code")), context);

        server.verify();
        assertThat(result.cards()).extracting(CardDraft::start).containsExactly("-40:00", "00:00");
        assertThat(result.calls()).extracting(LlmCall::getStatus)
                .containsExactly(LlmCall.CallStatus.FAILURE, LlmCall.CallStatus.SUCCESS);
        assertThat(result.calls().get(0).getErrorMessage()).contains("-40:00 - 00:00");
    }

    @Test
    void testMissingApiKey() {
        assertThatThrownBy(() -> provider("", 1).transcribe(new BatchVideo(1L, tempDir.resolve("x.mp4"), 900, 0)))
                .isInstanceOf(ProviderException.class)
                .hasMessageContaining("API key");
    }
}
