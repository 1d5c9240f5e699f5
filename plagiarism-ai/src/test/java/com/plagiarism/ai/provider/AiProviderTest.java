package com.plagiarism.ai.provider;

import com.plagiarism.ai.config.AiProperties;
import com.plagiarism.common.exception.ConfigurationException;
import com.plagiarism.common.exception.JudgmentServiceException;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AiProviderTest {

    private MockWebServer server;
    private AiProperties properties;
    private OkHttpClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        String baseUrl = server.url("/v1").toString();
        properties = new AiProperties();
        properties.getOpenai().setBaseUrl(baseUrl);
        properties.getAnthropic().setBaseUrl(baseUrl);
        properties.getGemini().setBaseUrl(baseUrl);
        client = new OkHttpClient.Builder().readTimeout(5, TimeUnit.SECONDS).build();
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void openAiSendsBearerKeyAndReadsFirstChoice() throws Exception {
        server.enqueue(new MockResponse().setBody(
                "{\"choices\":[{\"message\":{\"role\":\"assistant\",\"content\":\"{\\\"is_plagiarized\\\":true}\"}}]}"));

        String text = new OpenAiProvider(client, properties).complete("比较两段代码", "sk-test");

        assertThat(text).isEqualTo("{\"is_plagiarized\":true}");
        RecordedRequest request = server.takeRequest();
        assertThat(request.getPath()).isEqualTo("/v1/chat/completions");
        assertThat(request.getHeader("Authorization")).isEqualTo("Bearer sk-test");
        String body = request.getBody().readUtf8();
        assertThat(body).contains("\"model\":\"gpt-4o-mini\"").contains("比较两段代码");
    }

    @Test
    void anthropicJoinsTextBlocks() throws Exception {
        server.enqueue(new MockResponse().setBody(
                "{\"content\":[{\"type\":\"text\",\"text\":\"第一段\"},{\"type\":\"text\",\"text\":\"第二段\"}]}"));

        String text = new AnthropicProvider(client, properties).complete("prompt", "ak-test");

        assertThat(text).isEqualTo("第一段第二段");
        RecordedRequest request = server.takeRequest();
        assertThat(request.getPath()).isEqualTo("/v1/messages");
        assertThat(request.getHeader("x-api-key")).isEqualTo("ak-test");
        assertThat(request.getHeader("anthropic-version")).isEqualTo("2023-06-01");
    }

    @Test
    void geminiCallsGenerateContentForConfiguredModel() throws Exception {
        server.enqueue(new MockResponse().setBody(
                "{\"candidates\":[{\"content\":{\"parts\":[{\"text\":\"结论\"}],\"role\":\"model\"}}]}"));

        String text = new GeminiProvider(client, properties).complete("prompt", "gk-test");

        assertThat(text).isEqualTo("结论");
        RecordedRequest request = server.takeRequest();
        assertThat(request.getPath()).isEqualTo("/v1/models/gemini-2.5-flash-lite:generateContent");
        assertThat(request.getHeader("x-goog-api-key")).isEqualTo("gk-test");
        assertThat(request.getBody().readUtf8()).contains("\"maxOutputTokens\":1024");
    }

    @Test
    void errorStatusBecomesJudgmentServiceException() {
        server.enqueue(new MockResponse().setResponseCode(500).setBody("{\"error\":\"boom\"}"));

        assertThatThrownBy(() -> new GeminiProvider(client, properties).complete("prompt", "gk-test"))
                .isInstanceOf(JudgmentServiceException.class)
                .hasMessageContaining("HTTP 500");
    }

    @Test
    void emptyContentIsRejected() {
        server.enqueue(new MockResponse().setBody("{\"choices\":[]}"));

        assertThatThrownBy(() -> new OpenAiProvider(client, properties).complete("prompt", "sk-test"))
                .isInstanceOf(JudgmentServiceException.class)
                .hasMessageContaining("空内容");
    }

    @Test
    void factorySelectsProviderByNameIgnoringCase() {
        List<AiProvider> providers = List.of(
                new OpenAiProvider(client, properties),
                new AnthropicProvider(client, properties),
                new GeminiProvider(client, properties));
        properties.setProvider("Anthropic");
        AiProviderFactory factory = new AiProviderFactory(providers, properties);

        assertThat(factory.getProvider().getProviderName()).isEqualTo("anthropic");
        assertThat(factory.getProvider("GEMINI").getProviderName()).isEqualTo("gemini");
        assertThatThrownBy(() -> factory.getProvider("ollama"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("ollama");
    }
}
