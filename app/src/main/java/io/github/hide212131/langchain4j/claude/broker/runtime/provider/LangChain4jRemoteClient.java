package io.github.hide212131.langchain4j.claude.broker.runtime.provider;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ImageContent;
import dev.langchain4j.data.message.TextContent;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.ChatRequestParameters;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.output.TokenUsage;
import io.github.hide212131.langchain4j.claude.broker.infra.logging.BrokerLog;
import io.github.hide212131.langchain4j.claude.broker.runtime.LlmConfiguration;
import io.github.hide212131.langchain4j.claude.broker.runtime.QueryOptions;
import io.github.hide212131.langchain4j.claude.broker.runtime.artifact.ImagePayloads;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * LangChain4j の {@link ChatModel} を介してリモート API を呼び出す。
 */
public final class LangChain4jRemoteClient implements RemoteCompletionClient {

    static final String DEFAULT_ANTHROPIC_MODEL = "claude-sonnet-4-20250514";
    static final String DEFAULT_OPENAI_MODEL = "gpt-5-mini";
    static final int DEFAULT_MAX_TOKENS = 4096;

    private static final String PHASE = "fallback";

    private final ChatModel chatModel;
    private final String defaultModelName;
    private final Clock clock;
    private final BrokerLog log = BrokerLog.forClass(LangChain4jRemoteClient.class);
    private final AtomicInteger callCount = new AtomicInteger();
    private final AtomicLong cumulativeDurationMs = new AtomicLong();

    LangChain4jRemoteClient(ChatModel chatModel, String defaultModelName, Clock clock) {
        this.chatModel = Objects.requireNonNull(chatModel, "chatModel");
        this.defaultModelName = defaultModelName;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public static LangChain4jRemoteClient from(LlmConfiguration configuration) {
        return from(configuration, new DefaultChatModelFactory(), Clock.systemUTC());
    }

    static LangChain4jRemoteClient from(LlmConfiguration configuration, ChatModelFactory factory, Clock clock) {
        Objects.requireNonNull(configuration, "configuration");
        Objects.requireNonNull(factory, "factory");
        return new LangChain4jRemoteClient(factory.create(configuration), resolveModelName(configuration), clock);
    }

    public static LangChain4jRemoteClient usingChatModel(ChatModel chatModel) {
        return new LangChain4jRemoteClient(chatModel, null, Clock.systemUTC());
    }

    /** API キー無しで動く応答固定のクライアント。 */
    public static LangChain4jRemoteClient fake() {
        return new LangChain4jRemoteClient(new FakeChatModel(), null, Clock.systemUTC());
    }

    @Override
    public RemoteCompletion complete(String prompt, QueryOptions options) {
        Objects.requireNonNull(prompt, "prompt");
        return send(UserMessage.from(prompt), options);
    }

    @Override
    public RemoteCompletion completeWithImage(String prompt, byte[] image, String mimeType, QueryOptions options) {
        Objects.requireNonNull(prompt, "prompt");
        Objects.requireNonNull(image, "image");
        String resolvedMimeType = mimeType != null && !mimeType.isBlank() ? mimeType : ImagePayloads.DEFAULT_MIME_TYPE;
        UserMessage message = UserMessage.from(
                ImageContent.from(ImagePayloads.encodeBase64(image), resolvedMimeType),
                TextContent.from(prompt));
        return send(message, options);
    }

    public int callCount() {
        return callCount.get();
    }

    public long cumulativeDurationMs() {
        return cumulativeDurationMs.get();
    }

    private RemoteCompletion send(UserMessage message, QueryOptions options) {
        QueryOptions resolved = options != null ? options : QueryOptions.defaults();
        ChatRequest request = ChatRequest.builder()
                .messages(List.of(message))
                .parameters(parameters(resolved))
                .build();
        Instant start = clock.instant();
        ChatResponse response = chatModel.chat(request);
        long durationMs = Duration.between(start, clock.instant()).toMillis();
        callCount.incrementAndGet();
        cumulativeDurationMs.addAndGet(durationMs);
        AiMessage aiMessage = response.aiMessage();
        String content = aiMessage != null && aiMessage.text() != null ? aiMessage.text() : "";
        TokenUsage usage = response.tokenUsage();
        log.info(PHASE, null, "remote.complete", "リモート API から応答を受信しました",
                "durationMs=" + durationMs + " chars=" + content.length());
        return new RemoteCompletion(content, usage != null ? usage.inputTokenCount() : null,
                usage != null ? usage.outputTokenCount() : null, durationMs);
    }

    private ChatRequestParameters parameters(QueryOptions options) {
        var builder = ChatRequestParameters.builder();
        String modelName = options.model() != null ? options.model() : defaultModelName;
        if (modelName != null) {
            builder.modelName(modelName);
        }
        if (options.maxTokens() != null) {
            builder.maxOutputTokens(options.maxTokens());
        }
        return builder.build();
    }

    private static String resolveModelName(LlmConfiguration configuration) {
        if (configuration.model() != null) {
            return configuration.model();
        }
        return switch (configuration.provider()) {
            case ANTHROPIC -> DEFAULT_ANTHROPIC_MODEL;
            case OPENAI -> DEFAULT_OPENAI_MODEL;
            case MOCK -> null;
        };
    }

    interface ChatModelFactory {
        ChatModel create(LlmConfiguration configuration);
    }

    private static final class DefaultChatModelFactory implements ChatModelFactory {

        @Override
        public ChatModel create(LlmConfiguration configuration) {
            String modelName = resolveModelName(configuration);
            return switch (configuration.provider()) {
                case ANTHROPIC -> AnthropicChatModel.builder()
                        .apiKey(configuration.apiKey())
                        .modelName(modelName)
                        .maxTokens(DEFAULT_MAX_TOKENS)
                        .timeout(configuration.timeout())
                        .build();
                case OPENAI -> {
                    var builder = OpenAiChatModel.builder()
                            .apiKey(configuration.apiKey())
                            .modelName(modelName)
                            .timeout(configuration.timeout());
                    if (configuration.baseUrl() != null) {
                        builder.baseUrl(configuration.baseUrl());
                    }
                    yield builder.build();
                }
                case MOCK -> new FakeChatModel();
            };
        }
    }

    private static final class FakeChatModel implements ChatModel {
        @Override
        public ChatResponse doChat(ChatRequest request) {
            String reply = "mock-response: " + request.messages().size() + " message(s)";
            return ChatResponse.builder()
                    .aiMessage(AiMessage.from(reply))
                    .tokenUsage(new TokenUsage(0, 0, 0))
                    .build();
        }
    }
}
