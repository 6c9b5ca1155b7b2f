package io.github.hide212131.langchain4j.claude.broker.runtime.callsite;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.github.hide212131.langchain4j.claude.broker.runtime.fallback.CompletionUnavailableException;
import io.github.hide212131.langchain4j.claude.broker.runtime.fallback.FallbackOrchestrator;
import io.github.hide212131.langchain4j.claude.broker.runtime.provider.RecordingRemoteClient;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class TextExtractionServiceTest {

    @Test
    @DisplayName("会話の断片を抽出指示で包み、応答テキストをそのまま返す")
    void wrapsChunkWithInstructions() {
        RecordingRemoteClient remote = new RecordingRemoteClient("[]");
        TextExtractionService service = new TextExtractionService(new FallbackOrchestrator(null, remote));

        String output = service.extract("User: hi\nAssistant: hello").content();

        assertThat(output).isEqualTo("[]");
        assertThat(remote.prompts().get(0))
                .startsWith(TextExtractionService.DEFAULT_INSTRUCTIONS)
                .endsWith("Analyze this conversation and extract memories:\n\nUser: hi\nAssistant: hello");
        assertThat(remote.options().get(0).maxTokens()).isEqualTo(4000);
    }

    @Test
    @DisplayName("どちらの経路も使えなければ例外を呼び出し側へ伝える")
    void propagatesUnavailability() {
        TextExtractionService service = new TextExtractionService(new FallbackOrchestrator(null,
                new RecordingRemoteClient("unused").failingWith(new IllegalStateException("offline"))));

        assertThatThrownBy(() -> service.extract("User: hi")).isInstanceOf(CompletionUnavailableException.class);
    }
}
