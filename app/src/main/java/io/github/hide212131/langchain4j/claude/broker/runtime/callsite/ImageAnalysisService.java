package io.github.hide212131.langchain4j.claude.broker.runtime.callsite;

import io.github.hide212131.langchain4j.claude.broker.runtime.QueryOptions;
import io.github.hide212131.langchain4j.claude.broker.runtime.artifact.ImagePayloads;
import io.github.hide212131.langchain4j.claude.broker.runtime.fallback.FallbackOrchestrator;
import io.github.hide212131.langchain4j.claude.broker.runtime.fallback.FallbackResult;
import java.util.Objects;

/** 画像解析。画像はバイト列か base64 (data URL 可) で受け取る。 */
public final class ImageAnalysisService {

    private final FallbackOrchestrator orchestrator;
    private final QueryOptions options;

    public ImageAnalysisService(FallbackOrchestrator orchestrator) {
        this(orchestrator, QueryOptions.defaults().withMaxTokens(ChatCompletionService.DEFAULT_MAX_TOKENS));
    }

    public ImageAnalysisService(FallbackOrchestrator orchestrator, QueryOptions options) {
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator");
        this.options = Objects.requireNonNull(options, "options");
    }

    public FallbackResult analyze(String prompt, byte[] image, String mimeType) {
        return orchestrator.completeWithImage(prompt, image, mimeType, options);
    }

    /**
     * @throws IllegalArgumentException 画像データが base64 として不正な場合
     */
    public FallbackResult analyzeBase64(String prompt, String imageBase64) {
        byte[] image = ImagePayloads.decodeBase64(imageBase64);
        return analyze(prompt, image, ImagePayloads.mimeType(imageBase64));
    }
}
