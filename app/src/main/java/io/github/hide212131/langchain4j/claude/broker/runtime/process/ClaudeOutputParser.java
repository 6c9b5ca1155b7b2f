package io.github.hide212131.langchain4j.claude.broker.runtime.process;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;

/**
 * {@code --output-format json} の出力から応答テキストを取り出す。
 */
public final class ClaudeOutputParser {

    private static final List<String> TEXT_FIELDS = List.of("result", "content", "message");

    private final ObjectMapper objectMapper;

    public ClaudeOutputParser() {
        this(new ObjectMapper());
    }

    ClaudeOutputParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * 応答を解析する。
     *
     * @throws MalformedOutputException 空出力、JSON 以外、テキスト項目が無い場合
     */
    public ParsedOutput parse(String stdout) {
        if (stdout == null || stdout.isBlank()) {
            throw new MalformedOutputException("CLI の出力が空です");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(stdout.trim());
        } catch (JsonProcessingException ex) {
            throw new MalformedOutputException("CLI の出力を JSON として解釈できません", ex);
        }
        if (root == null || !root.isObject()) {
            throw new MalformedOutputException("CLI の出力が JSON オブジェクトではありません");
        }
        boolean error = root.path("is_error").asBoolean(false);
        for (String field : TEXT_FIELDS) {
            JsonNode node = root.get(field);
            if (node != null && node.isTextual()) {
                return new ParsedOutput(node.asText(), error);
            }
        }
        throw new MalformedOutputException("CLI の出力に応答テキストがありません: fields=" + fieldNames(root));
    }

    private static String fieldNames(JsonNode root) {
        StringBuilder sb = new StringBuilder();
        root.fieldNames().forEachRemaining(name -> {
            if (sb.length() > 0) {
                sb.append(',');
            }
            sb.append(name);
        });
        return sb.toString();
    }

    /**
     * 解析結果。
     *
     * @param text 応答テキスト
     * @param error CLI 自身がエラーとして報告したかどうか
     */
    public record ParsedOutput(String text, boolean error) {
    }
}
