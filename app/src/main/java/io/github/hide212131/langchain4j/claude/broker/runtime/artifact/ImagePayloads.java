package io.github.hide212131.langchain4j.claude.broker.runtime.artifact;

import java.util.Base64;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** 画面側から渡される base64 / data URL 形式の画像を扱う。 */
public final class ImagePayloads {

    public static final String DEFAULT_MIME_TYPE = "image/png";

    private static final Pattern DATA_URL =
            Pattern.compile("^data:(image/[\\w.+-]+);base64,", Pattern.CASE_INSENSITIVE);

    private ImagePayloads() {
        throw new AssertionError("インスタンス化できません");
    }

    /**
     * data URL の接頭辞があれば取り除いて base64 をデコードする。
     *
     * @throws IllegalArgumentException base64 として不正な場合
     */
    public static byte[] decodeBase64(String imageBase64) {
        if (imageBase64 == null || imageBase64.isBlank()) {
            throw new IllegalArgumentException("画像データが空です");
        }
        String data = DATA_URL.matcher(imageBase64.trim()).replaceFirst("");
        return Base64.getMimeDecoder().decode(data);
    }

    /** data URL から MIME タイプを取り出す。無ければ image/png とみなす。 */
    public static String mimeType(String imageBase64) {
        if (imageBase64 == null) {
            return DEFAULT_MIME_TYPE;
        }
        Matcher matcher = DATA_URL.matcher(imageBase64.trim());
        return matcher.find() ? matcher.group(1).toLowerCase(Locale.ROOT) : DEFAULT_MIME_TYPE;
    }

    public static String encodeBase64(byte[] bytes) {
        return Base64.getEncoder().encodeToString(bytes);
    }
}
