package io.github.hide212131.langchain4j.claude.broker.runtime.process;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 起動するコマンドと、そのプロセスに渡す環境変数の完全な集合。
 *
 * @param command 実行ファイルと引数
 * @param environment 子プロセスに見せる環境変数。親の環境は継承しない
 */
public record ProcessSpec(List<String> command, Map<String, String> environment) {

    public ProcessSpec {
        Objects.requireNonNull(command, "command");
        Objects.requireNonNull(environment, "environment");
        if (command.isEmpty()) {
            throw new IllegalArgumentException("command は空にできません");
        }
        command = List.copyOf(command);
        environment = Map.copyOf(environment);
    }

    public String executable() {
        return command.get(0);
    }

    /** ログ用の表示。プロンプトは標準入力で渡すため引数に機密は含まれない。 */
    public String displayCommand() {
        return String.join(" ", command);
    }
}
