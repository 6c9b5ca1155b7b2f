package io.github.hide212131.langchain4j.claude.broker.runtime.process;

import java.io.IOException;

/** 外部プロセスの起動口。テストではスクリプト化された実装に差し替える。 */
@FunctionalInterface
public interface ExternalProcessLauncher {

    /**
     * プロセスを起動する。
     *
     * @throws IOException 起動できなかった場合
     */
    ExternalProcessHandle spawn(ProcessSpec spec) throws IOException;
}
