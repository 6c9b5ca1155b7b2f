package io.github.hide212131.langchain4j.claude.broker.runtime.process;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;

/**
 * 起動済み外部プロセスへの操作。プールはこのインターフェース越しにのみプロセスを扱う。
 */
public interface ExternalProcessHandle {

    long pid();

    /** 標準入力へ UTF-8 で書き込み、入力を閉じる。 */
    void writeInput(String input) throws IOException;

    InputStream stdout();

    InputStream stderr();

    /** 正常終了を促すシグナルを送る。 */
    void terminate();

    /** 強制終了する。 */
    void kill();

    boolean isAlive();

    /**
     * 終了を最大 {@code timeout} まで待つ。
     *
     * @return 期限内に終了した場合は {@code true}
     */
    boolean waitFor(Duration timeout) throws InterruptedException;

    /** 終了を待ち、終了コードを返す。 */
    int waitFor() throws InterruptedException;
}
