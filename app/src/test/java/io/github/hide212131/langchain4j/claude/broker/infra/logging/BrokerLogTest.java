package io.github.hide212131.langchain4j.claude.broker.infra.logging;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class BrokerLogTest {

    private final Logger logger = Logger.getLogger("broker-log-test");
    private final List<LogRecord> records = new ArrayList<>();
    private final Handler handler = new Handler() {
        @Override
        public void publish(LogRecord record) {
            records.add(record);
        }

        @Override
        public void flush() {
        }

        @Override
        public void close() {
        }
    };

    @BeforeEach
    void setUp() {
        logger.setUseParentHandlers(false);
        logger.addHandler(handler);
        logger.setLevel(Level.ALL);
    }

    @AfterEach
    void tearDown() {
        logger.removeHandler(handler);
    }

    @Test
    @DisplayName("phase・level・request・step を先頭に並べた 1 行で出力する")
    void formatsStructuredLine() {
        new BrokerLog(logger).info("pool", "req-1", "slot.lease", "枠を貸し出しました", " active=1 ");

        assertThat(records).hasSize(1);
        assertThat(records.get(0).getMessage())
                .isEqualTo("[phase=pool][level=INFO][request=req-1][step=slot.lease] 枠を貸し出しました active=1");
    }

    @Test
    @DisplayName("リクエスト ID が無ければ - を出し、例外は種類とメッセージを添える")
    void includesErrorSummary() {
        IllegalStateException error = new IllegalStateException("boom");

        new BrokerLog(logger).warn("process", null, "process.exit", "異常終了", "", error);

        LogRecord record = records.get(0);
        assertThat(record.getLevel()).isEqualTo(Level.WARNING);
        assertThat(record.getThrown()).isSameAs(error);
        assertThat(record.getMessage())
                .startsWith("[phase=process][level=WARNING][request=-]")
                .endsWith("異常終了 error=IllegalStateException: boom");
    }

    @Test
    @DisplayName("無効なレベルのログは出力しない")
    void skipsDisabledLevel() {
        logger.setLevel(Level.INFO);

        new BrokerLog(logger).debug("stream", "req-1", "stream.chunk", "chunk", "");

        assertThat(records).isEmpty();
    }
}
