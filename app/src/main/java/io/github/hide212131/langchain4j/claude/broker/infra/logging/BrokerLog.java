package io.github.hide212131.langchain4j.claude.broker.infra.logging;

import java.util.Locale;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * ブローカー内部のイベントを 1 行の構造化ログとして出力する。
 *
 * <p>出力形式: {@code [phase=pool][level=INFO][request=...][step=slot.lease] message detail=... error=...}
 */
@SuppressWarnings({ "PMD.GuardLogStatement", "PMD.AvoidDuplicateLiterals", "PMD.ConsecutiveLiteralAppends" })
public final class BrokerLog {

    private static final int FORMAT_BUFFER_SIZE = 160;

    private final Logger logger;

    public BrokerLog(Logger logger) {
        this.logger = Objects.requireNonNull(logger, "logger");
    }

    public static BrokerLog forClass(Class<?> type) {
        Objects.requireNonNull(type, "type");
        return new BrokerLog(Logger.getLogger(type.getName()));
    }

    public void debug(String phase, String requestId, String step, String message, String detail) {
        if (!logger.isLoggable(Level.FINE)) {
            return;
        }
        logger.log(Level.FINE, format(Level.FINE, phase, requestId, step, message, detail, null));
    }

    public void info(String phase, String requestId, String step, String message, String detail) {
        if (!logger.isLoggable(Level.INFO)) {
            return;
        }
        logger.log(Level.INFO, format(Level.INFO, phase, requestId, step, message, detail, null));
    }

    public void warn(String phase, String requestId, String step, String message, String detail,
            Throwable error) {
        if (!logger.isLoggable(Level.WARNING)) {
            return;
        }
        logger.log(Level.WARNING, format(Level.WARNING, phase, requestId, step, message, detail, error), error);
    }

    public void error(String phase, String requestId, String step, String message, String detail,
            Throwable error) {
        if (!logger.isLoggable(Level.SEVERE)) {
            return;
        }
        logger.log(Level.SEVERE, format(Level.SEVERE, phase, requestId, step, message, detail, error), error);
    }

    Logger logger() {
        return logger;
    }

    @SuppressWarnings("checkstyle:ParameterNumber")
    private String format(Level level, String phase, String requestId, String step, String message, String detail,
            Throwable error) {
        String header = String.format(Locale.ROOT, "[phase=%s][level=%s][request=%s][step=%s] %s",
                valueOrDash(phase), level.getName(), valueOrDash(requestId), valueOrDash(step),
                valueOrEmpty(message));
        StringBuilder sb = new StringBuilder(FORMAT_BUFFER_SIZE);
        sb.append(header);
        if (detail != null && !detail.isBlank()) {
            sb.append(' ').append(detail.trim());
        }
        if (error != null) {
            sb.append(" error=").append(error.getClass().getSimpleName()).append(": ").append(error.getMessage());
        }
        return sb.toString();
    }

    private static String valueOrDash(String value) {
        if (value == null || value.isBlank()) {
            return "-";
        }
        return value.trim();
    }

    private static String valueOrEmpty(String value) {
        if (value == null) {
            return "";
        }
        return value;
    }
}
