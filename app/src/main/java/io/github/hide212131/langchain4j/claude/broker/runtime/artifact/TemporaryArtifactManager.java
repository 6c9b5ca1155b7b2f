package io.github.hide212131.langchain4j.claude.broker.runtime.artifact;

import io.github.hide212131.langchain4j.claude.broker.infra.logging.BrokerLog;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * CLI にファイルパスで渡すバイナリ (画像) を一時ファイルとして管理する。
 *
 * <p>ファイル名は UUID で一意にし、{@link StandardOpenOption#CREATE_NEW} で作成するため、リクエスト間で共有されることはない。
 * 作成したファイルは {@link #release(Path)} か {@link #releaseAll()} で必ず削除する。
 */
public final class TemporaryArtifactManager {

    private static final String PHASE = "artifact";
    private static final String FILE_PREFIX = "claude-image-";
    private static final String FILE_SUFFIX = ".png";

    private final Path directory;
    private final BrokerLog log;
    private final Map<Path, String> owners = new ConcurrentHashMap<>();

    public TemporaryArtifactManager(Path directory) {
        this(directory, BrokerLog.forClass(TemporaryArtifactManager.class));
    }

    TemporaryArtifactManager(Path directory, BrokerLog log) {
        this.directory = Objects.requireNonNull(directory, "directory");
        this.log = Objects.requireNonNull(log, "log");
    }

    /**
     * ペイロードを新しい一時ファイルへ書き込む。
     *
     * @throws ArtifactIoException 書き込みに失敗した場合。途中まで書いたファイルは削除する
     */
    public Path acquire(String requestId, byte[] payload) {
        Objects.requireNonNull(requestId, "requestId");
        Objects.requireNonNull(payload, "payload");
        Path path = directory.resolve(FILE_PREFIX + UUID.randomUUID() + FILE_SUFFIX);
        try {
            Files.createDirectories(directory);
            Files.write(path, payload, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
        } catch (IOException ex) {
            deleteQuietly(requestId, path);
            throw new ArtifactIoException("一時ファイルの作成に失敗しました: " + path, ex);
        }
        owners.put(path, requestId);
        log.debug(PHASE, requestId, "artifact.acquire", "一時ファイルを作成しました", "path=" + path);
        return path;
    }

    /** 一時ファイルを削除する。既に無い場合は何もしない。失敗はログのみで例外にしない。 */
    public void release(Path path) {
        if (path == null) {
            return;
        }
        String requestId = owners.remove(path);
        deleteQuietly(requestId, path);
    }

    /** 管理中のすべての一時ファイルを削除する。 */
    public void releaseAll() {
        for (Path path : Set.copyOf(owners.keySet())) {
            release(path);
        }
    }

    public Set<Path> activeArtifacts() {
        return Set.copyOf(owners.keySet());
    }

    public Path directory() {
        return directory;
    }

    private void deleteQuietly(String requestId, Path path) {
        try {
            Files.delete(path);
            log.debug(PHASE, requestId, "artifact.release", "一時ファイルを削除しました", "path=" + path);
        } catch (NoSuchFileException ex) {
            log.debug(PHASE, requestId, "artifact.release", "一時ファイルは既に削除されています", "path=" + path);
        } catch (IOException ex) {
            log.warn(PHASE, requestId, "artifact.release", "一時ファイルの削除に失敗しました", "path=" + path, ex);
        }
    }
}
