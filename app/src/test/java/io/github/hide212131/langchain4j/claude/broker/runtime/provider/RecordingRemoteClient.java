package io.github.hide212131.langchain4j.claude.broker.runtime.provider;

import io.github.hide212131.langchain4j.claude.broker.runtime.QueryOptions;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * 受け取ったプロンプトを記録し、決まった応答を返すリモート API の代役。
 */
public final class RecordingRemoteClient implements RemoteCompletionClient {

    private final Function<String, String> replies;
    private final List<String> prompts = new CopyOnWriteArrayList<>();
    private final List<QueryOptions> options = new CopyOnWriteArrayList<>();
    private final List<String> imageMimeTypes = new CopyOnWriteArrayList<>();
    private volatile RuntimeException failure;

    public RecordingRemoteClient(String reply) {
        this(prompt -> reply);
    }

    public RecordingRemoteClient(Function<String, String> replies) {
        this.replies = replies;
    }

    /** 以降の呼び出しをすべて失敗させる。 */
    public RecordingRemoteClient failingWith(RuntimeException failure) {
        this.failure = failure;
        return this;
    }

    @Override
    public RemoteCompletion complete(String prompt, QueryOptions queryOptions) {
        return answer(prompt, queryOptions);
    }

    @Override
    public RemoteCompletion completeWithImage(String prompt, byte[] image, String mimeType,
            QueryOptions queryOptions) {
        imageMimeTypes.add(mimeType);
        return answer(prompt, queryOptions);
    }

    public List<String> prompts() {
        return List.copyOf(prompts);
    }

    public List<QueryOptions> options() {
        return List.copyOf(options);
    }

    public List<String> imageMimeTypes() {
        return List.copyOf(imageMimeTypes);
    }

    public int callCount() {
        return prompts.size();
    }

    private RemoteCompletion answer(String prompt, QueryOptions queryOptions) {
        prompts.add(prompt);
        options.add(queryOptions != null ? queryOptions : QueryOptions.defaults());
        RuntimeException current = failure;
        if (current != null) {
            throw current;
        }
        return new RemoteCompletion(replies.apply(prompt), null, null, 0);
    }
}
