package dev.ragservice.summary;

import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.StreamingChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.chat.response.PartialResponse;
import dev.langchain4j.model.chat.response.PartialResponseContext;
import dev.langchain4j.model.chat.response.StreamingChatResponseHandler;
import dev.langchain4j.model.chat.response.StreamingHandle;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * {@link SummaryGenerator} backed by a LangChain4j {@link StreamingChatModel}.
 *
 * <p>The model pushes partial responses on its own I/O thread; they are forwarded into a {@link
 * QueueingGenerationStream} that the pipeline drains under its deadline. Closing the stream cancels
 * the provider exchange through the {@link StreamingHandle} delivered with the partial responses.
 * If the stream is closed before the first partial response arrives, the exchange is cancelled as
 * soon as that response delivers the handle. Callbacks after close are dropped.
 */
@Component
public class LangChain4jSummaryGenerator implements SummaryGenerator {

  private static final Logger log = LoggerFactory.getLogger(LangChain4jSummaryGenerator.class);

  static final String SYSTEM_PROMPT =
      "You are a helpful assistant that summarizes search results concisely.";

  private final StreamingChatModel chatModel;

  public LangChain4jSummaryGenerator(StreamingChatModel chatModel) {
    this.chatModel = chatModel;
  }

  @Override
  public GenerationStream generate(String prompt) {
    ProviderExchange exchange = new ProviderExchange();
    QueueingGenerationStream stream = new QueueingGenerationStream(exchange::cancel);
    List<ChatMessage> messages =
        List.of(SystemMessage.from(SYSTEM_PROMPT), UserMessage.from(prompt));

    chatModel.chat(
        messages,
        new StreamingChatResponseHandler() {
          @Override
          public void onPartialResponse(
              PartialResponse partialResponse, PartialResponseContext context) {
            exchange.attach(context.streamingHandle());
            if (stream.isClosed()) {
              exchange.cancel();
              return;
            }
            stream.emit(partialResponse.text());
          }

          @Override
          public void onCompleteResponse(ChatResponse completeResponse) {
            stream.complete();
          }

          @Override
          public void onError(Throwable error) {
            if (stream.isClosed()) {
              log.debug("Ignoring generation error after stream close: {}", error.getMessage());
            } else {
              stream.fail(error);
            }
          }
        });
    return stream;
  }

  /** The provider's streaming handle, once known, and whether the consumer asked to cancel. */
  private static final class ProviderExchange {

    private final AtomicReference<StreamingHandle> handle = new AtomicReference<>();
    private final AtomicBoolean cancelRequested = new AtomicBoolean();
    private final AtomicBoolean cancelled = new AtomicBoolean();

    void attach(StreamingHandle streamingHandle) {
      handle.compareAndSet(null, streamingHandle);
      if (cancelRequested.get()) {
        cancelOnce();
      }
    }

    void cancel() {
      cancelRequested.set(true);
      cancelOnce();
    }

    private void cancelOnce() {
      StreamingHandle current = handle.get();
      if (current != null && cancelled.compareAndSet(false, true)) {
        log.debug("Cancelling summary exchange with the model provider");
        current.cancel();
      }
    }
  }
}
