package dev.ragservice.api;

import dev.ragservice.search.SearchResponse;
import dev.ragservice.summary.SummarySink;
import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/** Writes pipeline output to a server-sent-event stream and notices when the client leaves. */
class SseSummarySink implements SummarySink {

  private static final Logger log = LoggerFactory.getLogger(SseSummarySink.class);

  private final SseEmitter emitter;
  private final AtomicBoolean cancelled = new AtomicBoolean();

  SseSummarySink(SseEmitter emitter) {
    this.emitter = emitter;
  }

  @Override
  public void onSearchComplete(SearchResponse response) {
    send("results", SearchResultsResponse.from(response));
  }

  @Override
  public void onFragment(String fragment) {
    send("token", fragment);
  }

  @Override
  public boolean isCancelled() {
    return cancelled.get();
  }

  void cancel() {
    cancelled.set(true);
  }

  void send(String eventName, Object data) {
    if (cancelled.get()) {
      return;
    }
    try {
      emitter.send(SseEmitter.event().name(eventName).data(data));
    } catch (IOException | IllegalStateException e) {
      log.debug("Client left during '{}' event: {}", eventName, e.getMessage());
      cancelled.set(true);
    }
  }
}
