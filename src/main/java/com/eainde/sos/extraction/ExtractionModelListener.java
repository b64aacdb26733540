package com.eainde.sos.extraction;

import dev.langchain4j.model.chat.listener.ChatModelErrorContext;
import dev.langchain4j.model.chat.listener.ChatModelListener;
import dev.langchain4j.model.chat.listener.ChatModelRequestContext;
import dev.langchain4j.model.chat.listener.ChatModelResponseContext;
import dev.langchain4j.model.output.TokenUsage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs latency and token usage of every extraction model call.
 */
public class ExtractionModelListener implements ChatModelListener {

    private static final Logger log = LoggerFactory.getLogger(ExtractionModelListener.class);

    static final String START_TIME = "sos.startTime";

    @Override
    public void onRequest(ChatModelRequestContext requestContext) {
        log.debug("Sending extraction request with {} messages", requestContext.chatRequest().messages().size());
        requestContext.attributes().put(START_TIME, System.currentTimeMillis());
    }

    @Override
    public void onResponse(ChatModelResponseContext responseContext) {
        Object startTime = responseContext.attributes().get(START_TIME);
        long duration = startTime instanceof Long start ? System.currentTimeMillis() - start : -1;

        TokenUsage usage = responseContext.chatResponse().tokenUsage();
        if (usage != null) {
            log.info("Extraction model responded in {}ms - tokens input: {}, output: {}, total: {}",
                    duration, usage.inputTokenCount(), usage.outputTokenCount(), usage.totalTokenCount());
        } else {
            log.info("Extraction model responded in {}ms", duration);
        }
    }

    @Override
    public void onError(ChatModelErrorContext errorContext) {
        log.error("Extraction model call failed", errorContext.error());
    }
}
