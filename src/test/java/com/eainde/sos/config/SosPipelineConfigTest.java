package com.eainde.sos.config;

import com.eainde.sos.cache.ContactCacheStore;
import com.eainde.sos.cache.InMemoryContactCacheStore;
import com.eainde.sos.search.SearchProvider;
import com.eainde.sos.search.SerpApiSearchProvider;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.boot.web.client.RestTemplateBuilder;

import java.time.Clock;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SosPipelineConfigTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withUserConfiguration(SosPipelineConfig.class)
            .withBean(RestTemplateBuilder.class, () -> new RestTemplateBuilder())
            .withPropertyValues("sos.cache.store=memory");

    @Test
    void wiresPipelineCollaborators() {
        runner.run(context -> {
            assertThat(context).hasSingleBean(Clock.class);
            assertThat(context).hasSingleBean(SosProperties.class);
            assertThat(context.getBean(ContactCacheStore.class)).isInstanceOf(InMemoryContactCacheStore.class);
            assertThat(context.getBean(SearchProvider.class)).isInstanceOf(SerpApiSearchProvider.class);
            assertThat(context).hasBean("sosFetchExecutor").hasBean("sosStageExecutor");
        });
    }

    @Test
    void missingGeminiKeyGivesAModelThatFailsEveryCall() {
        runner.run(context -> {
            ChatModel model = context.getBean(ChatModel.class);
            ChatRequest request = ChatRequest.builder().messages(UserMessage.from("hello")).build();

            assertThatThrownBy(() -> model.chat(request))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("sos.extraction.api-key");
        });
    }
}
