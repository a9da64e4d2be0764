package dev.pekelund.finsight.documents.local;

import org.springframework.ai.chat.model.ChatModel;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.context.annotation.Profile;

@Configuration
@Profile("local")
public class LocalDocumentProcessingConfiguration {

    @Bean
    @Primary
    public ChatModel chatModel() {
        return new NoopChatModel();
    }
}
