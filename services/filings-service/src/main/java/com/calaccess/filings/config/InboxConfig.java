package com.calaccess.filings.config;

import com.calaccess.filings.client.LocalSubmissionInbox;
import com.calaccess.filings.client.SubmissionInbox;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.file.Path;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class InboxConfig {

    @Bean
    SubmissionInbox submissionInbox(IngestionProperties properties, ObjectMapper objectMapper) {
        return new LocalSubmissionInbox(
            Path.of(properties.getInboxPath()),
            Path.of(properties.getArchivePath()),
            properties.getFilePattern(),
            objectMapper
        );
    }
}
