package com.phillippitts.sodam.service.transcript;

import com.phillippitts.sodam.config.properties.TranscriptProperties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Selects the transcript side-store: Redis when {@code sodam.transcript.redis-url} is set,
 * otherwise in-memory only.
 */
@Configuration
class TranscriptStoreConfig {

    private static final Logger LOG = LogManager.getLogger(TranscriptStoreConfig.class);

    @Bean
    TranscriptStore transcriptStore(TranscriptProperties props) {
        if (props.isPersistenceEnabled()) {
            return new RedisTranscriptStore(props.getRedisUrl());
        }
        LOG.warn("sodam.transcript.redis-url is not set; transcripts will not be persisted "
                + "and post-session analysis will see an empty transcript");
        return new NoopTranscriptStore();
    }
}
