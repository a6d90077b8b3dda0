package com.phillippitts.sodam.service.postsession;

import com.phillippitts.sodam.config.properties.BackendApiProperties;
import com.phillippitts.sodam.config.properties.PostSessionProperties;
import com.phillippitts.sodam.domain.SessionIdentity;
import com.phillippitts.sodam.service.backend.BackendApiClient;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONObject;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Asks the backend to index the conversation for retrieval in later calls:
 * {@code POST /v1/rag/index {"callId":...,"wardId":...}}.
 */
@Component
@Order(3)
public class RagIndexingNotifier implements PostSessionTask {

    private static final Logger LOG = LogManager.getLogger(RagIndexingNotifier.class);

    static final String PATH = "/v1/rag/index";

    private final BackendApiClient client;

    @Autowired
    public RagIndexingNotifier(RestTemplateBuilder builder, BackendApiProperties api, PostSessionProperties props) {
        this(BackendApiClient.create(builder, api, props.getRagIndexingTimeout()));
    }

    RagIndexingNotifier(BackendApiClient client) {
        this.client = client;
    }

    @Override
    public String name() {
        return "rag-indexing";
    }

    @Override
    public void execute(String sessionId, SessionIdentity identity) {
        JSONObject body = new JSONObject()
                .put("callId", identity.callId())
                .put("wardId", identity.wardId());
        client.postJson(PATH, body);
        LOG.info("RAG indexing triggered: call={}", identity.callId());
    }
}
