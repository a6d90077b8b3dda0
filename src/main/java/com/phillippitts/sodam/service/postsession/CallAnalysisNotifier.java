package com.phillippitts.sodam.service.postsession;

import com.phillippitts.sodam.config.properties.BackendApiProperties;
import com.phillippitts.sodam.config.properties.PostSessionProperties;
import com.phillippitts.sodam.domain.SessionIdentity;
import com.phillippitts.sodam.service.backend.BackendApiClient;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Asks the backend to analyse the stored transcript: {@code POST /v1/calls/{callId}/analyze}
 * with no body.
 */
@Component
@Order(2)
public class CallAnalysisNotifier implements PostSessionTask {

    private static final Logger LOG = LogManager.getLogger(CallAnalysisNotifier.class);

    static final String PATH = "/v1/calls/{callId}/analyze";

    private final BackendApiClient client;

    @Autowired
    public CallAnalysisNotifier(RestTemplateBuilder builder, BackendApiProperties api, PostSessionProperties props) {
        this(BackendApiClient.create(builder, api, props.getCallAnalysisTimeout()));
    }

    CallAnalysisNotifier(BackendApiClient client) {
        this.client = client;
    }

    @Override
    public String name() {
        return "call-analysis";
    }

    @Override
    public void execute(String sessionId, SessionIdentity identity) {
        client.postJson(PATH, null, identity.callId());
        LOG.info("Call analysis triggered: call={}", identity.callId());
    }
}
