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
 * Tells the backend the call is over: {@code POST /v1/calls/{callId}/end}.
 */
@Component
@Order(1)
public class CallEndedNotifier implements PostSessionTask {

    private static final Logger LOG = LogManager.getLogger(CallEndedNotifier.class);

    static final String PATH = "/v1/calls/{callId}/end";

    private final BackendApiClient client;

    @Autowired
    public CallEndedNotifier(RestTemplateBuilder builder, BackendApiProperties api, PostSessionProperties props) {
        this(BackendApiClient.create(builder, api, props.getCallEndedTimeout()));
    }

    CallEndedNotifier(BackendApiClient client) {
        this.client = client;
    }

    @Override
    public String name() {
        return "call-ended";
    }

    @Override
    public void execute(String sessionId, SessionIdentity identity) {
        client.postJson(PATH, new JSONObject().put("callId", identity.callId()), identity.callId());
        LOG.info("Call end reported: call={}", identity.callId());
    }
}
