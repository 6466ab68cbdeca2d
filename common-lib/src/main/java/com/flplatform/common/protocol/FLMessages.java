package com.flplatform.common.protocol;

import com.flplatform.common.model.GlobalModel;
import com.flplatform.common.model.ModelUpdate;

import java.util.LinkedHashMap;
import java.util.Map;

/** Builders for the common unsigned protocol messages. */
public final class FLMessages {

    private FLMessages() {}

    public static SignedMessage roundStart(String coordinatorId, int roundNumber, GlobalModel globalModel) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("round_number", roundNumber);
        payload.put("global_model", globalModel == null ? null : globalModel.toDict());
        return SignedMessage.create(coordinatorId, FLMessageType.ROUND_START, payload);
    }

    public static SignedMessage localUpdate(ModelUpdate update) {
        return SignedMessage.create(update.nodeId(), FLMessageType.LOCAL_UPDATE,
            Map.of("update", update.toDict()));
    }

    public static SignedMessage globalModel(String coordinatorId, GlobalModel model) {
        return SignedMessage.create(coordinatorId, FLMessageType.GLOBAL_MODEL,
            Map.of("global_model", model.toDict()));
    }

    public static SignedMessage heartbeat(String nodeId, String status) {
        return SignedMessage.create(nodeId, FLMessageType.HEARTBEAT, Map.of("status", status));
    }

    public static SignedMessage error(String senderId, String errorCode, String message, Map<String, Object> details) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("error_code", errorCode);
        payload.put("message", message);
        payload.put("details", details == null ? Map.of() : details);
        return SignedMessage.create(senderId, FLMessageType.ERROR, payload);
    }
}
