package com.chirpy.api.webhooks;

record PolkaEvent(String event, Data data) {
    record Data(String userId) {}
}
