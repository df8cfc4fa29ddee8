package com.infra.wiring.io;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Data;

/**
 * POJO representation of a subscriber configuration document.
 *
 * <pre>
 * {
 *   "name": "Orders",
 *   "iot": "Realtime",
 *   "filter": "devices/+/status",
 *   "subscriber": "src/orders.handler",
 *   "transform": { "topicRule": { "enabled": false } }
 * }
 * </pre>
 *
 * {@code subscriber} is either a handler string or a {@link FunctionDef} object.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public final class SubscriberDefinition {
    private String name, iot, filter;
    private Object subscriber;
    private Map<String, Map<String, Object>> transform;

    /** Object form of a subscriber function. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class FunctionDef {
        private String handler, description, runtime;
        private Integer memory, timeout;
        private Map<String, String> environment;
        private Map<String, Object> transform;
    }
}
