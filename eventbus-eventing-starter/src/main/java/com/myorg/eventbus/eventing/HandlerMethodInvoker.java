package com.myorg.eventbus.eventing;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.myorg.eventbus.contracts.core.envelope.EventEnvelope;
import com.myorg.eventbus.contracts.core.exception.EventBusNonRetryableException;
import lombok.Getter;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;

@Getter
public class HandlerMethodInvoker {

    private final Object target;
    private final Method method;
    private final Class<?> payloadClass;
    private final ObjectMapper mapper;
    private final boolean envelopeOnly;

    public HandlerMethodInvoker(Object target, Method method, Class<?> payloadClass, ObjectMapper mapper) {
        int params = method.getParameterCount();
        boolean firstIsEnvelope = params >= 1 && EventEnvelope.class.equals(method.getParameterTypes()[0]);
        if (params == 0 || params > 2 || (params == 2 && !firstIsEnvelope)) {
            throw new IllegalStateException("Handler method must take (payload), (envelope, payload) or (envelope): " + method);
        }
        this.target = target;
        this.method = method;
        this.payloadClass = payloadClass;
        this.mapper = mapper;
        this.envelopeOnly = params == 1 && firstIsEnvelope;
    }

    public void invoke(EventEnvelope env) throws Exception {
        try {
            if (envelopeOnly) {
                method.invoke(target, env);
                return;
            }
            Object payload = convert(env);
            if (method.getParameterCount() == 1) {
                method.invoke(target, payload);
            } else {
                method.invoke(target, env, payload);
            }
        } catch (InvocationTargetException e) {
            // ném lại lỗi gốc để retry/DLQ phân loại đúng
            Throwable cause = e.getTargetException();
            if (cause instanceof Exception ex) throw ex;
            if (cause instanceof Error err) throw err;
            throw e;
        }
    }

    private Object convert(EventEnvelope env) {
        JsonNode data = env.getData() != null ? env.getData() : NullNode.getInstance();
        try {
            return mapper.treeToValue(data, payloadClass);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new EventBusNonRetryableException("PAYLOAD_CONVERSION",
                    "Cannot convert data of eventId=" + env.getId() + " to " + payloadClass.getSimpleName(), e);
        }
    }
}
