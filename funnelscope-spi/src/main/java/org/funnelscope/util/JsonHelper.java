package org.funnelscope.util;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

public class JsonHelper {
    private final static ObjectMapper mapper = new ObjectMapper();
    private final static ObjectMapper prettyMapper = new ObjectMapper();

    static {
        for (ObjectMapper objectMapper : new ObjectMapper[] {mapper, prettyMapper}) {
            objectMapper.registerModule(new JavaTimeModule());
            objectMapper.registerModule(new Jdk8Module());
            objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
            objectMapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
            objectMapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        }
        prettyMapper.configure(SerializationFeature.INDENT_OUTPUT, true);
    }

    private JsonHelper() {
    }

    public static String encode(Object obj, boolean prettyPrint) {
        try {
            return (prettyPrint ? prettyMapper : mapper).writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Object is not json serializable", e);
        }
    }

    public static String encode(Object obj) {
        return encode(obj, false);
    }

    /**
     * Reads a value, unwrapping errors raised from {@code @JsonCreator} constructors so that callers
     * see the original {@link FunnelException}.
     */
    public static <T> T read(String json, Class<T> clazz) {
        try {
            return mapper.readValue(json, clazz);
        } catch (JsonProcessingException e) {
            Throwable cause = e;
            while (cause != null) {
                if (cause instanceof FunnelException) {
                    throw (FunnelException) cause;
                }
                cause = cause.getCause();
            }
            throw new ValidationException("Unable to parse " + clazz.getSimpleName() + ": " + e.getOriginalMessage());
        }
    }

    public static ObjectMapper getMapper() {
        return mapper;
    }
}
