package com.acme.eventlog.core;

import com.fasterxml.jackson.databind.ObjectMapper;

public final class Jsons {
    private static final ObjectMapper M = new ObjectMapper().findAndRegisterModules();

    private Jsons() {
    }

    public static String toJson(Object o) {
        try {
            return M.writeValueAsString(o);
        } catch(Exception e) {
            throw new IllegalArgumentException("Payload is not serializable: " + o.getClass().getName(), e);
        }
    }
}
