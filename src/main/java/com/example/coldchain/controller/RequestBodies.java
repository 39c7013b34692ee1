package com.example.coldchain.controller;

import java.util.Map;

final class RequestBodies {

    static final String DEFAULT_ACTOR = "user";

    private RequestBodies() {
    }

    /** The "actor" field when it is a non-blank string, otherwise {@value #DEFAULT_ACTOR}. */
    static String actor(Map<String, Object> body) {
        if (body == null) return DEFAULT_ACTOR;
        Object actor = body.get("actor");
        return actor instanceof String s && !s.isBlank() ? s : DEFAULT_ACTOR;
    }
}
