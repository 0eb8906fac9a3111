package org.calista.r3.store;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public final class R3Event {

    public static final String QUERY = "QUERY";
    public static final String RESULT = "RESULT";
    public static final String SNAPSHOT = "SNAPSHOT";

    public String type;        // QUERY, RESULT, SNAPSHOT
    public long tsEpochMs;
    public String sessionId;
    public String text;        // query text / result summary / snapshot file

    public static R3Event of(String type, String sessionId, String text, long tsEpochMs) {
        R3Event e = new R3Event();
        e.type = type;
        e.sessionId = sessionId;
        e.text = text;
        e.tsEpochMs = tsEpochMs;
        return e;
    }
}
