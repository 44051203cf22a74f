package com.prmanager.backend.global.error;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public class ProblemException extends RuntimeException {

    private final ErrorKind kind;
    private final String code;
    private final String detail;
    private final Map<String, Object> attributes;

    public ProblemException(ErrorKind kind, String code, String detail) {
        this(kind, code, detail, Map.of());
    }

    public ProblemException(ErrorKind kind, String code, String detail, Map<String, Object> attributes) {
        super(detail != null && !detail.isBlank() ? detail : code);
        if (kind == null) {
            throw new IllegalArgumentException("ProblemException kind must not be null");
        }
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("ProblemException code must not be blank");
        }
        this.kind = kind;
        this.code = code;
        this.detail = (detail != null && !detail.isBlank()) ? detail : code;
        this.attributes = attributes == null || attributes.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public ErrorKind getKind() {
        return kind;
    }

    public String getCode() {
        return code;
    }

    public String getDetailMessage() {
        return detail;
    }

    public Map<String, Object> getAttributes() {
        return attributes;
    }

    public Object getAttribute(String name) {
        return attributes.get(name);
    }
}
