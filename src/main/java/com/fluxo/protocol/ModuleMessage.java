package com.fluxo.protocol;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One message across the host/runtime boundary.
 *
 * <pre>
 * { "type": "module-request",  "path": "/lib/math.fxm" }
 * { "type": "module-response", "path": "/lib/math.fxm", "code": "..." }
 * { "type": "module-error",    "path": "/lib/math.fxm", "error": "Module not found: ..." }
 * { "type": "execute",         "code": "..." }
 * </pre>
 *
 * Responses echo the request path exactly; correlation is by string equality.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ModuleMessage {
    private final MessageType type;
    private final String path;
    private final String code;
    private final String error;

    @JsonCreator
    public ModuleMessage(@JsonProperty("type") MessageType type,
                         @JsonProperty("path") String path,
                         @JsonProperty("code") String code,
                         @JsonProperty("error") String error) {
        this.type = type;
        this.path = path;
        this.code = code;
        this.error = error;
    }

    public static ModuleMessage request(String path) {
        return new ModuleMessage(MessageType.MODULE_REQUEST, path, null, null);
    }

    public static ModuleMessage response(String path, String code) {
        return new ModuleMessage(MessageType.MODULE_RESPONSE, path, code, null);
    }

    public static ModuleMessage error(String path, String error) {
        return new ModuleMessage(MessageType.MODULE_ERROR, path, null, error);
    }

    public static ModuleMessage execute(String code) {
        return new ModuleMessage(MessageType.EXECUTE, null, code, null);
    }

    @JsonProperty("type") public MessageType type() { return type; }
    @JsonProperty("path") public String path() { return path; }
    @JsonProperty("code") public String code() { return code; }
    @JsonProperty("error") public String error() { return error; }

    @Override
    public String toString() {
        return type.wireName() + (path != null ? " " + path : "");
    }
}
