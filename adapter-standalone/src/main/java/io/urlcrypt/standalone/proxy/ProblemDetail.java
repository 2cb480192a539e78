package io.urlcrypt.standalone.proxy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * RFC 9457 Problem Details bodies for errors raised by the proxy itself.
 *
 * <p>
 * Decryption never produces one of these: values that do not decrypt are
 * forwarded unchanged. Only backend failures and rejected methods do.
 *
 * <pre>{@code
 * {
 *   "type": "urn:url-crypt:proxy:backend-unreachable",
 *   "title": "Backend Unreachable",
 *   "status": 502,
 *   "detail": "Connection refused by http://127.0.0.1:8080/orders/42",
 *   "instance": "/orders/42"
 * }
 * }</pre>
 */
public final class ProblemDetail {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final String URN_BACKEND_UNREACHABLE = "urn:url-crypt:proxy:backend-unreachable";
    static final String URN_GATEWAY_TIMEOUT = "urn:url-crypt:proxy:gateway-timeout";
    static final String URN_METHOD_NOT_ALLOWED = "urn:url-crypt:proxy:method-not-allowed";
    static final String URN_INTERNAL_ERROR = "urn:url-crypt:proxy:internal-error";

    private ProblemDetail() {
        // utility class
    }

    /** 502: backend unreachable or connection refused. */
    public static JsonNode backendUnreachable(String detail, String instancePath) {
        return build(URN_BACKEND_UNREACHABLE, "Backend Unreachable", 502, detail, instancePath);
    }

    /** 504: backend read timeout exceeded. */
    public static JsonNode gatewayTimeout(String detail, String instancePath) {
        return build(URN_GATEWAY_TIMEOUT, "Gateway Timeout", 504, detail, instancePath);
    }

    /** 405: HTTP method outside the proxied set. */
    public static JsonNode methodNotAllowed(String detail, String instancePath) {
        return build(URN_METHOD_NOT_ALLOWED, "Method Not Allowed", 405, detail, instancePath);
    }

    /** 500: unexpected failure inside the proxy. */
    public static JsonNode internalError(String detail, String instancePath) {
        return build(URN_INTERNAL_ERROR, "Internal Server Error", 500, detail, instancePath);
    }

    /**
     * @param instancePath request path, may be null
     */
    static JsonNode build(String type, String title, int status, String detail, String instancePath) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("type", type);
        node.put("title", title);
        node.put("status", status);
        node.put("detail", detail);
        if (instancePath != null) {
            node.put("instance", instancePath);
        } else {
            node.putNull("instance");
        }
        return node;
    }
}
