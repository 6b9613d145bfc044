package com.sqconfig.core.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sqconfig.core.cache.RemoteObjectCache;
import com.sqconfig.core.error.ObjectNotFoundException;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * In-memory stand-in for the platform web API. Routes answer with a JSON body built
 * from the request parameters, or throw to simulate errors. Unrouted GETs answer
 * 404, unrouted POSTs succeed with an empty body. Every call is recorded.
 */
public class FakeApiTransport implements ApiTransport {

    public static final String URL = "http://sq.test";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public record Call(HttpMethod method, String path, Map<String, String> params) {
        public String param(String name) {
            return params.get(name);
        }
    }

    private final Map<String, Function<Map<String, String>, Object>> routes = new ConcurrentHashMap<>();
    private final List<Call> calls = new CopyOnWriteArrayList<>();

    /**
     * A transport answering the identity calls of a platform of the given edition.
     */
    public static FakeApiTransport withEdition(String edition) {
        var transport = new FakeApiTransport();
        transport.onGet("system/status", Map.of("id", "SRV-1", "version", "10.4", "status", "UP"));
        transport.onGet("navigation/global", Map.of("version", "10.4", "edition", edition));
        return transport;
    }

    /**
     * @param responder returns a String (raw body) or any object serialized as JSON
     */
    public FakeApiTransport on(HttpMethod method, String path, Function<Map<String, String>, Object> responder) {
        routes.put(method + " " + path, responder);
        return this;
    }

    public FakeApiTransport onGet(String path, Object body) {
        return on(HttpMethod.GET, path, params -> body);
    }

    public FakeApiTransport onPost(String path, Function<Map<String, String>, Object> responder) {
        return on(HttpMethod.POST, path, responder);
    }

    public Platform platform() {
        return new Platform(URL, this, new RemoteObjectCache());
    }

    @Override
    public ApiResponse call(HttpMethod method, String path, Map<String, String> params) {
        calls.add(new Call(method, path, Map.copyOf(params)));
        var route = routes.get(method + " " + path);
        if (route == null) {
            if (method == HttpMethod.POST) {
                return new ApiResponse(204, "");
            }
            throw new ObjectNotFoundException("No route for GET " + path);
        }
        return new ApiResponse(200, body(route.apply(params)));
    }

    public List<Call> calls() {
        return List.copyOf(calls);
    }

    public List<Call> calls(HttpMethod method, String path) {
        return calls.stream().filter(c -> c.method() == method && c.path().equals(path)).toList();
    }

    public List<Call> posts(String path) {
        return calls(HttpMethod.POST, path);
    }

    public void clearCalls() {
        calls.clear();
    }

    private static String body(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof String s) {
            return s;
        }
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize fake response", e);
        }
    }
}
