package com.infomedia.abacox.storemigration.component.easyhttp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

import java.io.IOException;

/**
 * A fluent builder for constructing and executing a single HTTP request.
 * An instance of this class is created via an EasyHttpClient.
 */
public class EasyHttp {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final EasyHttpClient client;
    private final Request.Builder requestBuilder;
    private final HttpUrl.Builder urlBuilder;
    private RequestBody requestBody;

    // Package-private constructor, should only be created by EasyHttpClient
    EasyHttp(String url, EasyHttpClient client) {
        this.client = client;
        this.requestBuilder = new Request.Builder();
        HttpUrl parsedUrl = HttpUrl.parse(url);
        if (parsedUrl == null) {
            throw new IllegalArgumentException("Invalid URL: " + url);
        }
        this.urlBuilder = parsedUrl.newBuilder();
    }

    public EasyHttp queryParam(String name, Object value) {
        if (value != null) {
            urlBuilder.addQueryParameter(name, String.valueOf(value));
        }
        return this;
    }

    public EasyHttp json(Object object) {
        try {
            String jsonString = client.getObjectMapper().writeValueAsString(object);
            this.requestBody = RequestBody.create(jsonString, JSON);
            return this;
        } catch (JsonProcessingException e) {
            throw new EasyHttpException("Failed to serialize object to JSON", e);
        }
    }

    // --- Execution Methods (Terminal) ---

    private Request build(String method) {
        RequestBody body = requestBody;
        if (body == null && ("POST".equals(method) || "PUT".equals(method) || "PATCH".equals(method))) {
            body = RequestBody.create(new byte[0], JSON);
        }
        return requestBuilder.url(urlBuilder.build()).method(method, body).build();
    }

    public ResponseExecutor get() { return new ResponseExecutor(build("GET"), client); }
    public ResponseExecutor post() { return new ResponseExecutor(build("POST"), client); }
    public ResponseExecutor put() { return new ResponseExecutor(build("PUT"), client); }

    /**
     * Inner class to handle synchronous response processing.
     */
    public static class ResponseExecutor {
        private final Request request;
        private final EasyHttpClient client;

        private ResponseExecutor(Request request, EasyHttpClient client) {
            this.request = request;
            this.client = client;
        }

        private Response execute() throws EasyHttpException {
            try {
                return client.getOkHttpClient().newCall(request).execute();
            } catch (IOException e) {
                throw new EasyHttpException("Network request failed: " + request.method() + " " + request.url(), e);
            }
        }

        private String asString() throws EasyHttpException {
            try (Response response = execute()) {
                String bodyString = response.body() != null ? response.body().string() : "";
                if (!response.isSuccessful()) {
                    throw new EasyHttpException(response.message(), response.code(), bodyString,
                            parseRetryAfter(response.header("Retry-After")));
                }
                return bodyString;
            } catch (IOException e) {
                throw new EasyHttpException("Failed to read response body", e);
            }
        }

        /**
         * Reads the body as a JSON tree. An empty body yields an empty object.
         */
        public JsonNode asJsonNode() throws EasyHttpException {
            String bodyString = asString();
            if (bodyString == null || bodyString.isBlank()) {
                return client.getObjectMapper().createObjectNode();
            }
            try {
                return client.getObjectMapper().readTree(bodyString);
            } catch (JsonProcessingException e) {
                throw new EasyHttpException("Failed to parse JSON response from " + request.url(), e);
            }
        }

        public ObjectNode asObjectNode() throws EasyHttpException {
            JsonNode node = asJsonNode();
            if (!node.isObject()) {
                throw new EasyHttpException("Expected a JSON object from " + request.url() + " but got "
                        + node.getNodeType(), (Throwable) null);
            }
            return (ObjectNode) node;
        }
    }

    /**
     * Parses a Retry-After header given in seconds. HTTP-date values are not supported and yield null.
     */
    static Integer parseRetryAfter(String headerValue) {
        if (headerValue == null || headerValue.isBlank()) {
            return null;
        }
        try {
            int seconds = (int) Math.ceil(Double.parseDouble(headerValue.trim()));
            return seconds > 0 ? seconds : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
