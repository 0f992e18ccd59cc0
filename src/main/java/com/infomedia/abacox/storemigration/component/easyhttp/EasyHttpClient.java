package com.infomedia.abacox.storemigration.component.easyhttp;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import okhttp3.Credentials;
import okhttp3.OkHttpClient;
import okhttp3.logging.HttpLoggingInterceptor;

import java.util.concurrent.TimeUnit;

/**
 * A configurable factory for EasyHttp request builders bound to one remote API.
 * An instance holds the OkHttpClient configuration (timeouts, interceptors, credentials)
 * and the Jackson mapper used for request and response bodies.
 */
public class EasyHttpClient {

    private final OkHttpClient okHttpClient;
    private final ObjectMapper objectMapper;
    private final String baseUrl;

    private EasyHttpClient(OkHttpClient okHttpClient, ObjectMapper objectMapper, String baseUrl) {
        this.okHttpClient = okHttpClient;
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl;
    }

    // --- Accessors ---
    public OkHttpClient getOkHttpClient() {
        return okHttpClient;
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    /**
     * Starts building a request for a path relative to the configured base URL.
     * Leading slashes on the path are ignored so "customers/" and "/customers/" resolve alike.
     */
    public EasyHttp path(String path) {
        if (baseUrl == null) {
            throw new IllegalStateException("No base URL configured for this client");
        }
        String cleanPath = path.startsWith("/") ? path.substring(1) : path;
        String cleanBase = baseUrl.endsWith("/") ? baseUrl : baseUrl + "/";
        return new EasyHttp(cleanBase + cleanPath, this);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Defines the logging verbosity.
     */
    public enum LoggingLevel {
        NONE, BASIC, HEADERS, BODY
    }

    /**
     * Builder for creating a custom EasyHttpClient.
     */
    public static class Builder {
        private final OkHttpClient.Builder clientBuilder;
        private final HttpLoggingInterceptor loggingInterceptor;
        private ObjectMapper customMapper;
        private String baseUrl;

        public Builder() {
            this.clientBuilder = new OkHttpClient.Builder()
                .connectTimeout(10, TimeUnit.SECONDS)
                .writeTimeout(10, TimeUnit.SECONDS)
                .readTimeout(30, TimeUnit.SECONDS);

            this.loggingInterceptor = new HttpLoggingInterceptor();
            this.loggingInterceptor.setLevel(HttpLoggingInterceptor.Level.NONE);
            this.loggingInterceptor.redactHeader("Authorization");
            this.clientBuilder.addInterceptor(loggingInterceptor);
        }

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder connectTimeout(long timeout, TimeUnit unit) {
            clientBuilder.connectTimeout(timeout, unit);
            return this;
        }

        public Builder readTimeout(long timeout, TimeUnit unit) {
            clientBuilder.readTimeout(timeout, unit);
            return this;
        }

        /**
         * Sends HTTP Basic credentials and JSON accept headers on every request.
         */
        public Builder basicAuth(String username, String password) {
            String credentials = Credentials.basic(username, password);
            clientBuilder.addInterceptor(chain -> chain.proceed(chain.request().newBuilder()
                    .header("Authorization", credentials)
                    .header("Accept", "application/json")
                    .build()));
            return this;
        }

        /**
         * Sets the logging level for HTTP requests and responses.
         */
        public Builder loggingLevel(LoggingLevel level) {
            HttpLoggingInterceptor.Level okhttpLevel;
            switch (level) {
                case BASIC:   okhttpLevel = HttpLoggingInterceptor.Level.BASIC;   break;
                case HEADERS: okhttpLevel = HttpLoggingInterceptor.Level.HEADERS; break;
                case BODY:    okhttpLevel = HttpLoggingInterceptor.Level.BODY;    break;
                case NONE:
                default:      okhttpLevel = HttpLoggingInterceptor.Level.NONE;    break;
            }
            this.loggingInterceptor.setLevel(okhttpLevel);
            return this;
        }

        /**
         * Provide a custom Jackson ObjectMapper for this client instance.
         */
        public Builder objectMapper(ObjectMapper mapper) {
            this.customMapper = mapper;
            return this;
        }

        public EasyHttpClient build() {
            ObjectMapper mapper = (this.customMapper != null) ? this.customMapper.copy() : new ObjectMapper();
            mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
            mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
            mapper.findAndRegisterModules();
            mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
            return new EasyHttpClient(clientBuilder.build(), mapper, baseUrl);
        }
    }
}
