package com.infomedia.abacox.storemigration.dto.connection;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Result of a connectivity check against one remote API")
public class ConnectionTestResult {
    private String api;
    private boolean success;
    private String message;
    private String error;
    /**
     * Name of the remote shop, when the API reports one.
     */
    private String shopName;

    public static ConnectionTestResult ok(String api, String shopName) {
        return ConnectionTestResult.builder()
                .api(api)
                .success(true)
                .message("Connection successful")
                .shopName(shopName)
                .build();
    }

    public static ConnectionTestResult failed(String api, String error) {
        return ConnectionTestResult.builder()
                .api(api)
                .success(false)
                .error(error)
                .build();
    }
}
