package com.infomedia.abacox.storemigration.controller;

import com.infomedia.abacox.storemigration.component.sourceapi.SourceApi;
import com.infomedia.abacox.storemigration.component.targetapi.TargetApi;
import com.infomedia.abacox.storemigration.dto.connection.ConnectionTestResult;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RequiredArgsConstructor
@RestController
@Tag(name = "Connection", description = "Remote API connectivity")
@RequestMapping("/api/connection")
public class ConnectionController {

    private final SourceApi sourceApi;
    private final TargetApi targetApi;

    @GetMapping(value = "/test", produces = MediaType.APPLICATION_JSON_VALUE)
    public List<ConnectionTestResult> testConnections() {
        return List.of(sourceApi.testConnection(), targetApi.testConnection());
    }
}
