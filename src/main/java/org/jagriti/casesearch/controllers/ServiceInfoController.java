package org.jagriti.casesearch.controllers;

import org.jagriti.casesearch.config.ApiInfoProperties;

import java.util.LinkedHashMap;
import java.util.Map;

import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class ServiceInfoController {

    private final ApiInfoProperties apiInfo;

    @GetMapping("/")
    public ResponseEntity<Map<String, String>> root() {
        final Map<String, String> body = new LinkedHashMap<>();
        body.put("message", "Welcome to " + apiInfo.title());
        body.put("version", apiInfo.version());
        body.put("docs", "/swagger-ui.html");
        body.put("description", apiInfo.description());
        return ResponseEntity.ok(body);
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        return ResponseEntity.ok(Map.of("status", "healthy", "service", "jagriti-api"));
    }
}
