package com.offy.competition.controller;

import com.offy.competition.dto.LogScreenTimeRequest;
import com.offy.competition.dto.ScreenTimeLogResponse;
import com.offy.competition.model.ScreenTimeLog;
import com.offy.competition.service.AppCatalog;
import com.offy.competition.service.ScreenTimeLogService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/screen-time")
public class ScreenTimeController {

    private static final Logger logger = LoggerFactory.getLogger(ScreenTimeController.class);

    private final ScreenTimeLogService screenTimeLogService;
    private final AppCatalog appCatalog;

    @Autowired
    public ScreenTimeController(ScreenTimeLogService screenTimeLogService, AppCatalog appCatalog) {
        this.screenTimeLogService = screenTimeLogService;
        this.appCatalog = appCatalog;
    }

    /**
     * Log (or overwrite) the caller's minutes for one app and day.
     * POST /api/v1/screen-time
     */
    @PostMapping
    public ResponseEntity<ScreenTimeLogResponse> logScreenTime(
            @RequestHeader("X-User-Id") Long userId,
            @Valid @RequestBody LogScreenTimeRequest request) {

        logger.info("Received POST request to log screen time - userId: {}, app: {}, date: {}, minutes: {}",
            userId, request.getAppName(), request.getDate(), request.getMinutes());

        try {
            ScreenTimeLog log = screenTimeLogService.logScreenTime(
                userId, request.getAppName(), request.getDate(), request.getMinutes());
            return ResponseEntity.ok(ScreenTimeLogResponse.from(log));
        } catch (Exception e) {
            logger.error("Error logging screen time - userId: {}, error: {}", userId, e.getMessage(), e);
            throw e;
        }
    }

    @GetMapping("/apps")
    public ResponseEntity<List<String>> allowedApps() {
        return ResponseEntity.ok(appCatalog.allowedApps());
    }
}
