package com.reelindex.controller;

import com.reelindex.service.AdminService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Maintenance actions. Everything except {@code GET status} answers 403 while
 * demo mode is on.
 */
@RestController
@RequestMapping("/api/admin")
public class AdminController {

    private final AdminService adminService;

    public AdminController(AdminService adminService) {
        this.adminService = adminService;
    }

    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> status() {
        boolean demo = adminService.isDemoMode();
        return ResponseEntity.ok(Map.of("demoMode", demo, "adminEnabled", !demo));
    }

    @PostMapping("/reset-failed-jobs")
    public ResponseEntity<Map<String, Object>> resetFailedJobs() {
        return ResponseEntity.ok(Map.of("success", true, "resetCount", adminService.resetFailedJobs()));
    }

    @PostMapping("/reset-processing-jobs")
    public ResponseEntity<Map<String, Object>> resetProcessingJobs() {
        return ResponseEntity.ok(Map.of("success", true, "resetCount", adminService.resetProcessingJobs()));
    }

    @PostMapping("/purge-deleted")
    public ResponseEntity<Map<String, Object>> purgeDeleted() {
        return ResponseEntity.ok(Map.of("success", true, "purgedCount", adminService.purgeDeleted()));
    }

    @PostMapping("/purge-orphans")
    public ResponseEntity<Map<String, Object>> purgeOrphans() {
        return ResponseEntity.ok(Map.of("success", true, "purgedCount", adminService.purgeOrphans()));
    }

    @DeleteMapping("/database")
    public ResponseEntity<Map<String, Object>> wipeDatabase() {
        return ResponseEntity.ok(Map.of("success", true, "wiped", adminService.wipeDatabase()));
    }
}
