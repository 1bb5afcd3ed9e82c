package com.phillippitts.watchkeeper.presentation.controller;

import com.phillippitts.watchkeeper.service.control.SupervisorCommands;
import com.phillippitts.watchkeeper.service.lifecycle.DaemonLifecycle;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.Map;

/**
 * Daemon-wide commands.
 */
@RestController
@RequestMapping("/daemon")
class DaemonController {

    private static final Logger LOG = LogManager.getLogger(DaemonController.class);

    private final SupervisorCommands commands;
    private final DaemonLifecycle lifecycle;

    DaemonController(SupervisorCommands commands, DaemonLifecycle lifecycle) {
        this.commands = commands;
        this.lifecycle = lifecycle;
    }

    @PostMapping("/start-all")
    ResponseEntity<Map<String, Object>> startAll() {
        commands.startAll();
        return done("start-all");
    }

    @PostMapping("/stop-all")
    ResponseEntity<Map<String, Object>> stopAll() {
        commands.stopAll();
        return done("stop-all");
    }

    @PostMapping("/reload")
    ResponseEntity<Map<String, Object>> reload() {
        commands.reload();
        return done("reload");
    }

    @PostMapping("/reap")
    ResponseEntity<Map<String, Object>> reap() {
        int reaped = commands.reap();
        return ResponseEntity.ok(Map.of(
                "command", "reap",
                "reaped", reaped,
                "timestamp", Instant.now().toString()
        ));
    }

    @PostMapping("/quit")
    ResponseEntity<Map<String, Object>> quit() {
        LOG.warn("Quit requested over HTTP");
        lifecycle.requestShutdown("quit command", 0);
        return ResponseEntity.accepted().body(Map.of(
                "command", "quit",
                "timestamp", Instant.now().toString()
        ));
    }

    private static ResponseEntity<Map<String, Object>> done(String command) {
        return ResponseEntity.ok(Map.of(
                "command", command,
                "status", "ok",
                "timestamp", Instant.now().toString()
        ));
    }
}
