package com.phillippitts.watchkeeper.presentation.controller;

import com.phillippitts.watchkeeper.config.properties.WatchkeeperProperties;
import com.phillippitts.watchkeeper.domain.WatcherStatus;
import com.phillippitts.watchkeeper.service.control.SupervisorCommands;
import com.phillippitts.watchkeeper.service.watcher.WatcherSpec;
import jakarta.validation.Valid;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Per-watcher control commands. Busy and unknown-watcher errors are mapped by
 * {@code GlobalExceptionHandler}.
 */
@RestController
@RequestMapping("/watchers")
class WatcherController {

    private static final Logger LOG = LogManager.getLogger(WatcherController.class);

    private final SupervisorCommands commands;

    WatcherController(SupervisorCommands commands) {
        this.commands = commands;
    }

    @GetMapping
    List<WatcherStatus> list() {
        return commands.statuses();
    }

    @GetMapping("/{name}")
    WatcherStatus get(@PathVariable String name) {
        return commands.status(name);
    }

    @PostMapping
    ResponseEntity<WatcherStatus> add(@Valid @RequestBody WatchkeeperProperties.WatcherProperties body,
                                      @RequestParam(defaultValue = "true") boolean start) {
        LOG.info("Add watcher {} requested (start={})", body.getName(), start);
        WatcherStatus status = commands.add(WatcherSpec.from(body), start);
        return ResponseEntity.status(HttpStatus.CREATED).body(status);
    }

    @DeleteMapping("/{name}")
    ResponseEntity<Void> remove(@PathVariable String name) {
        LOG.info("Remove watcher {} requested", name);
        commands.remove(name);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{name}/start")
    WatcherStatus start(@PathVariable String name) {
        return commands.start(name);
    }

    @PostMapping("/{name}/stop")
    WatcherStatus stop(@PathVariable String name) {
        return commands.stop(name);
    }

    @PostMapping("/{name}/restart")
    WatcherStatus restart(@PathVariable String name) {
        return commands.restart(name);
    }

    @PostMapping("/{name}/incr")
    WatcherStatus incr(@PathVariable String name, @RequestParam(defaultValue = "1") int count) {
        return commands.incr(name, count);
    }

    @PostMapping("/{name}/decr")
    WatcherStatus decr(@PathVariable String name, @RequestParam(defaultValue = "1") int count) {
        return commands.decr(name, count);
    }
}
