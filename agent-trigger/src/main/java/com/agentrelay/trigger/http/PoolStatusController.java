package com.agentrelay.trigger.http;

import com.agentrelay.api.dto.PoolStatusDTO;
import com.agentrelay.domain.session.model.valobj.SessionPoolSnapshot;
import com.agentrelay.domain.session.service.AgentSessionPool;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;

/**
 * 存活与就绪探针。
 */
@Slf4j
@RestController
public class PoolStatusController {

    private final AgentSessionPool sessionPool;
    private final Clock clock;
    private final long startedAtMs;
    private volatile boolean ready;

    public PoolStatusController(AgentSessionPool sessionPool, Clock clock) {
        this.sessionPool = sessionPool;
        this.clock = clock;
        this.startedAtMs = clock.millis();
    }

    @EventListener(ApplicationReadyEvent.class)
    public void markReady() {
        ready = true;
        log.info("SERVER_READY startupMs={}", clock.millis() - startedAtMs);
    }

    @GetMapping(value = "/healthz", produces = MediaType.TEXT_PLAIN_VALUE)
    public String healthz() {
        return "ok";
    }

    @GetMapping(value = "/ready", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<PoolStatusDTO> ready() {
        SessionPoolSnapshot snapshot = sessionPool.snapshot();
        PoolStatusDTO status = new PoolStatusDTO();
        status.setReady(ready);
        status.setUptimeMs(clock.millis() - startedAtMs);
        status.setPoolSize(snapshot.size());
        status.setAvailable(snapshot.available());
        status.setInUse(snapshot.inUse());
        return ResponseEntity.status(ready ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE).body(status);
    }
}
