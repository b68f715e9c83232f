package com.agentrelay.test;

import com.agentrelay.api.dto.PoolStatusDTO;
import com.agentrelay.domain.session.model.valobj.SessionPoolSettings;
import com.agentrelay.domain.session.service.AgentSessionPool;
import com.agentrelay.test.support.FakeAgentRuntimeGateway;
import com.agentrelay.test.support.MutableClock;
import com.agentrelay.trigger.http.PoolStatusController;
import org.junit.jupiter.api.Test;
import org.springframework.http.ResponseEntity;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class PoolStatusControllerTest {

    @Test
    public void shouldReportUnavailableUntilReadyThenPoolStatistics() {
        MutableClock clock = new MutableClock(10_000L);
        AgentSessionPool pool = new AgentSessionPool(new FakeAgentRuntimeGateway(),
                new SessionPoolSettings(2, 60_000L, 0), Runnable::run, clock);
        PoolStatusController controller = new PoolStatusController(pool, clock);

        ResponseEntity<PoolStatusDTO> before = controller.ready();
        assertEquals(503, before.getStatusCode().value());
        assertFalse(before.getBody().isReady());

        pool.topUp(2).join();
        pool.acquire(null);
        clock.advance(1_500L);
        controller.markReady();

        ResponseEntity<PoolStatusDTO> after = controller.ready();
        assertEquals(200, after.getStatusCode().value());
        PoolStatusDTO status = after.getBody();
        assertTrue(status.isReady());
        assertEquals(1_500L, status.getUptimeMs());
        assertEquals(2, status.getPoolSize());
        assertEquals(1, status.getAvailable());
        assertEquals(1, status.getInUse());
        assertEquals("ok", controller.healthz());
    }
}
