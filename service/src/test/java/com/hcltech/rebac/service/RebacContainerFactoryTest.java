package com.hcltech.rebac.service;

import com.hcltech.rebac.common.IEnvGetter;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class RebacContainerFactoryTest {

    @Test
    void wiresAWorkingContainerFromEnvironment() throws Exception {
        IEnvGetter env = IEnvGetter.fromMap(Map.of(RebacConfig.WORKER_THREADS, "2", RebacConfig.MAX_DEPTH, "5"));

        try (RebacContainer container = RebacContainerFactory.create(env).valueOrThrow()) {
            assertEquals(new RebacConfig(2, 5, "user"), container.config());
            assertEquals(0, container.graph().edgeCount());

            String grant = "{\"dst\":{\"namespace\":\"files\",\"id\":\"foo.pdf\",\"relation\":\"read\"}}";
            container.executor().submit("Grant", grant, "alice").get(10, TimeUnit.SECONDS).valueOrThrow();

            assertEquals(1, container.graph().edgeCount());
            assertEquals("{\"permitted\":true}", container.handler().handle("IsPermitted", grant, "alice").valueOrThrow());
        }
    }

    @Test
    void eachContainerHasItsOwnGraph() {
        try (RebacContainer a = RebacContainerFactory.create(IEnvGetter.fromMap(Map.of())).valueOrThrow();
             RebacContainer b = RebacContainerFactory.create(IEnvGetter.fromMap(Map.of())).valueOrThrow()) {
            assertNotSame(a.graph(), b.graph());
        }
    }

    @Test
    void badConfigurationIsAnError() {
        var errors = RebacContainerFactory.create(IEnvGetter.fromMap(Map.of(RebacConfig.WORKER_THREADS, "0"))).errorsOrThrow();

        assertEquals(1, errors.size());
        assertTrue(errors.get(0).startsWith("Invalid configuration: "), errors.get(0));
        assertTrue(errors.get(0).contains(RebacConfig.WORKER_THREADS), errors.get(0));
    }
}
