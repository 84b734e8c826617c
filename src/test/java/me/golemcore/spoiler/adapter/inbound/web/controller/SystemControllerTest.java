package me.golemcore.spoiler.adapter.inbound.web.controller;

import me.golemcore.spoiler.adapter.inbound.web.dto.SystemHealthResponse;
import me.golemcore.spoiler.port.inbound.ChannelPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.info.BuildProperties;
import org.springframework.http.HttpStatus;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SystemControllerTest {

    private ChannelPort telegramPort;
    private ObjectProvider<BuildProperties> buildPropertiesProvider;
    private SystemController controller;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        telegramPort = mock(ChannelPort.class);
        when(telegramPort.getChannelType()).thenReturn("telegram");
        when(telegramPort.isRunning()).thenReturn(true);
        buildPropertiesProvider = mock(ObjectProvider.class);

        controller = new SystemController(List.of(telegramPort), buildPropertiesProvider);
    }

    @Test
    void shouldReturnHealthStatus() {
        StepVerifier.create(controller.health())
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    SystemHealthResponse body = response.getBody();
                    assertNotNull(body);
                    assertEquals("UP", body.getStatus());
                    assertTrue(body.getUptimeMs() >= 0);
                    assertEquals(1, body.getChannels().size());
                    assertTrue(body.getChannels().get("telegram").isRunning());
                })
                .verifyComplete();
    }

    @Test
    void shouldReportStoppedChannel() {
        when(telegramPort.isRunning()).thenReturn(false);

        StepVerifier.create(controller.health())
                .assertNext(response -> assertFalse(response.getBody().getChannels().get("telegram").isRunning()))
                .verifyComplete();
    }

    @Test
    void shouldReturnDevVersionWhenBuildPropertiesAbsent() {
        StepVerifier.create(controller.health())
                .assertNext(response -> assertEquals("dev", response.getBody().getVersion()))
                .verifyComplete();
    }

    @Test
    void shouldReturnVersionFromBuildProperties() {
        Properties props = new Properties();
        props.setProperty("version", "1.2.3");
        when(buildPropertiesProvider.getIfAvailable()).thenReturn(new BuildProperties(props));

        StepVerifier.create(controller.health())
                .assertNext(response -> assertEquals("1.2.3", response.getBody().getVersion()))
                .verifyComplete();
    }
}
