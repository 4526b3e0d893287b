package com.eyelevel.textextraction.client.monitor.config;

import com.eyelevel.textextraction.client.monitor.DocumentStatusMonitor;
import com.eyelevel.textextraction.client.monitor.StatusSource;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class StatusMonitorConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withUserConfiguration(StatusMonitorConfiguration.class)
            .withBean(WebClient.Builder.class, WebClient::builder);

    @Test
    void monitorIsWiredWhenBaseUrlIsSet() {
        contextRunner.withPropertyValues("app.monitor.base-url=http://localhost:8080",
                                         "app.monitor.max-session-duration=PT5M")
                     .run(context -> {
                         assertThat(context).hasSingleBean(DocumentStatusMonitor.class);
                         assertThat(context).hasSingleBean(StatusSource.class);
                         assertThat(context.getBean(StatusMonitorProperties.class).toSettings().maxSessionDuration())
                                 .isEqualTo(Duration.ofMinutes(5));
                     });
    }

    @Test
    void monitorIsAbsentWithoutBaseUrl() {
        contextRunner.run(context -> assertThat(context).doesNotHaveBean(DocumentStatusMonitor.class));
    }
}
