package fr.lapetina.slack;

import fr.lapetina.slack.domain.exception.SlackClientConfigurationException;
import fr.lapetina.slack.domain.retry.RetryHandler;
import fr.lapetina.slack.infrastructure.config.SlackClientConfig;
import fr.lapetina.slack.rtm.RtmClient;
import fr.lapetina.slack.socketmode.SocketModeClient;
import fr.lapetina.slack.support.FakeWebSocketConnector;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SlackClientFactoryTest {

    @Test
    @DisplayName("should build the retry chain from configuration")
    void shouldBuildRetryChain() {
        try (SlackClientFactory factory = SlackClientFactory.create("slack-client-test.yaml")) {
            assertThat(factory.getRetryHandlers())
                    .extracting(RetryHandler::getName)
                    .containsExactly("connection-error", "rate-limit", "server-error");
            assertThat(factory.getRetryHandlers())
                    .allSatisfy(handler -> assertThat(handler.getMaxRetryCount()).isEqualTo(2));
            assertThat(factory.getConfig().getMetrics().getPrefix()).isEqualTo("slack_test");
        }
    }

    @Test
    @DisplayName("should reject an unknown retry handler name")
    void shouldRejectUnknownHandler() {
        SlackClientConfig config = new SlackClientConfig();
        config.getRetry().setHandlers(List.of("connection-error", "teleport"));

        assertThatThrownBy(() -> SlackClientFactory.fromConfig(config))
                .isInstanceOf(SlackClientConfigurationException.class)
                .hasMessageContaining("teleport");
    }

    @Test
    @DisplayName("should create clients sharing the configuration")
    void shouldCreateClients() {
        try (SlackClientFactory factory = SlackClientFactory.fromConfig(new SlackClientConfig(), new FakeWebSocketConnector())) {
            assertThat(factory.webClient("xoxb-1").getBaseUrl()).isEqualTo("https://slack.com/api/");
            assertThat(factory.webhookClient("https://hooks.slack.com/services/T/B/X").getUrl())
                    .hasHost("hooks.slack.com");

            SocketModeClient socketMode = factory.socketModeClient("xapp-1", "xoxb-1");
            RtmClient rtm = factory.rtmClient("xoxb-1");
            assertThat(socketMode.isConnected()).isFalse();
            assertThat(rtm.getWebClient()).isNotNull();

            factory.close();
            assertThat(socketMode.isClosed()).isTrue();
            assertThat(rtm.isClosed()).isTrue();
        }
    }
}
