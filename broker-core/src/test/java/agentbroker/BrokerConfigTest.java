package agentbroker;

import agentbroker.policy.PolicyViolation;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class BrokerConfigTest {

  @Test
  void defaults() {
    BrokerConfig config = new BrokerConfig();

    assertEquals(10, config.getHistoryLimit());
    assertEquals("broker", config.getSystemAgentId());
    assertEquals(1000L, config.getPollIntervalMs());
  }

  @Test
  void settersChainAndValidate() {
    BrokerConfig config = new BrokerConfig()
        .setHistoryLimit(0)
        .setSystemAgentId("gatekeeper")
        .setPollIntervalMs(50);

    assertEquals(0, config.getHistoryLimit());
    assertEquals("gatekeeper", config.getSystemAgentId());
    assertEquals(50L, config.getPollIntervalMs());
    assertThrows(IllegalArgumentException.class, () -> config.setHistoryLimit(-1));
    assertThrows(IllegalArgumentException.class, () -> config.setSystemAgentId(" "));
    assertThrows(IllegalArgumentException.class, () -> config.setPollIntervalMs(0));
  }

  @Test
  void customSystemAgentSignsErrorReplies() {
    MessageBroker broker = MessageBroker.builder()
        .config(new BrokerConfig().setSystemAgentId("gatekeeper"))
        .build();
    MessageEnvelope original = MessageEnvelope.create("A", "B", "x");

    MessageEnvelope error = broker.createErrorResponse(original,
        List.of(new PolicyViolation("p", "r")));

    assertEquals("gatekeeper", error.sender());
    assertEquals(MessageType.ERROR, error.messageType());
  }
}
