package com.blackhole.sweeper;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import javax.xml.parsers.DocumentBuilderFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;

class LoggingConfigurationTest {

  private Document config;

  @BeforeEach
  void setUp() throws Exception {
    final ClassPathResource resource = new ClassPathResource("logback-spring.xml");
    assertThat(resource.exists()).isTrue();
    try (InputStream in = resource.getInputStream()) {
      config = DocumentBuilderFactory.newInstance().newDocumentBuilder().parse(in);
    }
  }

  @Test
  void jsonOutputKeepsSweeperMdcKeysAndOnlyFoldsTraceIds() {
    assertThat(textsOf("excludeMdcKeyName"))
        .containsExactlyInAnyOrder("trace_id", "span_id", "traceId", "spanId")
        .doesNotContain("scan_id", "request_id");
    assertThat(config.getElementsByTagName("mdc").getLength()).isEqualTo(1);
  }

  @Test
  void plainOutputShowsScanIdAndJsonNamesTheService() {
    assertThat(textsOf("pattern"))
        .anySatisfy(pattern -> assertThat(pattern).contains("scan=%X{scan_id:-}"))
        .anySatisfy(pattern -> assertThat(pattern).contains("\"service\":\"${appName}\""));
    assertThat(
            config
                .getElementsByTagName("springProperty")
                .item(0)
                .getAttributes()
                .getNamedItem("defaultValue")
                .getNodeValue())
        .isEqualTo("blackhole-sweeper");
  }

  @Test
  void testProfileLogsPlainTextAndOtherProfilesLogJson() {
    final NodeList profiles = config.getElementsByTagName("springProfile");
    final List<String> routes = new ArrayList<>();
    for (int i = 0; i < profiles.getLength(); i++) {
      final String name = profiles.item(i).getAttributes().getNamedItem("name").getNodeValue();
      final String appender =
          ((Element) profiles.item(i))
              .getElementsByTagName("appender-ref")
              .item(0)
              .getAttributes()
              .getNamedItem("ref")
              .getNodeValue();
      routes.add(name + "->" + appender);
    }

    assertThat(routes).containsExactly("local,test->PLAIN_CONSOLE", "!local & !test->JSON_CONSOLE");
  }

  private List<String> textsOf(String tag) {
    final NodeList nodes = config.getElementsByTagName(tag);
    final List<String> texts = new ArrayList<>();
    for (int i = 0; i < nodes.getLength(); i++) {
      texts.add(nodes.item(i).getTextContent().trim());
    }
    return texts;
  }
}
