// Copyright (c) 2024 Broadcom. All Rights Reserved.
// The term "Broadcom" refers to Broadcom Inc. and/or its subsidiaries.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
//
// If you have any questions regarding licensing, please contact us at
// info@rabbitmq.com.
package io.warren.client.metrics;

import static io.warren.client.impl.TestUtils.waitAtMost;
import static org.assertj.core.api.Assertions.assertThat;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import io.warren.client.DispatchOutcome;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;

public class MicrometerMetricsCollectorTest {

  @Test
  void simple() {
    SimpleMeterRegistry registry = new SimpleMeterRegistry();
    MetricsCollector collector = new MicrometerMetricsCollector(registry);

    assertThat(registry.get("warren.connections").gauge().value()).isZero();
    collector.openConnection();
    collector.openConnection();
    assertThat(registry.get("warren.connections").gauge().value()).isEqualTo(2);
    collector.closeConnection();
    assertThat(registry.get("warren.connections").gauge().value()).isEqualTo(1);

    assertThat(registry.get("warren.connection_recoveries").counter().count()).isZero();
    collector.recoverConnection();
    assertThat(registry.get("warren.connection_recoveries").counter().count()).isEqualTo(1.0);

    assertThat(registry.get("warren.consumers").gauge().value()).isZero();
    collector.openConsumer();
    collector.openConsumer();
    collector.closeConsumer();
    assertThat(registry.get("warren.consumers").gauge().value()).isEqualTo(1);

    collector.publish();
    collector.publish();
    assertThat(registry.get("warren.published").counter().count()).isEqualTo(2.0);

    collector.consume();
    collector.consume();
    collector.consume();
    assertThat(registry.get("warren.consumed").counter().count()).isEqualTo(3.0);

    collector.consumeOutcome(DispatchOutcome.HANDLED);
    collector.consumeOutcome(DispatchOutcome.HANDLED);
    collector.consumeOutcome(DispatchOutcome.NOT_HANDLED);
    collector.consumeOutcome(DispatchOutcome.FAILED);
    assertThat(registry.get("warren.consumed_handled").counter().count()).isEqualTo(2.0);
    assertThat(registry.get("warren.consumed_not_handled").counter().count()).isEqualTo(1.0);
    assertThat(registry.get("warren.consumed_failed").counter().count()).isEqualTo(1.0);
  }

  @Test
  void prefixAndTags() {
    SimpleMeterRegistry registry = new SimpleMeterRegistry();
    MetricsCollector collector =
        new MicrometerMetricsCollector(registry, "billing", "service", "invoicing");

    collector.publish();

    assertThat(registry.get("billing.published").tag("service", "invoicing").counter().count())
        .isEqualTo(1.0);
  }

  @Test
  void prometheus() {
    PrometheusMeterRegistry registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
    MetricsCollector collector = new MicrometerMetricsCollector(registry);

    collector.openConnection();
    collector.openConnection();
    collector.closeConnection();
    collector.recoverConnection();

    collector.openConsumer();

    collector.publish();
    collector.publish();

    collector.consume();
    collector.consumeOutcome(DispatchOutcome.FAILED);

    Stream.of(
            "# TYPE warren_connections gauge",
            "warren_connections 1.0",
            "# TYPE warren_consumers gauge",
            "warren_consumers 1.0",
            "# TYPE warren_connection_recoveries_total counter",
            "warren_connection_recoveries_total 1.0",
            "# TYPE warren_published_total counter",
            "warren_published_total 2.0",
            "# TYPE warren_consumed_total counter",
            "warren_consumed_total 1.0",
            "# TYPE warren_consumed_failed_total counter",
            "warren_consumed_failed_total 1.0")
        .forEach(expected -> waitAtMost(() -> registry.scrape().contains(expected)));
  }
}
