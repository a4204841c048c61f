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
package io.warren.client.impl;

import io.warren.client.BackOffDelayPolicy;
import io.warren.client.ConnectionFactory;
import io.warren.client.ConsumerErrorHandler;
import io.warren.client.Environment;
import io.warren.client.Serializer;
import io.warren.client.TypeNameSerializer;
import io.warren.client.metrics.MetricsCollector;
import io.warren.client.metrics.NoOpMetricsCollector;
import io.warren.client.serialization.GsonSerializer;
import java.time.Duration;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;

/** Builder to create an {@link Environment} instance. */
public class WarrenEnvironmentBuilder {

  static final BackOffDelayPolicy DEFAULT_BACK_OFF_DELAY_POLICY =
      BackOffDelayPolicy.fixedWithInitialDelay(Duration.ofSeconds(1), Duration.ofSeconds(5));

  private ExecutorService recoveryExecutorService;
  private Executor dispatchingExecutor;
  private MetricsCollector metricsCollector = NoOpMetricsCollector.INSTANCE;
  private Serializer serializer;
  private TypeNameSerializer typeNameSerializer = DefaultTypeNameSerializer.INSTANCE;
  private ConsumerErrorHandler errorHandler;
  private ConnectionFactory connectionFactory;
  private BackOffDelayPolicy backOffDelayPolicy = DEFAULT_BACK_OFF_DELAY_POLICY;

  public WarrenEnvironmentBuilder() {}

  /**
   * Set executor service used to run connection recovery.
   *
   * <p>The library uses sensible defaults, override only in case of problems.
   *
   * @param executorService the executor service
   * @return this builder instance
   */
  public WarrenEnvironmentBuilder recoveryExecutorService(ExecutorService executorService) {
    this.recoveryExecutorService = executorService;
    return this;
  }

  /**
   * Set the executor to use for inbound message dispatching.
   *
   * <p>It is the developer's responsibility to shut down the executor when it is no longer needed.
   *
   * @param executor the executor for inbound message dispatching
   * @return this builder instance
   */
  public WarrenEnvironmentBuilder dispatchingExecutor(Executor executor) {
    this.dispatchingExecutor = executor;
    return this;
  }

  /**
   * Set up a {@link MetricsCollector}.
   *
   * @param metricsCollector the metrics collector
   * @return this builder instance
   * @see io.warren.client.metrics.MicrometerMetricsCollector
   */
  public WarrenEnvironmentBuilder metricsCollector(MetricsCollector metricsCollector) {
    this.metricsCollector = metricsCollector;
    return this;
  }

  /**
   * Set the default {@link Serializer}. Default is JSON with Gson.
   *
   * @param serializer the serializer
   * @return this builder instance
   */
  public WarrenEnvironmentBuilder serializer(Serializer serializer) {
    this.serializer = serializer;
    return this;
  }

  public WarrenEnvironmentBuilder typeNameSerializer(TypeNameSerializer typeNameSerializer) {
    this.typeNameSerializer = typeNameSerializer;
    return this;
  }

  /**
   * Set the default {@link ConsumerErrorHandler}. Default logs the failure.
   *
   * @param errorHandler the error handler
   * @return this builder instance
   * @see PublishingConsumerErrorHandler
   */
  public WarrenEnvironmentBuilder errorHandler(ConsumerErrorHandler errorHandler) {
    this.errorHandler = errorHandler;
    return this;
  }

  /**
   * Set the factory of physical connections.
   *
   * <p>Default creates connections with the RabbitMQ Java client, using the credentials of each
   * durable connection.
   *
   * @param connectionFactory the connection factory
   * @return this builder instance
   */
  public WarrenEnvironmentBuilder connectionFactory(ConnectionFactory connectionFactory) {
    this.connectionFactory = connectionFactory;
    return this;
  }

  /**
   * Delay policy for connection recovery, when a durable connection does not set its own {@link
   * io.warren.client.RetryPolicy}.
   *
   * <p>Default is 1 second for the first attempt, then every 5 seconds, with no limit.
   *
   * @param backOffDelayPolicy the delay policy
   * @return this builder instance
   */
  public WarrenEnvironmentBuilder backOffDelayPolicy(BackOffDelayPolicy backOffDelayPolicy) {
    this.backOffDelayPolicy = backOffDelayPolicy;
    return this;
  }

  /**
   * Create the environment instance.
   *
   * @return the configured environment
   */
  public Environment build() {
    return new WarrenEnvironment(
        this.recoveryExecutorService,
        this.dispatchingExecutor,
        this.metricsCollector == null ? NoOpMetricsCollector.INSTANCE : this.metricsCollector,
        this.serializer == null ? new GsonSerializer() : this.serializer,
        this.typeNameSerializer == null
            ? DefaultTypeNameSerializer.INSTANCE
            : this.typeNameSerializer,
        this.errorHandler,
        this.connectionFactory,
        this.backOffDelayPolicy == null
            ? DEFAULT_BACK_OFF_DELAY_POLICY
            : this.backOffDelayPolicy);
  }
}
