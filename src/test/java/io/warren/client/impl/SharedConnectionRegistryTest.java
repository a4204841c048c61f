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

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.warren.client.ConnectionFactory;
import io.warren.client.ConnectionHandle;
import io.warren.client.ConnectionKey;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class SharedConnectionRegistryTest {

  static final ConnectionKey KEY = new ConnectionKey("localhost", 5672, "/", "guest");
  static final ConnectionKey OTHER_KEY = new ConnectionKey("localhost", 5672, "orders", "guest");

  SharedConnectionRegistry registry;
  ConnectionFactory factory;
  ConnectionHandle handle;

  @BeforeEach
  void init() {
    registry = new SharedConnectionRegistry();
    factory = mock(ConnectionFactory.class);
    handle = mock(ConnectionHandle.class);
    when(handle.isOpen()).thenReturn(true);
  }

  @Test
  void getOrCreateShouldReuseOpenConnection() {
    when(factory.createConnection(KEY)).thenReturn(handle);
    assertThat(registry.getOrCreate(KEY, factory)).isSameAs(handle);
    assertThat(registry.getOrCreate(KEY, factory)).isSameAs(handle);
    verify(factory, times(1)).createConnection(KEY);
    assertThat(registry.size()).isEqualTo(1);
    assertThat(registry.get(KEY)).isSameAs(handle);
  }

  @Test
  void getOrCreateShouldReplaceClosedConnection() {
    ConnectionHandle newHandle = mock(ConnectionHandle.class);
    when(factory.createConnection(KEY)).thenReturn(handle, newHandle);
    registry.getOrCreate(KEY, factory);
    when(handle.isOpen()).thenReturn(false);
    assertThat(registry.getOrCreate(KEY, factory)).isSameAs(newHandle);
    assertThat(registry.get(KEY)).isSameAs(newHandle);
  }

  @Test
  void removeShouldOnlyDropRegisteredHandle() {
    when(factory.createConnection(KEY)).thenReturn(handle);
    registry.getOrCreate(KEY, factory);
    assertThat(registry.remove(KEY, mock(ConnectionHandle.class))).isFalse();
    assertThat(registry.size()).isEqualTo(1);
    assertThat(registry.remove(KEY, handle)).isTrue();
    assertThat(registry.size()).isZero();
    verify(handle, never()).close();
  }

  @Test
  void releaseShouldCloseConnectionWhenLastReferenceIsGone() {
    when(factory.createConnection(KEY)).thenReturn(handle);
    registry.getOrCreate(KEY, factory);
    registry.getOrCreate(KEY, factory);

    registry.release(KEY, handle);
    verify(handle, never()).close();
    assertThat(registry.size()).isEqualTo(1);

    registry.release(KEY, handle);
    verify(handle, times(1)).close();
    assertThat(registry.size()).isZero();
  }

  @Test
  void closeShouldCloseAllConnections() {
    ConnectionHandle otherHandle = mock(ConnectionHandle.class);
    when(factory.createConnection(KEY)).thenReturn(handle);
    when(factory.createConnection(OTHER_KEY)).thenReturn(otherHandle);
    registry.getOrCreate(KEY, factory);
    registry.getOrCreate(OTHER_KEY, factory);

    registry.close();

    verify(handle, times(1)).close();
    verify(otherHandle, times(1)).close();
    assertThat(registry.size()).isZero();
  }

  @Test
  void slowCreationShouldNotBlockOtherKeys() throws Exception {
    CountDownLatch creationStarted = new CountDownLatch(1);
    CountDownLatch releaseCreation = new CountDownLatch(1);
    AtomicInteger creations = new AtomicInteger();
    ConnectionFactory slowFactory =
        key -> {
          creations.incrementAndGet();
          if (key.equals(KEY)) {
            creationStarted.countDown();
            try {
              releaseCreation.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
              Thread.currentThread().interrupt();
            }
          }
          ConnectionHandle h = mock(ConnectionHandle.class);
          when(h.isOpen()).thenReturn(true);
          return h;
        };
    ExecutorService executor = Executors.newSingleThreadExecutor();
    try {
      Future<ConnectionHandle> slow = executor.submit(() -> registry.getOrCreate(KEY, slowFactory));
      assertThat(creationStarted.await(10, TimeUnit.SECONDS)).isTrue();
      assertThat(registry.getOrCreate(OTHER_KEY, slowFactory)).isNotNull();
      releaseCreation.countDown();
      assertThat(slow.get(10, TimeUnit.SECONDS)).isNotNull();
      assertThat(creations.get()).isEqualTo(2);
      assertThat(registry.size()).isEqualTo(2);
    } finally {
      executor.shutdownNow();
    }
  }
}
