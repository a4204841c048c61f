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

import io.warren.client.ConnectionFactory;
import io.warren.client.ConnectionHandle;
import io.warren.client.ConnectionKey;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Physical connections shared by durable connections with the same {@link ConnectionKey}.
 *
 * <p>At most one live handle is registered per key. Handles are reference-counted: the physical
 * connection is closed when the last durable connection releases it.
 */
final class SharedConnectionRegistry implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(SharedConnectionRegistry.class);

  private final Map<ConnectionKey, Lock> locks = new ConcurrentHashMap<>();
  private final Map<ConnectionKey, Entry> entries = new ConcurrentHashMap<>();

  ConnectionHandle getOrCreate(ConnectionKey key, ConnectionFactory factory) {
    Lock lock = lock(key);
    lock.lock();
    try {
      Entry entry = this.entries.get(key);
      if (entry != null && entry.handle.isOpen()) {
        entry.references++;
        LOGGER.debug("Reusing connection for {} ({} reference(s))", key, entry.references);
        return entry.handle;
      }
      if (entry != null) {
        LOGGER.debug("Registered connection for {} is no longer open, replacing it", key);
      }
      ConnectionHandle handle = factory.createConnection(key);
      if (handle == null) {
        throw new IllegalStateException("Connection factory returned no connection for " + key);
      }
      this.entries.put(key, new Entry(handle));
      LOGGER.debug("Registered new connection for {}", key);
      return handle;
    } finally {
      lock.unlock();
    }
  }

  boolean remove(ConnectionKey key, ConnectionHandle handle) {
    Lock lock = lock(key);
    lock.lock();
    try {
      Entry entry = this.entries.get(key);
      if (entry != null && entry.handle == handle) {
        this.entries.remove(key);
        LOGGER.debug("Removed connection for {} from registry", key);
        return true;
      }
      return false;
    } finally {
      lock.unlock();
    }
  }

  void release(ConnectionKey key, ConnectionHandle handle) {
    Lock lock = lock(key);
    lock.lock();
    try {
      Entry entry = this.entries.get(key);
      if (entry != null && entry.handle == handle) {
        entry.references--;
        if (entry.references > 0) {
          LOGGER.debug(
              "Released connection for {}, {} reference(s) left", key, entry.references);
          return;
        }
        this.entries.remove(key);
      }
    } finally {
      lock.unlock();
    }
    LOGGER.debug("Closing connection for {}", key);
    Utils.maybeClose(
        handle, e -> LOGGER.info("Error while closing connection for {}: {}", key, e.getMessage()));
  }

  ConnectionHandle get(ConnectionKey key) {
    Entry entry = this.entries.get(key);
    return entry == null ? null : entry.handle;
  }

  int size() {
    return this.entries.size();
  }

  @Override
  public void close() {
    List<ConnectionHandle> handles = new ArrayList<>();
    for (ConnectionKey key : new ArrayList<>(this.entries.keySet())) {
      Lock lock = lock(key);
      lock.lock();
      try {
        Entry entry = this.entries.remove(key);
        if (entry != null) {
          handles.add(entry.handle);
        }
      } finally {
        lock.unlock();
      }
    }
    for (ConnectionHandle handle : handles) {
      Utils.maybeClose(
          handle, e -> LOGGER.info("Error while closing connection: {}", e.getMessage()));
    }
  }

  private Lock lock(ConnectionKey key) {
    return this.locks.computeIfAbsent(key, k -> new ReentrantLock());
  }

  private static final class Entry {

    private final ConnectionHandle handle;
    private int references = 1;

    private Entry(ConnectionHandle handle) {
      this.handle = handle;
    }
  }
}
