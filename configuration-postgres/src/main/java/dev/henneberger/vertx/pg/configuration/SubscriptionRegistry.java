/*
 * Copyright (C) 2026 Daniel Henneberger
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.henneberger.vertx.pg.configuration;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Live listeners keyed by channel, with a subscription id index. A channel holds at most one live
 * listener: registering a second one cancels and forgets the first. All access is serialized on this
 * instance.
 */
final class SubscriptionRegistry<L extends ChannelListener> {

  private final Map<String, L> byChannel = new HashMap<>();
  private final Map<String, String> channelById = new HashMap<>();
  private boolean closed;

  /**
   * Registers {@code listener} as the live listener of its channel.
   *
   * @return the superseded listener, already cancelled
   * @throws IllegalStateException when the registry was closed
   */
  synchronized Optional<L> register(L listener) {
    Objects.requireNonNull(listener, "listener");
    if (closed) {
      throw new IllegalStateException("subscription registry is closed");
    }
    if (channelById.containsKey(listener.subscriptionId())) {
      throw new IllegalArgumentException("duplicate subscription id " + listener.subscriptionId());
    }

    L previous = byChannel.put(listener.channel(), listener);
    if (previous != null) {
      channelById.remove(previous.subscriptionId());
      previous.cancel();
    }
    channelById.put(listener.subscriptionId(), listener.channel());
    return Optional.ofNullable(previous);
  }

  /**
   * Removes and cancels the listener registered under {@code subscriptionId}, if any.
   */
  synchronized Optional<L> remove(String subscriptionId) {
    String channel = channelById.remove(subscriptionId);
    if (channel == null) {
      return Optional.empty();
    }
    L listener = byChannel.remove(channel);
    if (listener != null) {
      listener.cancel();
    }
    return Optional.ofNullable(listener);
  }

  /**
   * Forgets {@code listener} if it is still the one registered for its channel. Used when a listener
   * stops on its own.
   */
  synchronized boolean discard(L listener) {
    if (byChannel.get(listener.channel()) != listener) {
      return false;
    }
    byChannel.remove(listener.channel());
    channelById.remove(listener.subscriptionId());
    return true;
  }

  synchronized Optional<L> find(String subscriptionId) {
    String channel = channelById.get(subscriptionId);
    return channel == null ? Optional.empty() : Optional.ofNullable(byChannel.get(channel));
  }

  synchronized int size() {
    return byChannel.size();
  }

  /**
   * Cancels every listener and rejects further registrations.
   */
  synchronized List<L> cancelAll() {
    closed = true;
    List<L> listeners = new ArrayList<>(byChannel.values());
    byChannel.clear();
    channelById.clear();
    for (L listener : listeners) {
      listener.cancel();
    }
    return listeners;
  }
}
