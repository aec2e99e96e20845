package com.blackhole.sweeper.model;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/** Read-only table of channel overrides, built once at startup and shared by every producer. */
public final class ChannelPolicies {

  private static final ChannelPolicies EMPTY = new ChannelPolicies(Map.of());

  private final Map<String, ChannelPolicy> byChannelId;

  private ChannelPolicies(Map<String, ChannelPolicy> byChannelId) {
    this.byChannelId = byChannelId;
  }

  public static ChannelPolicies empty() {
    return EMPTY;
  }

  /** Later policies for the same channel id replace earlier ones. */
  public static ChannelPolicies of(Collection<ChannelPolicy> policies) {
    final Map<String, ChannelPolicy> map = new LinkedHashMap<>();
    for (ChannelPolicy policy : policies) {
      map.put(policy.channelId(), policy);
    }
    return new ChannelPolicies(Map.copyOf(map));
  }

  public Optional<ChannelPolicy> find(String channelId) {
    if (channelId == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(byChannelId.get(channelId));
  }

  public int size() {
    return byChannelId.size();
  }
}
