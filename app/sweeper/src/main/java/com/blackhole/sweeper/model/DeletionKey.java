package com.blackhole.sweeper.model;

public record DeletionKey(ItemKind kind, String channelId, String itemId) {}
