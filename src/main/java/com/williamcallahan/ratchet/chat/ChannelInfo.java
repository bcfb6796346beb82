package com.williamcallahan.ratchet.chat;

public record ChannelInfo(String id, String name) {}
