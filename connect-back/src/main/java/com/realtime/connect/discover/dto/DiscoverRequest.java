package com.realtime.connect.discover.dto;

import jakarta.validation.constraints.Size;

public record DiscoverRequest(@Size(max = 32) String mood) {}
