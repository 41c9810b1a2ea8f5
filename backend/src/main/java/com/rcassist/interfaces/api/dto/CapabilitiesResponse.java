package com.rcassist.interfaces.api.dto;

import java.util.List;

public record CapabilitiesResponse(List<String> values, String defaultValue) {}
