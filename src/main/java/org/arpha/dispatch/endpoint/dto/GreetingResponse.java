package org.arpha.dispatch.endpoint.dto;

import java.util.List;

public record GreetingResponse(String method, List<String> greetings) {
}
