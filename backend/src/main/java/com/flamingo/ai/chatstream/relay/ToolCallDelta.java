package com.flamingo.ai.chatstream.relay;

/**
 * Fragment of a tool call streamed by the provider. The id and name arrive with the first fragment
 * of an index; arguments arrive in pieces.
 */
public record ToolCallDelta(int index, String id, String name, String arguments) {}
