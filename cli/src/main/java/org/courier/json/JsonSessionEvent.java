package org.courier.json;

/**
 * One line of daemon output.
 *
 * @param event  {@code received}, {@code sent}, {@code acknowledged}, {@code contactActivated} or {@code halted}
 */
public record JsonSessionEvent(String event, Object payload) {}
