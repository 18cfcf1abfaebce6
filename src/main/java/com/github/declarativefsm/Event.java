package com.github.declarativefsm;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.github.declarativefsm.StateMachineException.Code;

/**
 * Something that happened to the subject of a state machine. Transitions are looked up by
 * {@link #getType()} alone, exactly and case-sensitively; the payload rides along for actions and
 * listeners that care about it.
 */
public final class Event {
  private final String type;
  private final Map<String, Object> payload;

  public static Event of(final String type) throws StateMachineException {
    return new Event(type, Collections.<String, Object>emptyMap());
  }

  public static Event of(final String type, final Map<String, Object> payload)
      throws StateMachineException {
    return new Event(type, payload);
  }

  public String getType() {
    return type;
  }

  public Map<String, Object> getPayload() {
    return payload;
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = 1;
    result = prime * result + type.hashCode();
    result = prime * result + payload.hashCode();
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null) {
      return false;
    }
    if (getClass() != obj.getClass()) {
      return false;
    }
    Event other = (Event) obj;
    return type.equals(other.type) && payload.equals(other.payload);
  }

  @Override
  public String toString() {
    return "Event [type=" + type + ", payload=" + payload + "]";
  }

  private Event(final String type, final Map<String, Object> payload)
      throws StateMachineException {
    if (type == null || type.trim().isEmpty()) {
      throw new StateMachineException(Code.INVALID_EVENT);
    }
    this.type = type;
    if (payload == null || payload.isEmpty()) {
      this.payload = Collections.emptyMap();
    } else {
      this.payload = Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }
  }

}
