package io.github.ledgersync.stream;

import java.util.Objects;

/**
 * One event received over a server-sent-event stream.
 */
public final class StreamMessage {

    /** event name used when the server does not send one */
    public static final String DEFAULT_EVENT = "message";

    private final String event;
    private final String data;
    private final String id;

    /**
     * Creates a new stream message.
     *
     * @param event the event name
     * @param data  the event payload, multi-line data joined with newlines
     * @param id    the event id, may be null
     */
    public StreamMessage(String event, String data, String id) {
        this.event = event;
        this.data = data;
        this.id = id;
    }

    public String getEvent() {
        return event;
    }

    public String getData() {
        return data;
    }

    public String getId() {
        return id;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StreamMessage that = (StreamMessage) o;
        return Objects.equals(event, that.event) &&
                Objects.equals(data, that.data) &&
                Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(event, data, id);
    }

    @Override
    public String toString() {
        return "StreamMessage{" +
                "event='" + event + '\'' +
                ", data='" + data + '\'' +
                ", id='" + id + '\'' +
                '}';
    }
}
