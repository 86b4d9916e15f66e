package com.turnqueue.message;

import java.util.List;
import java.util.Objects;

/**
 * A structured message made of formatted text runs.
 * Messages are plain values; rendering them is left to whoever consumes them.
 *
 * @param kind the purpose of the message
 * @param importance how prominently the message should be shown
 * @param hidden whether the message is hidden from the player
 * @param contents the text runs, in display order
 */
public record Message(Kind kind, Importance importance, boolean hidden, List<Text> contents) {

    public Message {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(importance, "importance");
        contents = List.copyOf(contents);
    }

    /**
     * A message for display to the player, with normal importance and not hidden.
     *
     * @param contents the text runs
     * @return the message
     */
    public static Message normal(List<Text> contents) {
        return new Message(Kind.DISPLAY, Importance.NORMAL, false, contents);
    }

    /**
     * @see #normal(List)
     */
    public static Message normal(Text... contents) {
        return normal(List.of(contents));
    }

    /**
     * Renders the message without formatting. Every text run is followed by a single space.
     *
     * @return the plain text of the message
     */
    public String plainText() {
        StringBuilder sb = new StringBuilder();
        for (Text text : contents) {
            sb.append(text.text()).append(' ');
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "Message[kind=" + kind +
                ", importance=" + importance +
                ", hidden=" + hidden +
                ", text=" + plainText().stripTrailing() + "]";
    }
}
